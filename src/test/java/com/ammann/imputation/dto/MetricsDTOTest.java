/* (C)2026 */
package com.ammann.imputation.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class MetricsDTOTest {

    @Test
    void computesErrorsAndExplainedVariance() {
        MetricsDTO metrics = MetricsDTO.compute(new double[] {1.0, 2.0, 3.0, 4.0}, new double[] {1.0, 2.0, 3.0, 6.0});

        assertThat(metrics.samples()).isEqualTo(4);
        assertThat(metrics.rmse()).isCloseTo(1.0, within(1e-12));
        assertThat(metrics.mae()).isCloseTo(0.5, within(1e-12));
        // SS_res = 4, SS_tot = 5
        assertThat(metrics.r2()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void constantTruthGivesBinaryR2() {
        assertThat(MetricsDTO.compute(new double[] {2.0, 2.0}, new double[] {2.0, 2.0}).r2()).isEqualTo(1.0);
        assertThat(MetricsDTO.compute(new double[] {2.0, 2.0}, new double[] {2.5, 2.0}).r2()).isZero();
    }

    @Test
    void emptyInputYieldsNaN() {
        MetricsDTO metrics = MetricsDTO.compute(new double[0], new double[0]);

        assertThat(metrics.samples()).isZero();
        assertThat(metrics.rmse()).isNaN();
    }

    @Test
    void rejectsMismatchedLengths() {
        assertThatThrownBy(() -> MetricsDTO.compute(new double[1], new double[2]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
