/* (C)2026 */
package com.ammann.imputation.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.imputation.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MeasuredParameterTest {

    @ParameterizedTest
    @ValueSource(strings = {"pm25", "PM25", " Pm25 "})
    void resolvesKeyCaseInsensitively(String name) {
        assertThat(MeasuredParameter.fromName(name)).isEqualTo(MeasuredParameter.PM25);
    }

    @Test
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> MeasuredParameter.fromName("ozone")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> MeasuredParameter.fromName(" ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void clampsIntoPhysicalRange() {
        assertThat(MeasuredParameter.PM25.clamp(-3.0)).isZero();
        assertThat(MeasuredParameter.RH.clamp(104.0)).isEqualTo(100.0);
        assertThat(MeasuredParameter.TEMP.clamp(-12.5)).isEqualTo(-12.5);
        assertThat(MeasuredParameter.BP.isWithinRange(400.0)).isFalse();
    }

    @Test
    void durationClassBoundariesAreInclusive() {
        assertThat(DurationClass.fromHours(3, 3, 24)).isEqualTo(DurationClass.SHORT);
        assertThat(DurationClass.fromHours(24, 3, 24)).isEqualTo(DurationClass.MEDIUM);
        assertThat(DurationClass.fromHours(25, 3, 24)).isEqualTo(DurationClass.LONG);
        assertThat(DurationClass.LONG.isFillable()).isFalse();
    }

    @Test
    void rejectedModelsAreNeverUsable() {
        assertThat(CertificationStatus.PENDING.isUsable(false)).isTrue();
        assertThat(CertificationStatus.PENDING.isUsable(true)).isFalse();
        assertThat(CertificationStatus.CERTIFIED.isUsable(true)).isTrue();
        assertThat(CertificationStatus.REJECTED.isUsable(false)).isFalse();
    }
}
