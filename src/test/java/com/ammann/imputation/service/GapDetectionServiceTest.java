/* (C)2026 */
package com.ammann.imputation.service;

import static com.ammann.imputation.support.TestDataFactory.STATION;
import static com.ammann.imputation.support.TestDataFactory.hour;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.imputation.config.ImputationSettings;
import com.ammann.imputation.dto.GapDTO;
import com.ammann.imputation.enumeration.DurationClass;
import com.ammann.imputation.enumeration.MeasuredParameter;
import com.ammann.imputation.exception.ValidationException;
import com.ammann.imputation.support.InMemoryReadingStore;
import com.ammann.imputation.support.TestDataFactory;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Unit tests for {@link GapDetectionService}.
 */
class GapDetectionServiceTest {

    private InMemoryReadingStore store;
    private GapDetectionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryReadingStore();
        service = new GapDetectionService(store, ImputationSettings.defaults());
    }

    static Stream<Arguments> gapLengths() {
        return Stream.of(
                Arguments.of(1, DurationClass.SHORT),
                Arguments.of(3, DurationClass.SHORT),
                Arguments.of(4, DurationClass.MEDIUM),
                Arguments.of(24, DurationClass.MEDIUM),
                Arguments.of(25, DurationClass.LONG),
                Arguments.of(48, DurationClass.LONG));
    }

    @ParameterizedTest
    @MethodSource("gapLengths")
    void classifiesGapByInclusiveLength(int length, DurationClass expected) {
        store.addSeries(STATION, MeasuredParameter.PM25,
                TestDataFactory.withGap(TestDataFactory.constant(100, 10.0), 20, length));

        List<GapDTO> gaps = service.detectGaps(STATION, hour(0), hour(99)).stream().toList();

        assertThat(gaps).hasSize(1);
        GapDTO gap = gaps.get(0);
        assertThat(gap.start()).isEqualTo(hour(20));
        assertThat(gap.end()).isEqualTo(hour(20 + length - 1));
        assertThat(gap.hours()).isEqualTo(length);
        assertThat(gap.durationClass()).isEqualTo(expected);
    }

    @Test
    void acceptanceSeriesHasOneMediumGap() {
        store.addSeries(STATION, MeasuredParameter.PM25,
                TestDataFactory.withGap(TestDataFactory.noisyConstant(200, 50.0, 1.0, 7L), 150, 6));

        List<GapDTO> gaps = service.detectGaps(STATION, hour(0), hour(199)).stream().toList();

        assertThat(gaps).containsExactly(new GapDTO(STATION, MeasuredParameter.PM25, hour(150), hour(155), 6,
                DurationClass.MEDIUM));
        assertThat(gaps.get(0).missingHours()).hasSize(6).startsWith(hour(150)).endsWith(hour(155));
    }

    @Test
    void reportsGapsAtRangeEdgesAndKeepsOrder() {
        Map<Instant, Double> series = TestDataFactory.constant(50, 10.0);
        series = TestDataFactory.withGap(series, 0, 2);
        series = TestDataFactory.withGap(series, 10, 5);
        series = TestDataFactory.withGap(series, 47, 3);
        store.addSeries(STATION, MeasuredParameter.PM25, series);

        List<GapDTO> gaps = service.detectGaps(STATION, hour(0), hour(49)).stream().toList();

        assertThat(gaps).extracting(GapDTO::start).containsExactly(hour(0), hour(10), hour(47));
        assertThat(gaps).extracting(GapDTO::hours).containsExactly(2L, 5L, 3L);
        assertThat(gaps).extracting(GapDTO::durationClass)
                .containsExactly(DurationClass.SHORT, DurationClass.MEDIUM, DurationClass.SHORT);
    }

    @Test
    void scanIsRestartable() {
        store.addSeries(STATION, MeasuredParameter.PM25,
                TestDataFactory.withGap(TestDataFactory.constant(40, 10.0), 5, 2));

        GapScan scan = service.detectGaps(STATION, hour(0), hour(39));

        assertThat(scan.stream().toList()).isEqualTo(scan.stream().toList());
        assertThat(scan).hasSize(1);
    }

    @Test
    void imputedValuesCountAsPresent() {
        store.addSeries(STATION, MeasuredParameter.PM25,
                TestDataFactory.withGap(TestDataFactory.constant(30, 10.0), 10, 3));
        store.upsertReading(STATION, hour(11), Collections.singletonMap(MeasuredParameter.PM25, 9.5), true,
                STATION + "/pm25/v1");

        List<GapDTO> gaps = service.detectGaps(STATION, hour(0), hour(29)).stream().toList();

        assertThat(gaps).extracting(GapDTO::start).containsExactly(hour(10), hour(12));
        assertThat(gaps).allSatisfy(gap -> assertThat(gap.hours()).isEqualTo(1));
    }

    @Test
    void otherParametersDoNotHideGaps() {
        store.addSeries(STATION, MeasuredParameter.PM25, TestDataFactory.withGap(TestDataFactory.constant(20, 10.0), 4, 2));
        store.addSeries(STATION, MeasuredParameter.TEMP, TestDataFactory.constant(20, 21.0));

        assertThat(service.detectGaps(STATION, MeasuredParameter.PM25, hour(0), hour(19))).hasSize(1);
        assertThat(service.detectGaps(STATION, MeasuredParameter.TEMP, hour(0), hour(19))).isEmpty();
    }

    @Test
    void truncatesBoundsToTheHour() {
        store.addSeries(STATION, MeasuredParameter.PM25, TestDataFactory.constant(10, 10.0));

        GapScan scan = service.detectGaps(STATION, hour(2).plusSeconds(1800), hour(5).plusSeconds(59));

        assertThat(scan.start()).isEqualTo(hour(2));
        assertThat(scan.end()).isEqualTo(hour(5));
        assertThat(scan).isEmpty();
    }

    @Test
    void rejectsReversedRange() {
        store.addStation(STATION);

        assertThatThrownBy(() -> service.detectGaps(STATION, hour(10), hour(2)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("end");
    }

    @Test
    void rejectsUnknownStation() {
        assertThatThrownBy(() -> service.detectGaps("nope", hour(0), hour(2)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("nope");
    }
}
