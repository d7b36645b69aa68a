package com.company.netperf.service;

import com.company.netperf.domain.TimeSeriesPoint;
import com.company.netperf.domain.enums.AlertLevel;
import com.company.netperf.domain.enums.TrendDirection;
import com.company.netperf.dto.response.TrendResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrendAnalyzerTest {

    private static final Instant START = Instant.parse("2024-03-04T00:00:00Z");

    private final TrendAnalyzer analyzer = new TrendAnalyzer(100, 0.05, 0.20, 0.50);

    private static List<TimeSeriesPoint> hourly(double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new TimeSeriesPoint(START.plus(Duration.ofHours(i)), values[i]));
        }
        return points;
    }

    @Test
    void emptyInputIsUnknown() {
        TrendResult result = analyzer.analyze(List.of());

        assertThat(result.getTrend()).isEqualTo(TrendDirection.UNKNOWN);
        assertThat(result.getCurrent()).isNull();
        assertThat(result.getAlertLevel()).isEqualTo(AlertLevel.NORMAL);
    }

    @Test
    void singleSampleIsUnknownWithCurrentValue() {
        TrendResult result = analyzer.analyze(hourly(42.0));

        assertThat(result.getTrend()).isEqualTo(TrendDirection.UNKNOWN);
        assertThat(result.getCurrent()).isEqualTo(42.0);
        assertThat(result.getFirstDerivative()).isNull();
    }

    @Test
    void samplesAtSameInstantAreUnknown() {
        List<TimeSeriesPoint> points = List.of(
                new TimeSeriesPoint(START, 10.0), new TimeSeriesPoint(START, 20.0));

        assertThat(analyzer.analyze(points).getTrend()).isEqualTo(TrendDirection.UNKNOWN);
    }

    @Test
    void steadyDeclineIsDecreasingWithNegativeSlopePerHour() {
        TrendResult result = analyzer.analyze(hourly(1000, 900, 800, 700, 600));

        assertThat(result.getTrend()).isEqualTo(TrendDirection.DECREASING);
        assertThat(result.getFirstDerivative()).isCloseTo(-100.0, within(1e-9));
        assertThat(result.getCurrent()).isEqualTo(600.0);
        // 400 over a mean of 800
        assertThat(result.getAlertLevel()).isEqualTo(AlertLevel.CRITICAL);
    }

    @Test
    void moderateRiseIsIncreasingWarning() {
        TrendResult result = analyzer.analyze(hourly(10, 11, 12, 13));

        assertThat(result.getTrend()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.getAlertLevel()).isEqualTo(AlertLevel.WARNING);
    }

    @Test
    void smallWobbleIsStable() {
        TrendResult result = analyzer.analyze(hourly(500, 502, 499, 501, 500));

        assertThat(result.getTrend()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getAlertLevel()).isEqualTo(AlertLevel.NORMAL);
    }

    @Test
    void inputOrderDoesNotMatter() {
        List<TimeSeriesPoint> points = hourly(1000, 900, 800, 700, 600);
        List<TimeSeriesPoint> newestFirst = new ArrayList<>(points);
        Collections.reverse(newestFirst);

        assertThat(analyzer.analyze(newestFirst)).isEqualTo(analyzer.analyze(points));
    }

    @Test
    void zeroAndMissingValuesAreSkipped() {
        List<TimeSeriesPoint> points = new ArrayList<>(hourly(100, 100, 100));
        points.add(new TimeSeriesPoint(START.plus(Duration.ofHours(3)), 0.0));
        points.add(new TimeSeriesPoint(START.plus(Duration.ofHours(4)), null));
        points.add(new TimeSeriesPoint(null, 5.0));

        TrendResult result = analyzer.analyze(points);

        assertThat(result.getTrend()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.getCurrent()).isEqualTo(100.0);
    }

    @Test
    void onlyMostRecentWindowIsUsed() {
        TrendAnalyzer small = new TrendAnalyzer(3, 0.05, 0.20, 0.50);

        // early decline falls outside the window
        TrendResult result = small.analyze(hourly(900, 500, 100, 100, 100));

        assertThat(result.getTrend()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void windowMustHoldTwoSamples() {
        assertThatThrownBy(() -> new TrendAnalyzer(1, 0.05, 0.2, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
