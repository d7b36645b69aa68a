package com.company.netperf.domain.enums;

import com.company.netperf.domain.HealthThresholds;
import com.company.netperf.domain.PingStats;
import com.company.netperf.domain.ThroughputStats;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PathStatusTest {

    private static PingStats ping(double lossPct, double avgMs, double mdevMs) {
        return PingStats.builder().lossPct(lossPct).avgMs(avgMs).mdevMs(mdevMs).build();
    }

    private static ThroughputStats hot(double rateMbps) {
        return ThroughputStats.builder().rateMbps(rateMbps).durationSec(1).build();
    }

    @Test
    void healthyWhenAllMetricsWithinLimits() {
        assertThat(PathStatus.derive(ping(0.5, 10, 5), hot(500))).isEqualTo(PathStatus.HEALTHY);
    }

    @Test
    void healthyWithoutHotMeasurement() {
        assertThat(PathStatus.derive(ping(0, 10, 5), null)).isEqualTo(PathStatus.HEALTHY);
    }

    @Test
    void degradedWhenLossModerate() {
        assertThat(PathStatus.derive(ping(3, 10, 0), null)).isEqualTo(PathStatus.DEGRADED);
    }

    @Test
    void degradedWhenThroughputLow() {
        assertThat(PathStatus.derive(ping(0, 10, 5), hot(99.9))).isEqualTo(PathStatus.DEGRADED);
    }

    @Test
    void degradedWhenLatencyOrJitterHigh() {
        assertThat(PathStatus.derive(ping(0, 51, 0), null)).isEqualTo(PathStatus.DEGRADED);
        assertThat(PathStatus.derive(ping(0, 10, 21), null)).isEqualTo(PathStatus.DEGRADED);
    }

    @Test
    void errorWhenLossHigh() {
        assertThat(PathStatus.derive(ping(20, 10, 0), null)).isEqualTo(PathStatus.ERROR);
        assertThat(PathStatus.derive(PingStats.failed(), null)).isEqualTo(PathStatus.ERROR);
    }

    @Test
    void errorWithoutPing() {
        assertThat(PathStatus.derive(null, hot(900))).isEqualTo(PathStatus.ERROR);
    }

    @Test
    void boundaryValuesAreStillHealthy() {
        assertThat(PathStatus.derive(ping(1.0, 50, 20), hot(100))).isEqualTo(PathStatus.HEALTHY);
    }

    @Test
    void customThresholdsApply() {
        HealthThresholds strict = HealthThresholds.builder()
                .maxLossPct(0).maxAvgMs(1).maxJitterMs(1).minThroughputMbps(1000).errorLossPct(1)
                .build();

        assertThat(PathStatus.derive(ping(0, 10, 0), null, strict)).isEqualTo(PathStatus.DEGRADED);
        assertThat(PathStatus.derive(ping(2, 0.5, 0), null, strict)).isEqualTo(PathStatus.ERROR);
    }

    @Test
    void fromStringIsLenient() {
        assertThat(PathStatus.fromString("Degraded")).isEqualTo(PathStatus.DEGRADED);
        assertThat(PathStatus.fromString("bogus")).isEqualTo(PathStatus.UNKNOWN);
        assertThat(PathStatus.fromString(null)).isEqualTo(PathStatus.UNKNOWN);
    }
}
