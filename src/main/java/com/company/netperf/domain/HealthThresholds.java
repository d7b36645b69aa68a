package com.company.netperf.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Limits of the healthy-path predicate used to derive a record's status.
 */
@Value
@Builder
public class HealthThresholds {

    @Builder.Default
    double maxLossPct = 1.0;

    @Builder.Default
    double maxAvgMs = 50.0;

    @Builder.Default
    double maxJitterMs = 20.0;

    @Builder.Default
    double minThroughputMbps = 100.0;

    // below this loss an unhealthy path is degraded, at or above it is an error
    @Builder.Default
    double errorLossPct = 10.0;

    public static HealthThresholds defaults() {
        return HealthThresholds.builder().build();
    }
}
