package com.company.netperf.service;

import lombok.Builder;
import lombok.Value;

/**
 * Threshold tiers of the cause rules. High tiers yield high-confidence causes,
 * medium tiers medium-confidence ones.
 */
@Value
@Builder
public class DiagnosticThresholds {
    @Builder.Default double lossHighPct = 5.0;
    @Builder.Default double lossMediumPct = 1.0;
    @Builder.Default double latencyHighMs = 100.0;
    @Builder.Default double latencyMediumMs = 50.0;
    @Builder.Default double jitterHighMs = 20.0;
    @Builder.Default long retransHigh = 100;
    @Builder.Default long retransMedium = 10;
    @Builder.Default double lowThroughputMbps = 100.0;
    @Builder.Default double businessDropHighRatio = 0.30;
    @Builder.Default double businessDropMediumRatio = 0.15;

    public static DiagnosticThresholds defaults() {
        return DiagnosticThresholds.builder().build();
    }
}
