package com.company.netperf.domain;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * Round-trip statistics of one latency probe.
 * loss_pct = 100 with every other field at zero means the probe itself failed.
 */
@Value
@Builder
public class PingStats implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final double TOTAL_LOSS_PCT = 100.0;

    double minMs;
    double avgMs;
    double maxMs;
    double mdevMs; // jitter
    double lossPct;

    public static PingStats failed() {
        return PingStats.builder()
                .lossPct(TOTAL_LOSS_PCT)
                .build();
    }

    public boolean isProbeFailure() {
        return lossPct >= TOTAL_LOSS_PCT;
    }
}
