package com.company.netperf.domain;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Result of one bulk transfer (or the average of several).
 */
@Value
@Builder(toBuilder = true)
public class ThroughputStats implements Serializable {
    private static final long serialVersionUID = 1L;

    long bytesTransferred;
    double rateMbps;
    double durationSec;
    long tcpRetrans;

    // true when duration was assumed rather than timed
    boolean estimated;

    /**
     * Rate in megabits per second: bytes * 8 / duration / 1e6.
     */
    public static ThroughputStats fromTransfer(long bytes, double durationSec) {
        if (durationSec <= 0) {
            throw new IllegalArgumentException("Transfer duration must be positive: " + durationSec);
        }
        return ThroughputStats.builder()
                .bytesTransferred(bytes)
                .rateMbps(bytes * 8.0 / durationSec / 1_000_000.0)
                .durationSec(durationSec)
                .build();
    }

    /**
     * Arithmetic mean of rate and duration; bytes use integer division.
     */
    public static ThroughputStats average(List<ThroughputStats> runs) {
        if (runs == null || runs.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty list of runs");
        }

        long totalBytes = 0;
        double totalRate = 0;
        double totalDuration = 0;
        for (ThroughputStats run : runs) {
            totalBytes += run.getBytesTransferred();
            totalRate += run.getRateMbps();
            totalDuration += run.getDurationSec();
        }

        int n = runs.size();
        return ThroughputStats.builder()
                .bytesTransferred(totalBytes / n)
                .rateMbps(totalRate / n)
                .durationSec(totalDuration / n)
                .build();
    }
}
