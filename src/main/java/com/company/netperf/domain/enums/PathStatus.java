package com.company.netperf.domain.enums;

import com.company.netperf.domain.HealthThresholds;
import com.company.netperf.domain.PingStats;
import com.company.netperf.domain.ThroughputStats;

public enum PathStatus {
    HEALTHY,
    DEGRADED,
    ERROR,
    UNKNOWN;

    public String getValue() {
        return name().toLowerCase();
    }

    /**
     * Healthy when loss, latency and jitter are within limits and the hot-cache
     * rate (if measured) reaches the minimum; degraded when unhealthy but loss
     * stays under the error limit; error otherwise.
     */
    public static PathStatus derive(PingStats ping, ThroughputStats hot, HealthThresholds thresholds) {
        if (isHealthy(ping, hot, thresholds)) {
            return HEALTHY;
        }
        if (ping != null && ping.getLossPct() < thresholds.getErrorLossPct()) {
            return DEGRADED;
        }
        return ERROR;
    }

    public static PathStatus derive(PingStats ping, ThroughputStats hot) {
        return derive(ping, hot, HealthThresholds.defaults());
    }

    private static boolean isHealthy(PingStats ping, ThroughputStats hot, HealthThresholds thresholds) {
        if (ping == null) {
            return false;
        }
        if (ping.getLossPct() > thresholds.getMaxLossPct()) return false;
        if (ping.getAvgMs() > thresholds.getMaxAvgMs()) return false;
        if (ping.getMdevMs() > thresholds.getMaxJitterMs()) return false;
        return hot == null || hot.getRateMbps() >= thresholds.getMinThroughputMbps();
    }

    public static PathStatus fromString(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        try {
            return PathStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
