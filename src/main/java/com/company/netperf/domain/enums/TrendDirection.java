package com.company.netperf.domain.enums;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    UNKNOWN;

    public String getValue() {
        return name().toLowerCase();
    }
}
