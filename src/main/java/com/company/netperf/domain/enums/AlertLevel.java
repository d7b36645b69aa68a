package com.company.netperf.domain.enums;

public enum AlertLevel {
    NORMAL,
    WARNING,
    CRITICAL
}
