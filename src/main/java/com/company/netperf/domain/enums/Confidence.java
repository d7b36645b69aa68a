package com.company.netperf.domain.enums;

public enum Confidence {
    LOW,
    MEDIUM,
    HIGH
}
