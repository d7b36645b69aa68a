package com.company.netperf.domain.enums;

public enum PathType {
    DIRECT,
    SWITCH,
    NFS,
    UNKNOWN;

    public String getValue() {
        return name().toLowerCase();
    }

    public static PathType fromString(String pathType) {
        if (pathType == null) {
            return UNKNOWN;
        }
        try {
            return PathType.valueOf(pathType.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
