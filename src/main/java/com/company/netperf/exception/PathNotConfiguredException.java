package com.company.netperf.exception;

public class PathNotConfiguredException extends RuntimeException {
    public PathNotConfiguredException(String source, String dest) {
        super("Network path not configured: " + source + " -> " + dest);
    }
}
