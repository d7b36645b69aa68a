package com.company.netperf.dto.response;

import com.company.netperf.domain.enums.PathStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnosis of one network path, computed on request and never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkDiagnostic {
    public static final String THROUGHPUT = "throughput";
    public static final String LATENCY = "latency";

    private String sourceHost;
    private String destHost;
    private String pathType;

    // null when the path has no current sample
    private PathStatus currentStatus;
    private Instant lastSeen;

    private double latencyAvgMs;
    private double latencyJitterMs;
    private double packetLossPct;
    private double throughputMbps;
    private boolean throughputEstimated;
    private long tcpRetrans;

    private HistoricalSummary history;
    private TimePatternSummary timePatterns;

    @Builder.Default
    private Map<String, TrendResult> trends = new LinkedHashMap<>();

    @Builder.Default
    private List<DiagnosticCause> potentialCauses = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    public String getStatusLabel() {
        return currentStatus != null ? currentStatus.getValue() : "no_data";
    }
}
