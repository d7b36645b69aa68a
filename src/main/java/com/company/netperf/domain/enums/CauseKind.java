package com.company.netperf.domain.enums;

import java.util.List;

/**
 * Every cause the diagnostic engine can report, with the advice it maps to.
 */
public enum CauseKind {
    NO_DATA("No network data available", List.of(RemediationCategory.NONE)),
    COLLECTION_FAILED("Collection failed / path unreachable", List.of(RemediationCategory.CONNECTIVITY)),
    HIGH_PACKET_LOSS("High Packet Loss", List.of(RemediationCategory.PACKET_LOSS)),
    ELEVATED_PACKET_LOSS("Elevated Packet Loss", List.of(RemediationCategory.PACKET_LOSS)),
    HIGH_LATENCY("High Latency", List.of(RemediationCategory.LATENCY)),
    ELEVATED_LATENCY("Elevated Latency", List.of(RemediationCategory.LATENCY)),
    HIGH_JITTER("High Jitter", List.of(RemediationCategory.JITTER)),
    EXCESSIVE_TCP_RETRANSMITS("Excessive TCP Retransmits", List.of(RemediationCategory.RETRANSMITS)),
    ELEVATED_TCP_RETRANSMITS("Elevated TCP Retransmits", List.of(RemediationCategory.RETRANSMITS)),
    LOW_THROUGHPUT("Low Throughput", List.of(RemediationCategory.LOW_THROUGHPUT)),
    BUSINESS_HOURS_CONGESTION("Business Hours Congestion", List.of(RemediationCategory.CONGESTION)),
    MILD_BUSINESS_HOURS_IMPACT("Mild Business Hours Impact", List.of(RemediationCategory.CONGESTION)),
    DECLINING_THROUGHPUT_TREND("Declining Throughput Trend", List.of(RemediationCategory.LOW_THROUGHPUT)),
    INCREASING_LATENCY_TREND("Increasing Latency Trend", List.of(RemediationCategory.LATENCY)),
    NO_OBVIOUS_ISSUES("No obvious issues detected", List.of(RemediationCategory.NONE));

    private final String title;
    private final List<RemediationCategory> remediations;

    CauseKind(String title, List<RemediationCategory> remediations) {
        this.title = title;
        this.remediations = remediations;
    }

    public String getTitle() {
        return title;
    }

    public List<RemediationCategory> getRemediations() {
        return remediations;
    }
}
