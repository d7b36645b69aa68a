package com.company.netperf.domain.enums;

import java.util.List;

/**
 * Canned remediation advice, grouped by the kind of problem it addresses.
 */
public enum RemediationCategory {
    CONNECTIVITY(List.of(
            "Verify the destination answers: ping <dest>",
            "Check non-interactive ssh from the collector: ssh -o BatchMode=yes <dest> true",
            "Confirm pv and iperf3 are installed where the benchmark runs")),
    PACKET_LOSS(List.of(
            "Check cable connections and switch ports",
            "Verify switch port error counters: show interface counters errors",
            "Test with different cables or ports")),
    LATENCY(List.of(
            "Check for routing changes: traceroute <dest>",
            "Verify no bandwidth-heavy processes running",
            "Check switch/router CPU utilization")),
    JITTER(List.of(
            "Network jitter often indicates congestion",
            "Check for broadcast storms or network loops",
            "Consider QoS policies for critical traffic")),
    RETRANSMITS(List.of(
            "TCP retransmits indicate packet loss",
            "Check for duplex mismatch: ethtool <interface>",
            "Verify MTU settings match across path")),
    CONGESTION(List.of(
            "Consider dedicated network path for HPC traffic",
            "Evaluate traffic shaping or QoS policies",
            "Schedule large transfers for off-hours",
            "Document congestion pattern for infrastructure upgrade proposal")),
    LOW_THROUGHPUT(List.of(
            "Run iperf3 test to isolate bottleneck: iperf3 -c <dest>",
            "Check NIC link speed: ethtool <interface>",
            "Verify no half-duplex links in path")),
    NONE(List.of());

    public static final String NO_ACTION_REQUIRED = "Network appears healthy - no action required";

    private final List<String> recommendations;

    RemediationCategory(List<String> recommendations) {
        this.recommendations = recommendations;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }
}
