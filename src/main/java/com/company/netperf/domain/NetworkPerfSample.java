package com.company.netperf.domain;

import com.company.netperf.domain.enums.PathStatus;
import com.company.netperf.domain.enums.PathType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Flat, persisted shape of a {@link NetworkPerfRecord}: one row of network_perf.
 * Nullable metric columns stay null when the measurement was not taken.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkPerfSample implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private Instant timestamp;
    private String sourceHost;
    private String destHost;
    private PathType pathType;
    private PathStatus status;

    private Double pingMinMs;
    private Double pingAvgMs;
    private Double pingMaxMs;
    private Double pingMdevMs;
    private Double pingLossPct;

    // representative figure: hot cache, else cold cache
    private Double throughputMbps;
    private Long bytesTransferred;
    private Long tcpRetrans;
    private Boolean throughputEstimated;

    private Double coldMbps;
    private Double writeMbps;

    public static NetworkPerfSample fromRecord(NetworkPerfRecord record) {
        NetworkPerfSampleBuilder builder = NetworkPerfSample.builder()
                .timestamp(record.getTimestamp())
                .sourceHost(record.getSourceHost())
                .destHost(record.getDestHost())
                .pathType(record.getPathType())
                .status(record.getStatus());

        record.getPing().ifPresent(ping -> builder
                .pingMinMs(ping.getMinMs())
                .pingAvgMs(ping.getAvgMs())
                .pingMaxMs(ping.getMaxMs())
                .pingMdevMs(ping.getMdevMs())
                .pingLossPct(ping.getLossPct()));

        record.getRepresentativeThroughput().ifPresent(tp -> builder
                .throughputMbps(tp.getRateMbps())
                .bytesTransferred(tp.getBytesTransferred())
                .tcpRetrans(tp.getTcpRetrans())
                .throughputEstimated(tp.isEstimated()));

        record.getCold().ifPresent(cold -> builder.coldMbps(cold.getRateMbps()));
        record.getWrite().ifPresent(write -> builder.writeMbps(write.getRateMbps()));

        return builder.build();
    }

    public String pathLabel() {
        return sourceHost + "->" + destHost;
    }
}
