package com.company.netperf.domain;

import com.company.netperf.domain.enums.PathStatus;
import com.company.netperf.domain.enums.PathType;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * One collection run for one source/destination path. Immutable once built;
 * each throughput phase is optional because any phase may fail on its own.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class NetworkPerfRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String sourceHost;
    private final String destHost;
    private final PathType pathType;
    private final Instant timestamp;

    // null only for records built from a path-level failure
    @Getter(AccessLevel.NONE)
    private final PingStats ping;

    @Getter(AccessLevel.NONE)
    private final ThroughputStats cold;

    // hot cache, possibly averaged over several runs
    @Getter(AccessLevel.NONE)
    private final ThroughputStats hot;

    @Getter(AccessLevel.NONE)
    private final ThroughputStats write;

    private final PathStatus status;

    public Optional<PingStats> getPing() {
        return Optional.ofNullable(ping);
    }

    public Optional<ThroughputStats> getCold() {
        return Optional.ofNullable(cold);
    }

    public Optional<ThroughputStats> getHot() {
        return Optional.ofNullable(hot);
    }

    public Optional<ThroughputStats> getWrite() {
        return Optional.ofNullable(write);
    }

    /**
     * Throughput figure persisted for the record: hot cache, else cold cache.
     */
    public Optional<ThroughputStats> getRepresentativeThroughput() {
        return hot != null ? Optional.of(hot) : Optional.ofNullable(cold);
    }

    public String pathLabel() {
        return sourceHost + "->" + destHost;
    }

    /**
     * Minimal record for a path whose collection failed as a whole.
     */
    public static NetworkPerfRecord error(String sourceHost, String destHost, PathType pathType, Instant timestamp) {
        return NetworkPerfRecord.builder()
                .sourceHost(sourceHost)
                .destHost(destHost)
                .pathType(pathType)
                .timestamp(timestamp)
                .status(PathStatus.ERROR)
                .build();
    }
}
