package com.company.netperf.domain;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of the three-phase benchmark. Failed phases are absent; an error
 * is set only when the protocol could not run at all.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class BenchmarkResult {

    @Getter(AccessLevel.NONE)
    private final ThroughputStats coldCache;

    @Singular
    private final List<ThroughputStats> hotCacheRuns;

    @Getter(AccessLevel.NONE)
    private final ThroughputStats hotCacheAverage;

    @Getter(AccessLevel.NONE)
    private final ThroughputStats trueWrite;

    // retransmits over the whole three-phase sequence
    private final long tcpRetransTotal;

    @Getter(AccessLevel.NONE)
    private final String error;

    public Optional<ThroughputStats> getColdCache() {
        return Optional.ofNullable(coldCache);
    }

    public Optional<ThroughputStats> getHotCacheAverage() {
        return Optional.ofNullable(hotCacheAverage);
    }

    public Optional<ThroughputStats> getTrueWrite() {
        return Optional.ofNullable(trueWrite);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isUnavailable() {
        return error != null;
    }

    public static BenchmarkResult unavailable(String reason) {
        return BenchmarkResult.builder()
                .error(reason)
                .build();
    }
}
