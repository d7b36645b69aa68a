package com.company.netperf.event;

import com.company.netperf.domain.NetworkPerfRecord;
import com.company.netperf.domain.enums.PathStatus;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class NetworkPathEventListener {

    private final MeterRegistry meterRegistry;

    @EventListener
    @Async
    public void onPathCollected(NetworkPathCollectedEvent event) {
        NetworkPerfRecord record = event.getRecord();
        log.debug("Stored network record for {} ({})", record.pathLabel(), record.getStatus().getValue());
    }

    @EventListener
    @Async
    public void onPathDegraded(NetworkPathDegradedEvent event) {
        NetworkPerfRecord record = event.getRecord();

        meterRegistry.counter("netperf.paths.degraded",
                "path", record.pathLabel(),
                "status", record.getStatus().getValue()
        ).increment();

        if (record.getStatus() == PathStatus.ERROR) {
            log.error("Network path {} is in error state at {}", record.pathLabel(), record.getTimestamp());
            return;
        }
        log.warn("Network path {} degraded: loss={}%, avg={}ms, jitter={}ms, throughput={} Mbps",
                record.pathLabel(),
                record.getPing().map(p -> p.getLossPct()).orElse(null),
                record.getPing().map(p -> p.getAvgMs()).orElse(null),
                record.getPing().map(p -> p.getMdevMs()).orElse(null),
                record.getHot().map(t -> t.getRateMbps()).orElse(null));
    }
}
