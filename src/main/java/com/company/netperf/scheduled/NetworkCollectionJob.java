package com.company.netperf.scheduled;

import com.company.netperf.domain.NetworkPerfRecord;
import com.company.netperf.service.NetworkPathCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "netperf.collection.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class NetworkCollectionJob {

    private final NetworkPathCollector collector;

    /**
     * One collection cycle over all configured paths.
     * Fixed delay, so a slow cycle never overlaps the next one.
     */
    @Scheduled(
            fixedDelayString = "${netperf.collection.interval-ms:3600000}",
            initialDelayString = "${netperf.collection.initial-delay-ms:60000}"
    )
    public void collectNetworkPaths() {
        long start = System.currentTimeMillis();
        try {
            List<NetworkPerfRecord> records = collector.collectAll();
            log.info("Network collection cycle stored {} records in {} ms",
                    records.size(), System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.error("Network collection cycle failed", e);
        }
    }
}
