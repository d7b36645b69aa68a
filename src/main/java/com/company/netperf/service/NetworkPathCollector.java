package com.company.netperf.service;

import com.company.netperf.config.NetworkPerfProperties;
import com.company.netperf.config.NetworkPerfProperties.PathConfig;
import com.company.netperf.domain.BenchmarkResult;
import com.company.netperf.domain.CommandTarget;
import com.company.netperf.domain.NetworkPerfRecord;
import com.company.netperf.domain.PingStats;
import com.company.netperf.domain.ThroughputStats;
import com.company.netperf.domain.enums.PathStatus;
import com.company.netperf.domain.enums.PathType;
import com.company.netperf.event.NetworkPathCollectedEvent;
import com.company.netperf.event.NetworkPathDegradedEvent;
import com.company.netperf.exception.PathNotConfiguredException;
import com.company.netperf.repository.NetworkPerfRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Measures every configured path and stores one record per path per cycle.
 * A failure anywhere in a path's sequence becomes an error record for that
 * path; the other paths are unaffected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NetworkPathCollector {

    static final String MDC_PATH_KEY = "path";

    private final LatencyProber latencyProber;
    private final PhasedThroughputBenchmark phasedBenchmark;
    private final QuickThroughputService quickThroughput;
    private final NetworkPerfRepository repository;
    private final NetworkPerfProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    // one benchmark per path at a time, whichever trigger started it
    private final ConcurrentMap<String, ReentrantLock> pathLocks = new ConcurrentHashMap<>();

    /**
     * Collect all configured paths, sequentially or with the configured parallelism.
     */
    public List<NetworkPerfRecord> collectAll() {
        List<PathConfig> paths = properties.getPaths().stream()
                .filter(p -> p.getDest() != null && !p.getDest().isBlank())
                .collect(Collectors.toList());

        if (paths.isEmpty()) {
            log.debug("No network paths configured");
            return List.of();
        }

        log.info("Starting network collection for {} paths (full_test={}, parallelism={})",
                paths.size(), properties.isFullTest(), properties.getParallelism());

        List<NetworkPerfRecord> records = properties.getParallelism() > 1 && paths.size() > 1
                ? collectInParallel(paths)
                : paths.stream().map(this::collectAndStore).collect(Collectors.toList());

        long healthy = records.stream().filter(r -> r.getStatus() == PathStatus.HEALTHY).count();
        log.info("Network collection completed: {} paths, {} healthy, {} not healthy",
                records.size(), healthy, records.size() - healthy);

        return records;
    }

    /**
     * Collect one configured path on demand.
     */
    public NetworkPerfRecord collectConfiguredPath(String source, String dest) {
        PathConfig path = properties.getPaths().stream()
                .filter(p -> Objects.equals(p.getDest(), dest))
                .filter(p -> source == null || source.equals(resolveSource(p)))
                .findFirst()
                .orElseThrow(() -> new PathNotConfiguredException(source, dest));
        return collectAndStore(path);
    }

    NetworkPerfRecord collectAndStore(PathConfig path) {
        String source = resolveSource(path);
        String label = source + "->" + path.getDest();

        ReentrantLock lock = pathLocks.computeIfAbsent(label, key -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.info("Collection of {} already in progress, waiting for it to finish", label);
            lock.lock();
        }
        try {
            return collectAndStore(path, source, label);
        } finally {
            lock.unlock();
        }
    }

    private NetworkPerfRecord collectAndStore(PathConfig path, String source, String label) {
        MDC.put(MDC_PATH_KEY, label);
        Span span = tracer.spanBuilder("netperf.collect-path")
                .setAttribute("netperf.source", source)
                .setAttribute("netperf.dest", path.getDest())
                .setAttribute("netperf.path_type", PathType.fromString(path.getPathType()).getValue())
                .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            Timer.Sample sample = Timer.start(meterRegistry);
            NetworkPerfRecord record = collectPath(path, source);
            sample.stop(meterRegistry.timer("netperf.collection.duration"));

            span.setAttribute("netperf.status", record.getStatus().getValue());
            if (record.getStatus() == PathStatus.ERROR) {
                span.setStatus(StatusCode.ERROR);
            }

            store(record);
            return record;
        } finally {
            span.end();
            MDC.remove(MDC_PATH_KEY);
        }
    }

    /**
     * Probe, then benchmark, then derive status. Never throws.
     */
    NetworkPerfRecord collectPath(PathConfig path, String source) {
        PathType pathType = PathType.fromString(path.getPathType());
        try {
            NetworkPerfRecord record = measurePath(path, source, pathType);
            log.debug("Collected network stats {}: {}", record.pathLabel(), record.getStatus().getValue());
            return record;
        } catch (Exception e) {
            log.error("Failed to collect network stats for {}->{}", source, path.getDest(), e);
            return NetworkPerfRecord.error(source, path.getDest(), pathType, clock.instant());
        }
    }

    private NetworkPerfRecord measurePath(PathConfig path, String source, PathType pathType) {
        CommandTarget destination = CommandTarget.of(path.getDest(), path.getUser(), path.getSshKey());

        NetworkPerfRecord.NetworkPerfRecordBuilder record = NetworkPerfRecord.builder()
                .sourceHost(source)
                .destHost(path.getDest())
                .pathType(pathType)
                .timestamp(clock.instant());

        PingStats ping = latencyProber.measure(path.getDest(), properties.getPingCount());
        record.ping(ping);

        ThroughputStats hot;
        if (properties.isFullTest()) {
            BenchmarkResult result = phasedBenchmark.run(destination);
            if (result.isUnavailable()) {
                log.warn("Phased benchmark unavailable ({}), using quick measurement", result.getError().orElse(""));
                hot = quickThroughput.measure(destination).orElse(null);
            } else {
                hot = result.getHotCacheAverage()
                        .map(avg -> avg.toBuilder().tcpRetrans(result.getTcpRetransTotal()).build())
                        .orElse(null);
                record.cold(result.getColdCache().orElse(null));
                record.write(result.getTrueWrite().orElse(null));
            }
        } else {
            hot = quickThroughput.measure(destination).orElse(null);
        }
        record.hot(hot);

        record.status(PathStatus.derive(ping, hot, properties.getHealth().toThresholds()));
        return record.build();
    }

    private void store(NetworkPerfRecord record) {
        meterRegistry.counter("netperf.collections",
                "path", record.pathLabel(),
                "status", record.getStatus().getValue()
        ).increment();

        try {
            repository.save(record);
        } catch (Exception e) {
            log.error("Failed to persist record for {}", record.pathLabel(), e);
            return;
        }

        eventPublisher.publishEvent(new NetworkPathCollectedEvent(record));
        if (record.getStatus() != PathStatus.HEALTHY) {
            eventPublisher.publishEvent(new NetworkPathDegradedEvent(record));
        }
    }

    private List<NetworkPerfRecord> collectInParallel(List<PathConfig> paths) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(properties.getParallelism(), paths.size()));
        try {
            List<Callable<NetworkPerfRecord>> tasks = new ArrayList<>();
            for (PathConfig path : paths) {
                tasks.add(() -> collectAndStore(path));
            }

            List<NetworkPerfRecord> records = new ArrayList<>();
            List<Future<NetworkPerfRecord>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                records.add(awaitRecord(futures.get(i), paths.get(i)));
            }
            return records;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while collecting network paths", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private NetworkPerfRecord awaitRecord(Future<NetworkPerfRecord> future, PathConfig path) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            String source = resolveSource(path);
            log.error("Collection task for {}->{} failed", source, path.getDest(), e.getCause());
            return NetworkPerfRecord.error(source, path.getDest(), PathType.fromString(path.getPathType()), clock.instant());
        }
    }

    private String resolveSource(PathConfig path) {
        if (path.getSource() != null && !path.getSource().isBlank()) {
            return path.getSource();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name: {}", e.getMessage());
            return "localhost";
        }
    }
}
