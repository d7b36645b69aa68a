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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NetworkPathCollectorTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private static final PingStats GOOD_PING = PingStats.builder()
            .minMs(0.2).avgMs(0.3).maxMs(0.5).mdevMs(0.1).lossPct(0).build();

    @Mock
    private LatencyProber latencyProber;

    @Mock
    private PhasedThroughputBenchmark phasedBenchmark;

    @Mock
    private QuickThroughputService quickThroughput;

    @Mock
    private NetworkPerfRepository repository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private NetworkPerfProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private NetworkPathCollector collector;

    @BeforeEach
    void setUp() {
        properties = new NetworkPerfProperties();
        properties.setPingCount(5);
        meterRegistry = new SimpleMeterRegistry();
        collector = new NetworkPathCollector(latencyProber, phasedBenchmark, quickThroughput, repository,
                properties, eventPublisher, meterRegistry,
                OpenTelemetry.noop().getTracer("test"),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PathConfig path(String source, String dest, String type) {
        PathConfig path = new PathConfig();
        path.setSource(source);
        path.setDest(dest);
        path.setPathType(type);
        path.setUser("ops");
        return path;
    }

    @Test
    void collectAll_quickModeBuildsHealthyRecord() {
        properties.setPaths(List.of(path("node-1", "storage-01", "direct")));
        when(latencyProber.measure("storage-01", 5)).thenReturn(GOOD_PING);
        when(quickThroughput.measure(CommandTarget.of("storage-01", "ops", null)))
                .thenReturn(Optional.of(ThroughputStats.builder().rateMbps(940).durationSec(10).build()));

        List<NetworkPerfRecord> records = collector.collectAll();

        assertThat(records).hasSize(1);
        NetworkPerfRecord record = records.get(0);
        assertThat(record.getSourceHost()).isEqualTo("node-1");
        assertThat(record.getDestHost()).isEqualTo("storage-01");
        assertThat(record.getPathType()).isEqualTo(PathType.DIRECT);
        assertThat(record.getTimestamp()).isEqualTo(NOW);
        assertThat(record.getStatus()).isEqualTo(PathStatus.HEALTHY);
        assertThat(record.getHot()).isPresent();
        assertThat(record.getCold()).isEmpty();

        verify(repository).save(record);
        verify(eventPublisher).publishEvent(any(NetworkPathCollectedEvent.class));
        verify(eventPublisher, never()).publishEvent(any(NetworkPathDegradedEvent.class));
        verify(phasedBenchmark, never()).run(any());
        assertThat(meterRegistry.counter("netperf.collections",
                "path", "node-1->storage-01", "status", "healthy").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("netperf.collection.duration").count()).isEqualTo(1L);
    }

    @Test
    void collectAll_fullTestUsesPhasedBenchmark() {
        properties.setFullTest(true);
        properties.setPaths(List.of(path("node-1", "nas-1", "nfs")));
        ThroughputStats cold = ThroughputStats.builder().rateMbps(400).durationSec(1).build();
        ThroughputStats hotAvg = ThroughputStats.builder().rateMbps(900).durationSec(1).build();
        ThroughputStats write = ThroughputStats.builder().rateMbps(300).durationSec(1).build();
        when(latencyProber.measure("nas-1", 5)).thenReturn(GOOD_PING);
        when(phasedBenchmark.run(any())).thenReturn(BenchmarkResult.builder()
                .coldCache(cold).hotCacheRun(hotAvg).hotCacheAverage(hotAvg).trueWrite(write)
                .tcpRetransTotal(12).build());

        NetworkPerfRecord record = collector.collectAll().get(0);

        assertThat(record.getCold()).contains(cold);
        assertThat(record.getWrite()).contains(write);
        assertThat(record.getHot()).isPresent();
        assertThat(record.getHot().get().getRateMbps()).isEqualTo(900.0);
        assertThat(record.getHot().get().getTcpRetrans()).isEqualTo(12L);
        assertThat(record.getStatus()).isEqualTo(PathStatus.HEALTHY);
        verify(quickThroughput, never()).measure(any());
    }

    @Test
    void collectAll_unavailableBenchmarkFallsBackToQuickMeasurement() {
        properties.setFullTest(true);
        properties.setPaths(List.of(path("node-1", "nas-1", "nfs")));
        when(latencyProber.measure("nas-1", 5)).thenReturn(GOOD_PING);
        when(phasedBenchmark.run(any())).thenReturn(BenchmarkResult.unavailable("pv not installed"));
        when(quickThroughput.measure(any()))
                .thenReturn(Optional.of(ThroughputStats.builder().rateMbps(50).durationSec(10).estimated(true).build()));

        NetworkPerfRecord record = collector.collectAll().get(0);

        assertThat(record.getHot()).isPresent();
        assertThat(record.getStatus()).isEqualTo(PathStatus.DEGRADED);
        verify(eventPublisher).publishEvent(any(NetworkPathDegradedEvent.class));
    }

    @Test
    void collectAll_failingPathBecomesErrorRecordAndOthersContinue() {
        properties.setPaths(List.of(
                path("node-1", "broken", "switch"),
                path("node-1", "storage-01", "direct")));
        when(latencyProber.measure("broken", 5)).thenThrow(new IllegalStateException("boom"));
        when(latencyProber.measure("storage-01", 5)).thenReturn(GOOD_PING);
        when(quickThroughput.measure(any())).thenReturn(Optional.empty());

        List<NetworkPerfRecord> records = collector.collectAll();

        assertThat(records).hasSize(2);
        NetworkPerfRecord broken = records.get(0);
        assertThat(broken.getStatus()).isEqualTo(PathStatus.ERROR);
        assertThat(broken.getDestHost()).isEqualTo("broken");
        assertThat(broken.getPathType()).isEqualTo(PathType.SWITCH);
        assertThat(broken.getTimestamp()).isEqualTo(NOW);
        assertThat(broken.getPing()).isEmpty();
        assertThat(broken.getHot()).isEmpty();

        assertThat(records.get(1).getStatus()).isEqualTo(PathStatus.HEALTHY);
        verify(repository, times(2)).save(any());
    }

    @Test
    void collectAll_persistenceFailureDoesNotStopOtherPaths() {
        properties.setPaths(List.of(
                path("node-1", "a", "direct"),
                path("node-1", "b", "direct")));
        when(latencyProber.measure(any(), anyInt())).thenReturn(GOOD_PING);
        when(quickThroughput.measure(any())).thenReturn(Optional.empty());
        when(repository.save(any()))
                .thenThrow(new IllegalStateException("db down"))
                .thenReturn(null);

        List<NetworkPerfRecord> records = collector.collectAll();

        assertThat(records).hasSize(2);
        verify(eventPublisher, times(1)).publishEvent(any(NetworkPathCollectedEvent.class));
    }

    @Test
    void collectAll_skipsPathsWithoutDestination() {
        properties.setPaths(List.of(path("node-1", " ", "direct")));

        assertThat(collector.collectAll()).isEmpty();
        verify(latencyProber, never()).measure(any(), anyInt());
    }

    @Test
    void collectAll_parallelKeepsConfiguredOrder() {
        properties.setParallelism(3);
        properties.setPaths(List.of(
                path("node-1", "a", "direct"),
                path("node-1", "b", "switch"),
                path("node-1", "c", "nfs")));
        when(latencyProber.measure(any(), anyInt())).thenReturn(GOOD_PING);
        when(quickThroughput.measure(any())).thenReturn(Optional.empty());

        List<NetworkPerfRecord> records = collector.collectAll();

        assertThat(records).extracting(NetworkPerfRecord::getDestHost).containsExactly("a", "b", "c");
        verify(repository, times(3)).save(any());
    }

    @Test
    void collectConfiguredPath_unknownPathIsRejected() {
        properties.setPaths(List.of(path("node-1", "a", "direct")));

        assertThatThrownBy(() -> collector.collectConfiguredPath("node-1", "zzz"))
                .isInstanceOf(PathNotConfiguredException.class);
    }

    @Test
    void collectConfiguredPath_measuresMatchingPath() {
        properties.setPaths(List.of(path("node-1", "a", "direct"), path("node-1", "b", "nfs")));
        when(latencyProber.measure(eq("b"), anyInt())).thenReturn(PingStats.failed());
        when(quickThroughput.measure(any())).thenReturn(Optional.empty());

        NetworkPerfRecord record = collector.collectConfiguredPath(null, "b");

        assertThat(record.getDestHost()).isEqualTo("b");
        assertThat(record.getStatus()).isEqualTo(PathStatus.ERROR);
        assertThat(record.getPing()).contains(PingStats.failed());
    }

    @Test
    void samePathIsNeverBenchmarkedConcurrently() throws Exception {
        properties.setFullTest(true);
        properties.setParallelism(2);
        properties.setPaths(List.of(path("node-1", "storage-01", "direct"), path("node-1", "storage-01", "direct")));
        when(latencyProber.measure(any(), anyInt())).thenReturn(GOOD_PING);

        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        ThroughputStats hot = ThroughputStats.builder().rateMbps(900).durationSec(1).build();
        when(phasedBenchmark.run(any())).thenAnswer(invocation -> {
            maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
            Thread.sleep(100);
            running.decrementAndGet();
            return BenchmarkResult.builder().hotCacheRun(hot).hotCacheAverage(hot).build();
        });

        ExecutorService manual = Executors.newSingleThreadExecutor();
        try {
            Future<NetworkPerfRecord> onDemand = manual.submit(
                    () -> collector.collectConfiguredPath("node-1", "storage-01"));
            List<NetworkPerfRecord> scheduled = collector.collectAll();

            assertThat(onDemand.get(10, TimeUnit.SECONDS).getStatus()).isEqualTo(PathStatus.HEALTHY);
            assertThat(scheduled).hasSize(2);
        } finally {
            manual.shutdownNow();
        }

        verify(phasedBenchmark, times(3)).run(any());
        assertThat(maxRunning.get()).isEqualTo(1);
    }
}
