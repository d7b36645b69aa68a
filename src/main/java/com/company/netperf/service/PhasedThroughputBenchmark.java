package com.company.netperf.service;

import com.company.netperf.config.NetworkPerfProperties;
import com.company.netperf.domain.BenchmarkResult;
import com.company.netperf.domain.CommandTarget;
import com.company.netperf.domain.PipelineStage;
import com.company.netperf.domain.ThroughputStats;
import com.company.netperf.exception.CollectionException;
import com.company.netperf.util.TestFileSet;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Three-phase throughput benchmark that separates network bandwidth from
 * storage effects:
 * <ol>
 *   <li>cold cache: caches flushed on both ends, receiver discards;</li>
 *   <li>hot cache: files pinned in memory, three discard runs averaged;</li>
 *   <li>true write: caches flushed and re-pinned, receiver writes to disk.</li>
 * </ol>
 * Phases run strictly in order. A failed phase is left absent and the others
 * still run; only a missing pv aborts the protocol.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PhasedThroughputBenchmark {

    public static final int HOT_CACHE_RUNS = 3;

    static final String MEASUREMENT_TOOL = "pv";
    static final String DISCARD_SINK = "cat > /dev/null";
    // every run writes to its own remote file
    static final String WRITE_SINK = "f=$(mktemp /tmp/netperf_nettest_recv.XXXXXX) && cat > \"$f\"; rc=$?; rm -f \"$f\"; exit $rc";

    private static final double MIN_DURATION_SEC = 1e-6;

    private final RemoteCommandRunner commandRunner;
    private final RetransmitCounter retransmitCounter;
    private final PageCacheController cacheController;
    private final NetworkPerfProperties properties;
    private final MeterRegistry meterRegistry;

    public BenchmarkResult run(CommandTarget destination) {
        if (!commandRunner.isToolAvailable(MEASUREMENT_TOOL)) {
            log.warn("{} not installed, skipping phased benchmark to {}", MEASUREMENT_TOOL, destination.getHost());
            return BenchmarkResult.unavailable(MEASUREMENT_TOOL + " not installed");
        }

        try (TestFileSet files = TestFileSet.generate(workDir(), properties.getNumFiles(), properties.getFileSizeMb())) {
            return runPhases(destination, files);
        } catch (IOException e) {
            log.warn("Could not generate benchmark test files: {}", e.getMessage());
            return BenchmarkResult.unavailable("Failed to generate test files: " + e.getMessage());
        }
    }

    private BenchmarkResult runPhases(CommandTarget destination, TestFileSet files) {
        BenchmarkResult.BenchmarkResultBuilder result = BenchmarkResult.builder();
        CommandTarget local = CommandTarget.local();

        long retransStart = retransmitCounter.read();

        cacheController.flush(local);
        cacheController.flush(destination);
        transfer("cold cache", files, destination, DISCARD_SINK).ifPresent(result::coldCache);

        cacheController.pin(files.getFileNames());
        List<ThroughputStats> hotRuns = new ArrayList<>();
        for (int run = 1; run <= HOT_CACHE_RUNS; run++) {
            transfer("hot cache run " + run, files, destination, DISCARD_SINK).ifPresent(hotRuns::add);
            if (run < HOT_CACHE_RUNS && !pauseBetweenRuns()) {
                break;
            }
        }
        result.hotCacheRuns(hotRuns);
        if (!hotRuns.isEmpty()) {
            result.hotCacheAverage(ThroughputStats.average(hotRuns));
        }

        cacheController.flush(local);
        cacheController.flush(destination);
        cacheController.pin(files.getFileNames());
        transfer("true write", files, destination, WRITE_SINK).ifPresent(result::trueWrite);

        long retransTotal = RetransmitCounter.delta(retransStart, retransmitCounter.read());
        result.tcpRetransTotal(retransTotal);

        log.info("Phased benchmark to {} finished: {}/{} hot runs succeeded, {} retransmits",
                destination.getHost(), hotRuns.size(), HOT_CACHE_RUNS, retransTotal);

        return result.build();
    }

    /**
     * Stream the test files to the destination sink and time the whole pipeline.
     */
    private Optional<ThroughputStats> transfer(String phase, TestFileSet files, CommandTarget destination, String sink) {
        List<String> generator = new ArrayList<>();
        generator.add("cat");
        generator.addAll(files.getFileNames());

        List<PipelineStage> stages = List.of(
                PipelineStage.of("generator", generator),
                PipelineStage.of("measurement", List.of(MEASUREMENT_TOOL, "-q")),
                PipelineStage.of("transport", commandRunner.remoteLogin(destination, sink, true)));

        long start = System.nanoTime();
        try {
            commandRunner.runPipeline(stages, properties.getTransferTimeout());
        } catch (CollectionException e) {
            log.warn("{} transfer to {} failed: {}", phase, destination.getHost(), e.getMessage());
            meterRegistry.counter("netperf.benchmark.phase.failures", "phase", phaseTag(phase)).increment();
            return Optional.empty();
        }
        double durationSec = Math.max((System.nanoTime() - start) / 1e9, MIN_DURATION_SEC);

        ThroughputStats stats = ThroughputStats.fromTransfer(files.getTotalBytes(), durationSec);
        log.debug("{} transfer: {} bytes in {}s ({} Mbps)",
                phase, stats.getBytesTransferred(), String.format("%.2f", durationSec),
                String.format("%.1f", stats.getRateMbps()));
        return Optional.of(stats);
    }

    private boolean pauseBetweenRuns() {
        Duration pause = properties.getHotRunPause();
        if (pause.isZero() || pause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted between hot cache runs, skipping remaining runs");
            return false;
        }
    }

    private Path workDir() {
        String dir = properties.getWorkDir();
        return Path.of(dir != null && !dir.isBlank() ? dir : System.getProperty("java.io.tmpdir"));
    }

    private static String phaseTag(String phase) {
        return phase.startsWith("hot cache") ? "hot_cache" : phase.replace(' ', '_');
    }
}
