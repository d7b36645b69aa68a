package com.company.netperf.service;

import com.company.netperf.config.NetworkPerfProperties;
import com.company.netperf.domain.CommandTarget;
import com.company.netperf.domain.PipelineStage;
import com.company.netperf.domain.ThroughputStats;
import com.company.netperf.exception.CollectionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Single-shot throughput measurement used when the phased benchmark is off
 * or cannot run: iperf3 when installed, else a streaming transfer over ssh.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuickThroughputService {

    /**
     * Duration assumed for the streaming fallback, which has no timing signal.
     */
    public static final double ASSUMED_STREAM_DURATION_SEC = 10.0;

    private static final long MIB = 1024L * 1024L;

    private final RemoteCommandRunner commandRunner;
    private final RetransmitCounter retransmitCounter;
    private final NetworkPerfProperties properties;
    private final ObjectMapper objectMapper;

    public Optional<ThroughputStats> measure(CommandTarget destination) {
        Optional<ThroughputStats> iperf = measureWithIperf(destination.getHost(), properties.getIperfDuration());
        if (iperf.isPresent()) {
            return iperf;
        }
        return measureWithStream(destination, properties.getFallbackSizeMb());
    }

    Optional<ThroughputStats> measureWithIperf(String host, int durationSec) {
        if (!commandRunner.isToolAvailable("iperf3")) {
            return Optional.empty();
        }

        try {
            long before = retransmitCounter.read();
            String output = commandRunner.run(
                    List.of("iperf3", "-c", host, "-t", String.valueOf(durationSec), "-J"),
                    Duration.ofSeconds(durationSec + 30L));
            long after = retransmitCounter.read();

            long retrans = RetransmitCounter.delta(before, after);
            return parseIperf(output, durationSec).map(s -> s.toBuilder().tcpRetrans(retrans).build());
        } catch (CollectionException e) {
            log.debug("iperf3 to {} failed: {}", host, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * dd | pv | ssh with a known payload. Duration is assumed, so the result
     * is flagged as an estimate.
     */
    Optional<ThroughputStats> measureWithStream(CommandTarget destination, int sizeMb) {
        if (!commandRunner.isToolAvailable("pv")) {
            log.debug("pv not installed, no fallback throughput measurement for {}", destination.getHost());
            return Optional.empty();
        }

        List<PipelineStage> stages = List.of(
                PipelineStage.of("generator", List.of("dd", "if=/dev/zero", "bs=1M", "count=" + sizeMb)),
                PipelineStage.of("measurement", List.of("pv", "-q")),
                PipelineStage.of("transport",
                        commandRunner.remoteLogin(destination, PhasedThroughputBenchmark.DISCARD_SINK, true)));

        try {
            long before = retransmitCounter.read();
            commandRunner.runPipeline(stages, properties.getTransferTimeout());
            long after = retransmitCounter.read();

            ThroughputStats stats = ThroughputStats.fromTransfer(sizeMb * MIB, ASSUMED_STREAM_DURATION_SEC)
                    .toBuilder()
                    .tcpRetrans(RetransmitCounter.delta(before, after))
                    .estimated(true)
                    .build();

            log.info("Streamed {} MiB to {}; rate {} Mbps is an estimate (assumed {}s duration)",
                    sizeMb, destination.getHost(), String.format("%.1f", stats.getRateMbps()),
                    ASSUMED_STREAM_DURATION_SEC);
            return Optional.of(stats);
        } catch (CollectionException e) {
            log.debug("Streaming throughput test to {} failed: {}", destination.getHost(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<ThroughputStats> parseIperf(String json, int durationSec) {
        try {
            JsonNode sent = objectMapper.readTree(json).path("end").path("sum_sent");
            if (sent.isMissingNode()) {
                log.debug("iperf3 output has no end.sum_sent summary");
                return Optional.empty();
            }
            return Optional.of(ThroughputStats.builder()
                    .bytesTransferred(sent.path("bytes").asLong(0))
                    .rateMbps(sent.path("bits_per_second").asDouble(0) / 1_000_000.0)
                    .durationSec(sent.path("seconds").asDouble(durationSec))
                    .build());
        } catch (JsonProcessingException e) {
            log.debug("Unparseable iperf3 output: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
