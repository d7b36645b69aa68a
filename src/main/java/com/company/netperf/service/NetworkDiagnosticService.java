package com.company.netperf.service;

import com.company.netperf.config.DiagnosticProperties;
import com.company.netperf.domain.NetworkPerfSample;
import com.company.netperf.domain.TimeSeriesPoint;
import com.company.netperf.dto.response.DiagnosticCause;
import com.company.netperf.dto.response.HistoricalSummary;
import com.company.netperf.dto.response.NetworkDiagnostic;
import com.company.netperf.dto.response.NetworkPathResponse;
import com.company.netperf.dto.response.TimePatternSummary;
import com.company.netperf.dto.response.TrendResult;
import com.company.netperf.repository.NetworkPerfRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds {@link NetworkDiagnostic}s from the stored series. Always returns a
 * diagnosis; a path without data is reported as such.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NetworkDiagnosticService {

    private final NetworkPerfRepository repository;
    private final TrendAnalyzer trendAnalyzer;
    private final TimePatternAnalyzer timePatternAnalyzer;
    private final DiagnosticEngine engine;
    private final DiagnosticReportFormatter reportFormatter;
    private final DiagnosticProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public NetworkDiagnostic diagnose(String source, String dest, Integer hours) {
        meterRegistry.counter("netperf.diagnostics.requests").increment();

        int lookbackHours = hours != null ? hours : properties.getHistoryHours();
        NetworkPerfSample current = repository.findLatest(source, dest).orElse(null);
        List<NetworkPerfSample> history = findHistory(source, dest, lookbackHours);

        log.debug("Diagnosing {}->{} over {}h: current={}, {} history samples",
                source, dest, lookbackHours, current != null, history.size());

        NetworkDiagnostic.NetworkDiagnosticBuilder diag = NetworkDiagnostic.builder();
        if (current != null) {
            diag.sourceHost(current.getSourceHost())
                    .destHost(current.getDestHost())
                    .pathType(current.getPathType() != null ? current.getPathType().getValue() : "unknown")
                    .currentStatus(current.getStatus())
                    .lastSeen(current.getTimestamp())
                    .latencyAvgMs(valueOf(current.getPingAvgMs()))
                    .latencyJitterMs(valueOf(current.getPingMdevMs()))
                    .packetLossPct(valueOf(current.getPingLossPct()))
                    .throughputMbps(valueOf(current.getThroughputMbps()))
                    .throughputEstimated(Boolean.TRUE.equals(current.getThroughputEstimated()))
                    .tcpRetrans(current.getTcpRetrans() != null ? current.getTcpRetrans() : 0L);
        } else {
            diag.sourceHost(source != null ? source : "unknown")
                    .destHost(dest != null ? dest : "unknown")
                    .pathType("unknown");
        }

        List<TimeSeriesPoint> throughputSeries = series(history, NetworkPerfSample::getThroughputMbps);
        List<TimeSeriesPoint> latencySeries = series(history, NetworkPerfSample::getPingAvgMs);

        TimePatternSummary timePatterns = timePatternAnalyzer.analyze(throughputSeries);

        Map<String, TrendResult> trends = new LinkedHashMap<>();
        trends.put(NetworkDiagnostic.THROUGHPUT, trendAnalyzer.analyze(throughputSeries));
        trends.put(NetworkDiagnostic.LATENCY, trendAnalyzer.analyze(latencySeries));

        List<DiagnosticCause> causes = engine.analyzeCauses(current, trends, timePatterns);

        return diag.history(summarize(throughputSeries))
                .timePatterns(timePatterns)
                .trends(trends)
                .potentialCauses(causes)
                .recommendations(engine.recommend(causes))
                .build();
    }

    public String report(String source, String dest, Integer hours, boolean color) {
        return reportFormatter.format(diagnose(source, dest, hours), color);
    }

    public List<NetworkPerfSample> findHistory(String source, String dest, int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        return repository.findSince(source, dest, since);
    }

    public List<NetworkPathResponse> findPaths() {
        return repository.findPaths();
    }

    private static HistoricalSummary summarize(List<TimeSeriesPoint> throughputSeries) {
        DoubleSummaryStatistics stats = throughputSeries.stream()
                .mapToDouble(TimeSeriesPoint::getValue)
                .filter(v -> v != 0.0)
                .summaryStatistics();
        if (stats.getCount() == 0) {
            return HistoricalSummary.empty();
        }
        return HistoricalSummary.builder()
                .samplesCount((int) stats.getCount())
                .avgThroughputMbps(stats.getAverage())
                .minThroughputMbps(stats.getMin())
                .maxThroughputMbps(stats.getMax())
                .build();
    }

    private static List<TimeSeriesPoint> series(List<NetworkPerfSample> history,
                                                Function<NetworkPerfSample, Double> metric) {
        return history.stream()
                .filter(s -> metric.apply(s) != null)
                .map(s -> new TimeSeriesPoint(s.getTimestamp(), metric.apply(s)))
                .filter(p -> Objects.nonNull(p.getTimestamp()))
                .collect(Collectors.toList());
    }

    private static double valueOf(Double value) {
        return value != null ? value : 0.0;
    }
}
