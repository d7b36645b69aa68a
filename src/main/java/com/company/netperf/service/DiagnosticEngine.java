package com.company.netperf.service;

import com.company.netperf.config.DiagnosticProperties;
import com.company.netperf.domain.NetworkPerfSample;
import com.company.netperf.domain.enums.CauseKind;
import com.company.netperf.domain.enums.Confidence;
import com.company.netperf.domain.enums.PathStatus;
import com.company.netperf.domain.enums.RemediationCategory;
import com.company.netperf.domain.enums.TrendDirection;
import com.company.netperf.dto.response.DiagnosticCause;
import com.company.netperf.dto.response.NetworkDiagnostic;
import com.company.netperf.dto.response.TimePatternSummary;
import com.company.netperf.dto.response.TrendResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Rule set turning the current sample and its derived aggregates into causes
 * and recommendations. Holds no state between calls.
 * <p>
 * Every rule is evaluated independently, so one sample may trigger several causes.
 */
@Component
public class DiagnosticEngine {

    // absorbs rounding in 1 - business/off so an exact tier boundary still counts
    private static final double RATIO_EPSILON = 1e-9;

    private final DiagnosticThresholds thresholds;

    @Autowired
    public DiagnosticEngine(DiagnosticProperties properties) {
        this(properties.toThresholds());
    }

    public DiagnosticEngine(DiagnosticThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public List<DiagnosticCause> analyzeCauses(NetworkPerfSample current,
                                               Map<String, TrendResult> trends,
                                               TimePatternSummary timePatterns) {
        List<DiagnosticCause> causes = new ArrayList<>();

        if (current == null) {
            causes.add(cause(CauseKind.NO_DATA, Confidence.HIGH, "No recent measurements found for this path"));
            return causes;
        }

        if (!hasMeasurements(current)) {
            causes.add(cause(CauseKind.COLLECTION_FAILED, Confidence.HIGH,
                    "Latest collection produced no measurements - destination unreachable or transport failed"));
            return causes;
        }

        double loss = valueOf(current.getPingLossPct());
        if (loss > thresholds.getLossHighPct()) {
            causes.add(cause(CauseKind.HIGH_PACKET_LOSS, Confidence.HIGH,
                    format("%.1f%% packet loss - indicates network instability", loss)));
        } else if (loss > thresholds.getLossMediumPct()) {
            causes.add(cause(CauseKind.ELEVATED_PACKET_LOSS, Confidence.MEDIUM,
                    format("%.1f%% packet loss - minor network issues", loss)));
        }

        double latency = valueOf(current.getPingAvgMs());
        if (latency > thresholds.getLatencyHighMs()) {
            causes.add(cause(CauseKind.HIGH_LATENCY, Confidence.HIGH,
                    format("%.1fms average latency - significantly impacts performance", latency)));
        } else if (latency > thresholds.getLatencyMediumMs()) {
            causes.add(cause(CauseKind.ELEVATED_LATENCY, Confidence.MEDIUM,
                    format("%.1fms average latency", latency)));
        }

        double jitter = valueOf(current.getPingMdevMs());
        if (jitter > thresholds.getJitterHighMs()) {
            causes.add(cause(CauseKind.HIGH_JITTER, Confidence.HIGH,
                    format("%.1fms jitter - indicates network congestion or instability", jitter)));
        }

        long retrans = current.getTcpRetrans() != null ? current.getTcpRetrans() : 0L;
        if (retrans > thresholds.getRetransHigh()) {
            causes.add(cause(CauseKind.EXCESSIVE_TCP_RETRANSMITS, Confidence.HIGH,
                    retrans + " retransmits - significant packet loss or corruption"));
        } else if (retrans > thresholds.getRetransMedium()) {
            causes.add(cause(CauseKind.ELEVATED_TCP_RETRANSMITS, Confidence.MEDIUM, retrans + " retransmits"));
        }

        // an unmeasured rate is not a low rate
        double throughput = valueOf(current.getThroughputMbps());
        if (throughput > 0 && throughput < thresholds.getLowThroughputMbps()) {
            causes.add(cause(CauseKind.LOW_THROUGHPUT, Confidence.MEDIUM,
                    format("%.1f Mbps - below expected performance", throughput)));
        }

        if (timePatterns != null) {
            OptionalDouble drop = timePatterns.getBusinessHoursDrop();
            if (drop.isPresent()) {
                double ratio = drop.getAsDouble();
                if (ratio + RATIO_EPSILON >= thresholds.getBusinessDropHighRatio()) {
                    causes.add(cause(CauseKind.BUSINESS_HOURS_CONGESTION, Confidence.HIGH,
                            format("%.0f%% throughput drop during business hours on weekdays", ratio * 100)));
                } else if (ratio + RATIO_EPSILON >= thresholds.getBusinessDropMediumRatio()) {
                    causes.add(cause(CauseKind.MILD_BUSINESS_HOURS_IMPACT, Confidence.MEDIUM,
                            format("%.0f%% throughput drop during business hours", ratio * 100)));
                }
            }
        }

        if (trends != null) {
            if (trendOf(trends, NetworkDiagnostic.THROUGHPUT) == TrendDirection.DECREASING) {
                causes.add(cause(CauseKind.DECLINING_THROUGHPUT_TREND, Confidence.HIGH,
                        "Throughput has been decreasing over time"));
            }
            if (trendOf(trends, NetworkDiagnostic.LATENCY) == TrendDirection.INCREASING) {
                causes.add(cause(CauseKind.INCREASING_LATENCY_TREND, Confidence.HIGH,
                        "Latency has been increasing over time"));
            }
        }

        if (causes.isEmpty() && current.getStatus() == PathStatus.ERROR) {
            causes.add(cause(CauseKind.COLLECTION_FAILED, Confidence.HIGH,
                    "Latest collection was marked as failed"));
        }
        if (causes.isEmpty()) {
            causes.add(cause(CauseKind.NO_OBVIOUS_ISSUES, Confidence.LOW, "Network path appears healthy"));
        }
        return causes;
    }

    /**
     * Advice for the given causes, in cause order, without duplicates.
     */
    public List<String> recommend(List<DiagnosticCause> causes) {
        Set<String> recommendations = new LinkedHashSet<>();
        for (DiagnosticCause cause : causes) {
            for (RemediationCategory category : cause.getKind().getRemediations()) {
                recommendations.addAll(category.getRecommendations());
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.add(RemediationCategory.NO_ACTION_REQUIRED);
        }
        return new ArrayList<>(recommendations);
    }

    private static boolean hasMeasurements(NetworkPerfSample sample) {
        return sample.getPingLossPct() != null
                || sample.getPingAvgMs() != null
                || sample.getThroughputMbps() != null;
    }

    private static TrendDirection trendOf(Map<String, TrendResult> trends, String metric) {
        TrendResult trend = trends.get(metric);
        return trend != null ? trend.getTrend() : TrendDirection.UNKNOWN;
    }

    private static DiagnosticCause cause(CauseKind kind, Confidence confidence, String detail) {
        return new DiagnosticCause(kind, confidence, detail);
    }

    private static double valueOf(Double value) {
        return value != null ? value : 0.0;
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
