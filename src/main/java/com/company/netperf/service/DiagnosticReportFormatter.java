package com.company.netperf.service;

import com.company.netperf.config.DiagnosticProperties;
import com.company.netperf.domain.enums.Confidence;
import com.company.netperf.domain.enums.PathStatus;
import com.company.netperf.domain.enums.TrendDirection;
import com.company.netperf.dto.response.DiagnosticCause;
import com.company.netperf.dto.response.HistoricalSummary;
import com.company.netperf.dto.response.NetworkDiagnostic;
import com.company.netperf.dto.response.TimePatternSummary;
import com.company.netperf.dto.response.TrendResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link NetworkDiagnostic} as a terminal report, optionally with ANSI colors.
 */
@Component
public class DiagnosticReportFormatter {

    private static final String RESET = "\033[0m";
    private static final String BOLD = "\033[1m";
    private static final String RED = "\033[91m";
    private static final String GREEN = "\033[92m";
    private static final String YELLOW = "\033[93m";
    private static final String CYAN = "\033[96m";
    private static final String GRAY = "\033[90m";

    private static final String RULE = "  " + "─".repeat(56);

    private final int maxRecommendations;

    @Autowired
    public DiagnosticReportFormatter(DiagnosticProperties properties) {
        this(properties.getMaxRecommendations());
    }

    public DiagnosticReportFormatter(int maxRecommendations) {
        this.maxRecommendations = maxRecommendations;
    }

    public String format(NetworkDiagnostic diag, boolean color) {
        Palette c = new Palette(color);
        StringBuilder out = new StringBuilder();

        line(out, "");
        line(out, "  " + c.bold("Network Diagnostic") + " - "
                + c.paint(CYAN, diag.getSourceHost() + " → " + diag.getDestHost()));
        line(out, "  Path type: " + diag.getPathType());
        line(out, RULE);

        line(out, "");
        line(out, "  " + c.bold("Status:") + " " + c.paint(statusColor(diag.getCurrentStatus()), diag.getStatusLabel()));
        if (diag.getLastSeen() != null) {
            line(out, "  " + c.bold("Last Test:") + " " + diag.getLastSeen());
        }

        appendCurrentMetrics(out, diag, c);
        appendHistory(out, diag.getHistory(), c);
        appendTimePatterns(out, diag.getTimePatterns(), c);
        appendTrends(out, diag.getTrends(), c);

        section(out, "Potential Causes", c);
        for (DiagnosticCause cause : diag.getPotentialCauses()) {
            Confidence confidence = cause.getConfidence();
            String tagColor = confidence == Confidence.HIGH ? RED : confidence == Confidence.MEDIUM ? YELLOW : GRAY;
            line(out, "    " + c.paint(tagColor, "[" + confidence.name() + "]") + " " + cause.getCause());
            line(out, "           " + c.paint(GRAY, cause.getDetail()));
        }

        section(out, "Recommendations", c);
        diag.getRecommendations().stream()
                .limit(maxRecommendations)
                .forEach(rec -> line(out, "    " + c.paint(CYAN, "→") + " " + rec));

        line(out, "");
        return out.toString();
    }

    private void appendCurrentMetrics(StringBuilder out, NetworkDiagnostic diag, Palette c) {
        section(out, "Current Metrics", c);

        double latency = diag.getLatencyAvgMs();
        String latencyColor = latency > 50 ? RED : latency > 20 ? YELLOW : GREEN;
        line(out, "    Latency:      " + c.paint(latencyColor, decimal(latency) + " ms")
                + " (jitter: " + decimal(diag.getLatencyJitterMs()) + " ms)");

        double loss = diag.getPacketLossPct();
        line(out, "    Packet Loss:  " + c.paint(loss > 1 ? RED : GREEN, decimal(loss) + "%"));

        double throughput = diag.getThroughputMbps();
        if (throughput > 0) {
            String throughputColor = throughput > 500 ? GREEN : throughput > 100 ? YELLOW : RED;
            String suffix = diag.isThroughputEstimated() ? " (estimated)" : "";
            line(out, "    Throughput:   " + c.paint(throughputColor, decimal(throughput) + " Mbps") + suffix);
        }

        long retrans = diag.getTcpRetrans();
        if (retrans > 0) {
            String retransColor = retrans > 50 ? RED : retrans > 10 ? YELLOW : GREEN;
            line(out, "    Retransmits:  " + c.paint(retransColor, String.valueOf(retrans)));
        }
    }

    private void appendHistory(StringBuilder out, HistoricalSummary history, Palette c) {
        if (history == null || history.getSamplesCount() == 0) {
            return;
        }
        line(out, "");
        line(out, "  " + c.bold("Historical Summary") + " (" + history.getSamplesCount() + " samples)");
        line(out, RULE);
        line(out, "    Avg Throughput:  " + decimal(history.getAvgThroughputMbps()) + " Mbps");
        line(out, "    Min/Max:         " + decimal(history.getMinThroughputMbps())
                + " / " + decimal(history.getMaxThroughputMbps()) + " Mbps");
    }

    private void appendTimePatterns(StringBuilder out, TimePatternSummary patterns, Palette c) {
        if (patterns == null || patterns.isEmpty()) {
            return;
        }
        section(out, "Time-based Analysis", c);

        if (patterns.getWeekdayAvg() > 0 && patterns.getWeekendAvg() > 0) {
            line(out, "    Weekday Avg:      " + decimal(patterns.getWeekdayAvg()) + " Mbps");
            line(out, "    Weekend Avg:      " + decimal(patterns.getWeekendAvg()) + " Mbps");
        }

        patterns.getBusinessHoursDrop().ifPresent(drop -> {
            double dropPct = drop * 100;
            String businessColor = dropPct > 20 ? RED : dropPct > 10 ? YELLOW : GREEN;
            line(out, "    Business Hours:   " + c.paint(businessColor, decimal(patterns.getBusinessHoursAvg()) + " Mbps"));
            line(out, "    Off Hours:        " + decimal(patterns.getOffHoursAvg()) + " Mbps");
            if (dropPct > 5) {
                line(out, "    " + c.paint(YELLOW, "↓ " + String.format(Locale.ROOT, "%.0f", dropPct)
                        + "% drop during business hours"));
            }
        });
    }

    private void appendTrends(StringBuilder out, Map<String, TrendResult> trends, Palette c) {
        if (trends == null || trends.isEmpty()) {
            return;
        }
        section(out, "Trends", c);
        trends.forEach((name, trend) -> {
            if (trend == null) {
                return;
            }
            TrendDirection direction = trend.getTrend() != null ? trend.getTrend() : TrendDirection.UNKNOWN;
            // rising latency is bad, rising throughput is good
            TrendDirection bad = NetworkDiagnostic.LATENCY.equals(name) ? TrendDirection.INCREASING : TrendDirection.DECREASING;
            TrendDirection good = bad == TrendDirection.INCREASING ? TrendDirection.DECREASING : TrendDirection.INCREASING;
            String trendColor = direction == bad ? RED : direction == good ? GREEN : GRAY;
            String label = String.format(Locale.ROOT, "%-12s", capitalize(name));
            line(out, "    " + label + " " + c.paint(trendColor, direction.getValue()));
        });
    }

    private static String statusColor(PathStatus status) {
        if (status == PathStatus.HEALTHY) return GREEN;
        if (status == PathStatus.DEGRADED) return YELLOW;
        return RED;
    }

    private static void section(StringBuilder out, String title, Palette c) {
        line(out, "");
        line(out, "  " + c.bold(title));
        line(out, RULE);
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String capitalize(String name) {
        return name.isEmpty() ? name : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    private static final class Palette {
        private final boolean enabled;

        Palette(boolean enabled) {
            this.enabled = enabled;
        }

        String paint(String ansi, String text) {
            return enabled ? ansi + text + RESET : text;
        }

        String bold(String text) {
            return paint(BOLD, text);
        }
    }
}
