package com.company.netperf.service;

import com.company.netperf.config.DiagnosticProperties;
import com.company.netperf.domain.TimeSeriesPoint;
import com.company.netperf.domain.enums.AlertLevel;
import com.company.netperf.domain.enums.TrendDirection;
import com.company.netperf.dto.response.TrendResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Least-squares trend of a metric over its most recent samples.
 * <p>
 * The first derivative is the fitted slope per hour. The change it implies
 * across the window, relative to the window mean, decides the direction
 * (below the noise ratio it is stable) and the alert level.
 */
@Component
public class TrendAnalyzer {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private final int window;
    private final double noiseRatio;
    private final double warningRatio;
    private final double criticalRatio;

    @Autowired
    public TrendAnalyzer(DiagnosticProperties properties) {
        this(properties.getTrendWindow(), properties.getTrendNoiseRatio(),
                properties.getTrendWarningRatio(), properties.getTrendCriticalRatio());
    }

    public TrendAnalyzer(int window, double noiseRatio, double warningRatio, double criticalRatio) {
        if (window < 2) {
            throw new IllegalArgumentException("Trend window must hold at least 2 samples: " + window);
        }
        this.window = window;
        this.noiseRatio = noiseRatio;
        this.warningRatio = warningRatio;
        this.criticalRatio = criticalRatio;
    }

    public TrendResult analyze(List<TimeSeriesPoint> points) {
        if (points == null || points.isEmpty()) {
            return TrendResult.unknown(null);
        }

        // missing or zero values carry no signal
        List<TimeSeriesPoint> usable = points.stream()
                .filter(p -> p.getTimestamp() != null && p.getValue() != null && p.getValue() != 0.0)
                .sorted(Comparator.comparing(TimeSeriesPoint::getTimestamp))
                .collect(Collectors.toList());
        if (usable.size() > window) {
            usable = usable.subList(usable.size() - window, usable.size());
        }
        if (usable.isEmpty()) {
            return TrendResult.unknown(null);
        }

        Double current = usable.get(usable.size() - 1).getValue();
        if (usable.size() < 2) {
            return TrendResult.unknown(current);
        }

        TimeSeriesPoint first = usable.get(0);
        double spanHours = hoursBetween(first, usable.get(usable.size() - 1));
        if (spanHours <= 0) {
            return TrendResult.unknown(current);
        }

        int n = usable.size();
        double sumX = 0, sumY = 0;
        double[] xs = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = hoursBetween(first, usable.get(i));
            sumX += xs[i];
            sumY += usable.get(i).getValue();
        }
        double meanX = sumX / n;
        double meanY = sumY / n;

        double covariance = 0, variance = 0;
        for (int i = 0; i < n; i++) {
            double dx = xs[i] - meanX;
            covariance += dx * (usable.get(i).getValue() - meanY);
            variance += dx * dx;
        }
        double slope = covariance / variance;

        if (meanY == 0.0) {
            return TrendResult.builder()
                    .current(current)
                    .trend(TrendDirection.UNKNOWN)
                    .firstDerivative(slope)
                    .alertLevel(AlertLevel.NORMAL)
                    .build();
        }

        double relativeChange = slope * spanHours / Math.abs(meanY);
        return TrendResult.builder()
                .current(current)
                .trend(direction(relativeChange))
                .firstDerivative(slope)
                .alertLevel(alertLevel(relativeChange))
                .build();
    }

    private TrendDirection direction(double relativeChange) {
        if (Math.abs(relativeChange) < noiseRatio) {
            return TrendDirection.STABLE;
        }
        return relativeChange > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    private AlertLevel alertLevel(double relativeChange) {
        double magnitude = Math.abs(relativeChange);
        if (magnitude >= criticalRatio) return AlertLevel.CRITICAL;
        if (magnitude >= warningRatio) return AlertLevel.WARNING;
        return AlertLevel.NORMAL;
    }

    private static double hoursBetween(TimeSeriesPoint from, TimeSeriesPoint to) {
        return Duration.between(from.getTimestamp(), to.getTimestamp()).toMillis() / 1000.0 / SECONDS_PER_HOUR;
    }
}
