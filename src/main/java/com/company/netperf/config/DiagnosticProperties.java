package com.company.netperf.config;

import com.company.netperf.service.DiagnosticThresholds;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Typed binding for netperf.diagnostics: history window, trend sensitivity,
 * time bucketing and the threshold tiers of the cause rules.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "netperf.diagnostics")
public class DiagnosticProperties {

    /**
     * Lookback for the historical series (one week)
     */
    @Min(1)
    private int historyHours = 168;

    @Min(2)
    private int trendWindow = 100;

    private double trendNoiseRatio = 0.05;
    private double trendWarningRatio = 0.20;
    private double trendCriticalRatio = 0.50;

    /**
     * Zone used to decide weekday/weekend and business hours
     */
    private String zoneId = "UTC";

    @Min(0)
    @Max(23)
    private int businessHoursStart = 9;

    @Min(1)
    @Max(24)
    private int businessHoursEnd = 17;

    @Min(1)
    private int maxRecommendations = 6;

    private double lossHighPct = 5.0;
    private double lossMediumPct = 1.0;
    private double latencyHighMs = 100.0;
    private double latencyMediumMs = 50.0;
    private double jitterHighMs = 20.0;
    private long retransHigh = 100;
    private long retransMedium = 10;
    private double lowThroughputMbps = 100.0;
    private double businessDropHighRatio = 0.30;
    private double businessDropMediumRatio = 0.15;

    public ZoneId getZone() {
        return ZoneId.of(zoneId);
    }

    public DiagnosticThresholds toThresholds() {
        return DiagnosticThresholds.builder()
                .lossHighPct(lossHighPct)
                .lossMediumPct(lossMediumPct)
                .latencyHighMs(latencyHighMs)
                .latencyMediumMs(latencyMediumMs)
                .jitterHighMs(jitterHighMs)
                .retransHigh(retransHigh)
                .retransMedium(retransMedium)
                .lowThroughputMbps(lowThroughputMbps)
                .businessDropHighRatio(businessDropHighRatio)
                .businessDropMediumRatio(businessDropMediumRatio)
                .build();
    }
}
