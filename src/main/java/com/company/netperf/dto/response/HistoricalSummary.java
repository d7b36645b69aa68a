package com.company.netperf.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalSummary {
    private int samplesCount;
    private double avgThroughputMbps;
    private double minThroughputMbps;
    private double maxThroughputMbps;

    public static HistoricalSummary empty() {
        return new HistoricalSummary();
    }
}
