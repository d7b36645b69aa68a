package com.company.netperf.dto.response;

import com.company.netperf.domain.enums.AlertLevel;
import com.company.netperf.domain.enums.TrendDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendResult {
    private Double current;
    private TrendDirection trend;

    // change per hour
    private Double firstDerivative;
    private AlertLevel alertLevel;

    public static TrendResult unknown(Double current) {
        return TrendResult.builder()
                .current(current)
                .trend(TrendDirection.UNKNOWN)
                .alertLevel(AlertLevel.NORMAL)
                .build();
    }
}
