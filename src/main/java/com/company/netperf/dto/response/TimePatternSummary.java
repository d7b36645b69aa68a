package com.company.netperf.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.OptionalDouble;

/**
 * Mean throughput per calendar bucket. An average of 0 means the bucket had no samples.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimePatternSummary {
    private double weekdayAvg;
    private double weekendAvg;
    private double businessHoursAvg;
    private double offHoursAvg;
    private int weekdayCount;
    private int weekendCount;
    private int businessHoursCount;
    private int offHoursCount;

    public static TimePatternSummary empty() {
        return new TimePatternSummary();
    }

    /**
     * Relative throughput drop of business hours against off hours, when both buckets have data.
     */
    @JsonIgnore
    public OptionalDouble getBusinessHoursDrop() {
        if (businessHoursAvg <= 0 || offHoursAvg <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(1.0 - businessHoursAvg / offHoursAvg);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return weekdayCount + weekendCount == 0;
    }
}
