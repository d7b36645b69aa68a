package com.company.netperf.service;

import com.company.netperf.config.DiagnosticProperties;
import com.company.netperf.domain.TimeSeriesPoint;
import com.company.netperf.dto.response.TimePatternSummary;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Buckets samples into weekday/weekend and business/off hours and averages each bucket.
 * Business hours are [start, end) on weekdays only.
 */
@Component
public class TimePatternAnalyzer {

    private final ZoneId zone;
    private final int businessHoursStart;
    private final int businessHoursEnd;

    @Autowired
    public TimePatternAnalyzer(DiagnosticProperties properties) {
        this(properties.getZone(), properties.getBusinessHoursStart(), properties.getBusinessHoursEnd());
    }

    public TimePatternAnalyzer(ZoneId zone, int businessHoursStart, int businessHoursEnd) {
        if (businessHoursStart >= businessHoursEnd) {
            throw new IllegalArgumentException(
                    "Business hours must start before they end: " + businessHoursStart + "-" + businessHoursEnd);
        }
        this.zone = zone;
        this.businessHoursStart = businessHoursStart;
        this.businessHoursEnd = businessHoursEnd;
    }

    public TimePatternSummary analyze(List<TimeSeriesPoint> points) {
        if (points == null || points.isEmpty()) {
            return TimePatternSummary.empty();
        }

        Bucket weekday = new Bucket();
        Bucket weekend = new Bucket();
        Bucket business = new Bucket();
        Bucket offHours = new Bucket();

        for (TimeSeriesPoint point : points) {
            Double value = point.getValue();
            if (point.getTimestamp() == null || value == null || value == 0.0) {
                continue;
            }

            ZonedDateTime local = point.getTimestamp().atZone(zone);
            boolean isWeekday = isWeekday(local.getDayOfWeek());
            (isWeekday ? weekday : weekend).add(value);

            int hour = local.getHour();
            if (isWeekday && hour >= businessHoursStart && hour < businessHoursEnd) {
                business.add(value);
            } else {
                offHours.add(value);
            }
        }

        return TimePatternSummary.builder()
                .weekdayAvg(weekday.mean())
                .weekendAvg(weekend.mean())
                .businessHoursAvg(business.mean())
                .offHoursAvg(offHours.mean())
                .weekdayCount(weekday.count)
                .weekendCount(weekend.count)
                .businessHoursCount(business.count)
                .offHoursCount(offHours.count)
                .build();
    }

    private static boolean isWeekday(DayOfWeek day) {
        return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
    }

    private static class Bucket {
        private double sum;
        private int count;

        void add(double value) {
            sum += value;
            count++;
        }

        double mean() {
            return count == 0 ? 0.0 : sum / count;
        }
    }
}
