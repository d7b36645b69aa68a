package com.company.netperf.service;

import com.company.netperf.domain.PingStats;
import com.company.netperf.exception.CollectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-count ping probe. A probe that cannot run at all is reported as total
 * loss rather than as an error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LatencyProber {

    public static final int DEFAULT_COUNT = 10;

    // "3 packets transmitted, 3 received, 0% packet loss"
    private static final Pattern LOSS_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)% packet loss");

    // "rtt min/avg/max/mdev = 0.123/0.456/0.789/0.111 ms" (BSD prints round-trip ... stddev)
    private static final Pattern RTT_PATTERN = Pattern.compile(
            "(?:rtt|round-trip) min/avg/max/(?:mdev|stddev) = ([\\d.]+)/([\\d.]+)/([\\d.]+)/([\\d.]+)");

    private final RemoteCommandRunner commandRunner;

    public PingStats measure(String host) {
        return measure(host, DEFAULT_COUNT);
    }

    public PingStats measure(String host, int count) {
        try {
            String output = commandRunner.run(
                    List.of("ping", "-c", String.valueOf(count), "-q", host),
                    Duration.ofSeconds(count + 10L));
            return parse(output);
        } catch (CollectionException e) {
            log.warn("Ping to {} failed: {}", host, e.getMessage());
            return PingStats.failed();
        }
    }

    static PingStats parse(String output) {
        PingStats.PingStatsBuilder stats = PingStats.builder();

        Matcher loss = LOSS_PATTERN.matcher(output);
        if (loss.find()) {
            double pct = Double.parseDouble(loss.group(1));
            stats.lossPct(Math.max(0.0, Math.min(PingStats.TOTAL_LOSS_PCT, pct)));
        }

        Matcher rtt = RTT_PATTERN.matcher(output);
        if (rtt.find()) {
            stats.minMs(Double.parseDouble(rtt.group(1)))
                    .avgMs(Double.parseDouble(rtt.group(2)))
                    .maxMs(Double.parseDouble(rtt.group(3)))
                    .mdevMs(Double.parseDouble(rtt.group(4)));
        }

        return stats.build();
    }
}
