package com.company.netperf.service;

import com.company.netperf.exception.CollectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Reads the kernel's cumulative TcpRetransSegs counter. The signal is
 * supplementary, so every failure reads as zero.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetransmitCounter {

    static final String COUNTER_NAME = "TcpRetransSegs";
    private static final Duration READ_TIMEOUT = Duration.ofSeconds(10);

    private final RemoteCommandRunner commandRunner;

    public long read() {
        try {
            String output = commandRunner.run(List.of("nstat", "-az", COUNTER_NAME), READ_TIMEOUT);
            return parse(output);
        } catch (CollectionException e) {
            log.debug("Could not read {}: {}", COUNTER_NAME, e.getMessage());
            return 0;
        }
    }

    /**
     * Retransmits attributable to the window between two readings.
     */
    public static long delta(long before, long after) {
        return Math.max(0, after - before);
    }

    // "TcpRetransSegs                  1234               0.0"
    static long parse(String output) {
        if (output == null) {
            return 0;
        }
        for (String line : output.split("\\R")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length >= 2 && COUNTER_NAME.equals(parts[0])) {
                try {
                    return Long.parseLong(parts[1]);
                } catch (NumberFormatException e) {
                    log.debug("Unparseable {} value: {}", COUNTER_NAME, parts[1]);
                    return 0;
                }
            }
        }
        return 0;
    }
}
