package com.company.netperf.service;

import com.company.netperf.domain.CommandTarget;
import com.company.netperf.exception.CollectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Page-cache state control for the benchmark. Everything here is best effort:
 * an unflushed cache only makes the following transfer look faster.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PageCacheController {

    static final String DROP_CACHES = "sync; echo 3 | sudo -n tee /proc/sys/vm/drop_caches > /dev/null 2>&1";
    private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration PIN_TIMEOUT = Duration.ofSeconds(60);

    private final RemoteCommandRunner commandRunner;

    /**
     * Drop the page cache on the target (local when the target is local).
     */
    public boolean flush(CommandTarget target) {
        try {
            commandRunner.run(target, DROP_CACHES, FLUSH_TIMEOUT);
            return true;
        } catch (CollectionException e) {
            log.warn("Cache flush on {} failed, continuing with warm cache: {}",
                    target.isLocal() ? "localhost" : target.getHost(), e.getMessage());
            return false;
        }
    }

    /**
     * Force files into the local page cache: vmtouch when present, otherwise
     * a sequential read of each file.
     */
    public boolean pin(List<String> files) {
        try {
            for (String file : files) {
                commandRunner.run(List.of("vmtouch", "-t", file), PIN_TIMEOUT);
            }
            return true;
        } catch (CollectionException e) {
            log.debug("vmtouch unavailable, falling back to sequential read: {}", e.getMessage());
        }

        try {
            for (String file : files) {
                commandRunner.run(List.of("sh", "-c", "cat \"$1\" > /dev/null", "pin", file), PIN_TIMEOUT);
            }
            return true;
        } catch (CollectionException e) {
            log.warn("Could not load test files into page cache: {}", e.getMessage());
            return false;
        }
    }
}
