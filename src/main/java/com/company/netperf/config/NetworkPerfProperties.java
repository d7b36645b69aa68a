package com.company.netperf.config;

import com.company.netperf.domain.HealthThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed binding for netperf.collection: the paths to measure and how.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "netperf.collection")
public class NetworkPerfProperties {

    private boolean enabled = true;

    /**
     * Delay between the end of one collection cycle and the start of the next
     */
    @Min(1000)
    private long intervalMs = 3_600_000;

    private long initialDelayMs = 60_000;

    /**
     * Source/destination pairs measured on every cycle
     */
    @Valid
    private List<PathConfig> paths = new ArrayList<>();

    @Min(1)
    private int pingCount = 10;

    /**
     * iperf3 run length in seconds (quick mode)
     */
    @Min(1)
    private int iperfDuration = 10;

    /**
     * Run the three-phase cold/hot/write benchmark instead of quick mode
     */
    private boolean fullTest = false;

    @Min(1)
    private int numFiles = 3;

    @Min(1)
    private int fileSizeMb = 10;

    /**
     * Payload streamed by the transport fallback when iperf3 is missing
     */
    @Min(1)
    private int fallbackSizeMb = 50;

    /**
     * Where benchmark test files are generated (defaults to java.io.tmpdir)
     */
    private String workDir;

    private long hotRunPauseMs = 5000;

    @Min(1)
    private int transferTimeoutSeconds = 300;

    @Min(1)
    private int connectTimeoutSeconds = 10;

    /**
     * Number of paths collected concurrently; 1 collects them one after another
     */
    @Min(1)
    private int parallelism = 1;

    private Health health = new Health();

    public Duration getTransferTimeout() {
        return Duration.ofSeconds(transferTimeoutSeconds);
    }

    public Duration getHotRunPause() {
        return Duration.ofMillis(hotRunPauseMs);
    }

    @Data
    public static class PathConfig {

        /**
         * Defaults to the local host name when blank
         */
        private String source;

        /**
         * Entries without a destination are skipped
         */
        private String dest;

        /**
         * direct, switch, nfs or unknown
         */
        private String pathType = "unknown";

        private String user;

        private String sshKey;
    }

    @Data
    public static class Health {
        private double maxLossPct = 1.0;
        private double maxAvgMs = 50.0;
        private double maxJitterMs = 20.0;
        private double minThroughputMbps = 100.0;
        private double errorLossPct = 10.0;

        public HealthThresholds toThresholds() {
            return HealthThresholds.builder()
                    .maxLossPct(maxLossPct)
                    .maxAvgMs(maxAvgMs)
                    .maxJitterMs(maxJitterMs)
                    .minThroughputMbps(minThroughputMbps)
                    .errorLossPct(errorLossPct)
                    .build();
        }
    }
}
