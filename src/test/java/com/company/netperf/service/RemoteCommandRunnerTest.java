package com.company.netperf.service;

import com.company.netperf.domain.CommandTarget;
import com.company.netperf.domain.PipelineStage;
import com.company.netperf.exception.CollectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteCommandRunnerTest {

    private final RemoteCommandRunner runner = new RemoteCommandRunner(7);

    @Test
    void remoteLogin_localTargetUsesShell() {
        assertThat(runner.remoteLogin(CommandTarget.local(), "echo hi", false))
                .containsExactly("sh", "-c", "echo hi");
        assertThat(runner.remoteLogin(CommandTarget.of("localhost", "ops", null), "echo hi", true))
                .containsExactly("sh", "-c", "echo hi");
    }

    @Test
    void remoteLogin_remoteTargetUsesNonInteractiveSsh() {
        List<String> args = runner.remoteLogin(CommandTarget.of("storage-01", "ops", null), "uptime", false);

        assertThat(args).containsExactly(
                "ssh",
                "-o", "BatchMode=yes",
                "-o", "ConnectTimeout=7",
                "-o", "StrictHostKeyChecking=accept-new",
                "ops@storage-01",
                "uptime");
    }

    @Test
    void remoteLogin_bulkTransferDisablesTtyAndCompression() {
        List<String> args = runner.remoteLogin(
                CommandTarget.of("storage-01", null, "/keys/id_ed25519"), "cat > /dev/null", true);

        assertThat(args).containsSubsequence("-T", "-o", "Compression=no");
        assertThat(args).containsSubsequence("-i", "/keys/id_ed25519", "storage-01", "cat > /dev/null");
        assertThat(args).doesNotContain("null@storage-01");
    }

    @Test
    void runPipeline_rejectsEmptyPipeline() {
        assertThatThrownBy(() -> runner.runPipeline(List.of(), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisabledOnOs(OS.WINDOWS)
    class LocalProcesses {

        @AfterEach
        void tearDown() {
            runner.shutdown();
        }

        @Test
        void run_returnsTrimmedStdout() {
            assertThat(runner.run(List.of("sh", "-c", "echo '  x  '"), Duration.ofSeconds(5))).isEqualTo("x");
        }

        @Test
        void run_nonZeroExitIsCollectionException() {
            assertThatThrownBy(() -> runner.run(List.of("false"), Duration.ofSeconds(5)))
                    .isInstanceOf(CollectionException.class)
                    .hasMessage("Command failed with exit code 1: false");
        }

        @Test
        void run_longCommandIsCutInMessage() {
            String script = "exit 3; " + "x".repeat(80);

            assertThatThrownBy(() -> runner.run(List.of("sh", "-c", script), Duration.ofSeconds(5)))
                    .isInstanceOf(CollectionException.class)
                    .hasMessage("Command failed with exit code 3: " + ("sh -c " + script).substring(0, 50) + "...");
        }

        @Test
        void run_timeoutKillsProcess() {
            long start = System.nanoTime();

            assertThatThrownBy(() -> runner.run(List.of("sleep", "5"), Duration.ofMillis(100)))
                    .isInstanceOf(CollectionException.class)
                    .hasMessage("Command timed out: sleep 5");
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(4));
        }

        @Test
        void run_missingExecutableIsCollectionException() {
            assertThatThrownBy(() -> runner.run(List.of("netperf-no-such-tool"), Duration.ofSeconds(5)))
                    .isInstanceOf(CollectionException.class)
                    .hasMessageStartingWith("Command failed: netperf-no-such-tool");
        }

        @Test
        void isToolAvailable_probesPath() {
            assertThat(runner.isToolAvailable("sh")).isTrue();
            assertThat(runner.isToolAvailable("netperf-no-such-tool")).isFalse();
        }

        @Test
        void runPipeline_succeeds() {
            runner.runPipeline(List.of(
                    PipelineStage.of("generator", List.of("echo", "payload")),
                    PipelineStage.of("transport", List.of("cat"))), Duration.ofSeconds(5));
        }

        @Test
        void runPipeline_namesFailingSink() {
            List<PipelineStage> stages = List.of(
                    PipelineStage.of("generator", List.of("true")),
                    PipelineStage.of("transport", List.of("false")));

            assertThatThrownBy(() -> runner.runPipeline(stages, Duration.ofSeconds(5)))
                    .isInstanceOf(CollectionException.class)
                    .hasMessage("Pipeline stage 'transport' failed with exit code 1: false");
        }

        @Test
        void runPipeline_namesFailingUpstreamStage() {
            List<PipelineStage> stages = List.of(
                    PipelineStage.of("generator", List.of("false")),
                    PipelineStage.of("transport", List.of("cat")));

            assertThatThrownBy(() -> runner.runPipeline(stages, Duration.ofSeconds(5)))
                    .isInstanceOf(CollectionException.class)
                    .hasMessage("Pipeline stage 'generator' failed with exit code 1: false");
        }

        @Test
        void runPipeline_timeoutKillsAllStages() {
            List<PipelineStage> stages = List.of(
                    PipelineStage.of("generator", List.of("sleep", "5")),
                    PipelineStage.of("transport", List.of("cat")));

            assertThatThrownBy(() -> runner.runPipeline(stages, Duration.ofMillis(100)))
                    .isInstanceOf(CollectionException.class)
                    .hasMessage("Command timed out: sleep 5 | cat");
        }
    }
}
