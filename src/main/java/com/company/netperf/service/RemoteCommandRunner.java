package com.company.netperf.service;

import com.company.netperf.config.NetworkPerfProperties;
import com.company.netperf.domain.CommandTarget;
import com.company.netperf.domain.PipelineStage;
import com.company.netperf.exception.CollectionException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs external commands locally or over ssh, always with a timeout.
 * Each call starts and reaps its own processes; nothing is held between calls.
 */
@Component
@Slf4j
public class RemoteCommandRunner {

    private static final Duration TOOL_PROBE_TIMEOUT = Duration.ofSeconds(10);
    private static final long OUTPUT_DRAIN_SECONDS = 5;
    private static final long UPSTREAM_EXIT_SECONDS = 10;

    private static final int MIN_OUTPUT_READERS = 4;

    private final int connectTimeoutSeconds;
    private final ExecutorService outputReaders;

    @Autowired
    public RemoteCommandRunner(NetworkPerfProperties properties) {
        this(properties.getConnectTimeoutSeconds(), Math.max(MIN_OUTPUT_READERS, properties.getParallelism() * 2));
    }

    RemoteCommandRunner(int connectTimeoutSeconds) {
        this(connectTimeoutSeconds, MIN_OUTPUT_READERS);
    }

    RemoteCommandRunner(int connectTimeoutSeconds, int outputReaderThreads) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("netperf-output-");
        threadFactory.setDaemon(true);
        this.outputReaders = Executors.newFixedThreadPool(outputReaderThreads, threadFactory);
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    /**
     * Run a local command and return its standard output, trimmed.
     *
     * @throws CollectionException on non-zero exit, timeout or start failure
     */
    public String run(List<String> command, Duration timeout) {
        String display = String.join(" ", command);
        log.debug("Running: {}", display);

        Process process = start(new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD), display);
        closeQuietly(process);

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
                () -> readFully(process.getInputStream()), outputReaders);

        int exitCode = awaitExit(process, timeout, display);
        String output = drain(stdout, display);

        if (exitCode != 0) {
            throw CollectionException.failed(display, exitCode);
        }
        return output.trim();
    }

    /**
     * Run a shell command on the target: through sh locally, through ssh otherwise.
     */
    public String run(CommandTarget target, String shellCommand, Duration timeout) {
        return run(remoteLogin(target, shellCommand, false), timeout);
    }

    /**
     * Presence probe for an external utility.
     */
    public boolean isToolAvailable(String tool) {
        try {
            run(List.of("sh", "-c", "command -v " + tool), TOOL_PROBE_TIMEOUT);
            return true;
        } catch (CollectionException e) {
            log.debug("Tool {} not available: {}", tool, e.getMessage());
            return false;
        }
    }

    /**
     * Run stages connected stdout-to-stdin. The last stage's output is discarded.
     * The first failing stage, checked from the sink backwards, is reported.
     */
    public void runPipeline(List<PipelineStage> stages, Duration timeout) {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("Pipeline needs at least one stage");
        }

        String display = stages.stream().map(PipelineStage::describe).collect(Collectors.joining(" | "));
        log.debug("Running pipeline: {}", display);

        List<ProcessBuilder> builders = new ArrayList<>();
        for (PipelineStage stage : stages) {
            builders.add(new ProcessBuilder(stage.getCommand()).redirectError(ProcessBuilder.Redirect.DISCARD));
        }
        builders.get(builders.size() - 1).redirectOutput(ProcessBuilder.Redirect.DISCARD);

        List<Process> processes;
        try {
            processes = ProcessBuilder.startPipeline(builders);
        } catch (IOException e) {
            throw CollectionException.failed(display, e);
        }
        closeQuietly(processes.get(0));

        Process sink = processes.get(processes.size() - 1);
        try {
            if (!sink.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                processes.forEach(Process::destroyForcibly);
                throw CollectionException.timedOut(display);
            }
            for (Process upstream : processes) {
                if (!upstream.waitFor(UPSTREAM_EXIT_SECONDS, TimeUnit.SECONDS)) {
                    upstream.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            processes.forEach(Process::destroyForcibly);
            throw CollectionException.failed(display, e);
        }

        for (int i = processes.size() - 1; i >= 0; i--) {
            Process process = processes.get(i);
            int exitCode = process.isAlive() ? -1 : process.exitValue();
            if (exitCode != 0) {
                PipelineStage stage = stages.get(i);
                throw CollectionException.stageFailed(stage.getName(), exitCode, stage.describe());
            }
        }
    }

    /**
     * Argument list that runs shellCommand on the target. Bulk mode disables
     * pseudo-terminal allocation and compression for data transfers.
     */
    public List<String> remoteLogin(CommandTarget target, String shellCommand, boolean bulk) {
        if (target == null || target.isLocal()) {
            return List.of("sh", "-c", shellCommand);
        }

        List<String> args = new ArrayList<>(List.of(
                "ssh",
                "-o", "BatchMode=yes",
                "-o", "ConnectTimeout=" + connectTimeoutSeconds,
                "-o", "StrictHostKeyChecking=accept-new"));
        if (bulk) {
            args.addAll(List.of("-T", "-o", "Compression=no"));
        }
        if (target.getSshKey() != null && !target.getSshKey().isBlank()) {
            args.addAll(List.of("-i", target.getSshKey()));
        }
        args.add(target.destination());
        args.add(shellCommand);
        return args;
    }

    private Process start(ProcessBuilder builder, String display) {
        try {
            return builder.start();
        } catch (IOException e) {
            throw CollectionException.failed(display, e);
        }
    }

    private int awaitExit(Process process, Duration timeout, String display) {
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw CollectionException.timedOut(display);
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw CollectionException.failed(display, e);
        }
    }

    private String drain(CompletableFuture<String> stdout, String display) {
        try {
            return stdout.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CollectionException.failed(display, e);
        } catch (ExecutionException | TimeoutException e) {
            throw CollectionException.failed(display, e);
        }
    }

    // nothing is ever written to a child's stdin
    private void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Failed to close stdin of process {}", process.pid(), e);
        }
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
