package com.company.netperf.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Freshly generated, non-compressible benchmark files in a private temp
 * directory. Closing the set deletes the directory.
 */
@Slf4j
public class TestFileSet implements AutoCloseable {

    static final int MIB = 1024 * 1024;
    private static final String FILE_PREFIX = "netperf_nettest_";
    private static final byte[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".getBytes(StandardCharsets.US_ASCII);

    private final Path directory;
    private final List<Path> files;
    private final long totalBytes;

    private TestFileSet(Path directory, List<Path> files, long totalBytes) {
        this.directory = directory;
        this.files = Collections.unmodifiableList(files);
        this.totalBytes = totalBytes;
    }

    /**
     * Write count files of sizeMb MiB of random printable characters.
     */
    public static TestFileSet generate(Path parentDir, int count, int sizeMb) throws IOException {
        Path directory = Files.createTempDirectory(parentDir, FILE_PREFIX);
        List<Path> files = new ArrayList<>(count);
        Random random = ThreadLocalRandom.current();
        byte[] chunk = new byte[MIB];

        try {
            for (int i = 0; i < count; i++) {
                Path file = directory.resolve(FILE_PREFIX + i + ".iotest");
                try (OutputStream out = Files.newOutputStream(file)) {
                    for (int mb = 0; mb < sizeMb; mb++) {
                        for (int b = 0; b < chunk.length; b++) {
                            chunk[b] = ALPHABET[random.nextInt(ALPHABET.length)];
                        }
                        out.write(chunk);
                    }
                }
                files.add(file);
            }
        } catch (IOException e) {
            deleteRecursively(directory);
            throw e;
        }

        long totalBytes = (long) count * sizeMb * MIB;
        log.debug("Generated {} test files ({} bytes) in {}", count, totalBytes, directory);
        return new TestFileSet(directory, files, totalBytes);
    }

    public Path getDirectory() {
        return directory;
    }

    public List<Path> getFiles() {
        return files;
    }

    public List<String> getFileNames() {
        return files.stream().map(Path::toString).collect(Collectors.toList());
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    @Override
    public void close() {
        deleteRecursively(directory);
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete test file {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up test directory {}: {}", directory, e.getMessage());
        }
    }
}
