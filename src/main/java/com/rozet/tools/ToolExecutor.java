package com.rozet.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Read/write/list/bash operations confined to one working directory. Every operation
 * reports failure through its result instead of throwing.
 */
@Slf4j
public class ToolExecutor {

    public static final Duration DEFAULT_BASH_TIMEOUT = Duration.ofSeconds(60);

    private final Path workingDir;
    private final Duration defaultBashTimeout;

    public ToolExecutor(Path workingDir) {
        this(workingDir, DEFAULT_BASH_TIMEOUT);
    }

    public ToolExecutor(Path workingDir, Duration defaultBashTimeout) {
        this.workingDir = workingDir.toAbsolutePath().normalize();
        this.defaultBashTimeout = defaultBashTimeout;
        try {
            Files.createDirectories(this.workingDir);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create working directory " + this.workingDir, ex);
        }
    }

    public Path getWorkingDir() {
        return workingDir;
    }

    public FileReadResult readFile(String path) {
        try {
            Path file = resolvePath(path);
            if (!Files.exists(file)) {
                return FileReadResult.failed("File does not exist: " + path);
            }
            if (!Files.isRegularFile(file)) {
                return FileReadResult.failed("Path is not a file: " + path);
            }
            return FileReadResult.ok(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | IllegalArgumentException ex) {
            log.error("Failed to read file {}: {}", path, ex.getMessage());
            return FileReadResult.failed(ex.getMessage());
        }
    }

    public FileWriteResult writeFile(String path, String content) {
        String safeContent = content == null ? "" : content;
        try {
            Path file = resolvePath(path);
            if (Files.exists(file) && !Files.isRegularFile(file)) {
                return FileWriteResult.failed(path, "Path is not a file: " + path);
            }
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, safeContent, StandardCharsets.UTF_8);
            boolean verified = safeContent.equals(Files.readString(file, StandardCharsets.UTF_8));
            return new FileWriteResult(true, toRelative(file), safeContent.length(), verified, null);
        } catch (IOException | IllegalArgumentException ex) {
            log.error("Failed to write file {}: {}", path, ex.getMessage());
            return FileWriteResult.failed(path, ex.getMessage());
        }
    }

    public FileListResult listFiles(String directory, String pattern) {
        String safeDirectory = StringUtils.hasText(directory) ? directory : ".";
        String safePattern = StringUtils.hasText(pattern) ? pattern : "*";
        try {
            Path dir = resolvePath(safeDirectory);
            if (!Files.isDirectory(dir)) {
                return FileListResult.failed("Directory does not exist: " + safeDirectory);
            }
            int depth = safePattern.contains("/") || safePattern.contains("**") ? Integer.MAX_VALUE : 1;
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + safePattern);
            try (Stream<Path> stream = Files.walk(dir, depth)) {
                List<String> files = stream
                        .filter(candidate -> !candidate.equals(dir))
                        .filter(candidate -> matcher.matches(dir.relativize(candidate)))
                        .map(this::toRelative)
                        .sorted()
                        .toList();
                return new FileListResult(true, files, null);
            }
        } catch (IOException | IllegalArgumentException ex) {
            log.error("Failed to list files in {}: {}", safeDirectory, ex.getMessage());
            return FileListResult.failed(ex.getMessage());
        }
    }

    public BashResult executeBash(String command) {
        return executeBash(command, defaultBashTimeout);
    }

    public BashResult executeBash(String command, Duration timeout) {
        log.info("Executing bash: {}", command);
        Process process;
        try {
            process = new ProcessBuilder("bash", "-c", command)
                    .directory(workingDir.toFile())
                    .start();
        } catch (IOException ex) {
            log.error("Bash command failed to start: {}", ex.getMessage());
            return BashResult.failed(ex.getMessage());
        }
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.error("Bash command timed out: {}", command);
                return BashResult.failed("Command timed out after " + formatSeconds(timeout) + "s");
            }
            int exitCode = process.exitValue();
            return new BashResult(exitCode == 0,
                    stdout.get(5, TimeUnit.SECONDS),
                    stderr.get(5, TimeUnit.SECONDS),
                    exitCode);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return BashResult.failed("Interrupted while running command");
        } catch (ExecutionException | TimeoutException ex) {
            log.error("Failed to collect output of bash command {}: {}", command, ex.getMessage());
            return BashResult.failed(String.valueOf(ex.getMessage()));
        }
    }

    public boolean exists(String path) {
        try {
            return Files.exists(resolvePath(path));
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    private Path resolvePath(String path) {
        if (!StringUtils.hasText(path)) {
            throw new IllegalArgumentException("Path is required.");
        }
        Path target = workingDir.resolve(path).normalize();
        if (!target.startsWith(workingDir)) {
            throw new IllegalArgumentException("Invalid path: " + path);
        }
        return target;
    }

    private String toRelative(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (normalized.equals(workingDir)) {
            return "";
        }
        return workingDir.relativize(normalized).toString().replace("\\", "/");
    }

    static String formatSeconds(Duration timeout) {
        return BigDecimal.valueOf(timeout.toMillis(), 3).stripTrailingZeros().toPlainString();
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
