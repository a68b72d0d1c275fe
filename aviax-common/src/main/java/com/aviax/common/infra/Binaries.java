package com.aviax.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Locates external executables (yt-dlp, ffmpeg) via {@code which} / {@code where}.
 */
public final class Binaries {

    private Binaries() {
    }

    private static final Logger log = LoggerFactory.getLogger(Binaries.class);
    private static final long TIMEOUT_MS = 5_000;

    /**
     * Resolve a configured executable: an existing path is returned as-is,
     * a bare name is looked up on PATH, and an unresolvable name is returned
     * unchanged so that the process launch reports the real error.
     */
    public static String resolveExecutable(String configured) {
        if (configured == null || configured.isBlank()) {
            throw new IllegalArgumentException("executable must not be blank");
        }
        String trimmed = configured.trim();
        if (trimmed.contains("/") || trimmed.contains("\\")) {
            if (!Files.isRegularFile(Path.of(trimmed))) {
                log.warn("Configured executable does not exist: {}", trimmed);
            }
            return trimmed;
        }
        String resolved = resolveBinaryPath(trimmed);
        if (resolved == null) {
            log.debug("Executable '{}' not found on PATH", trimmed);
            return trimmed;
        }
        return resolved;
    }

    /**
     * Resolve the full path of a binary on PATH.
     *
     * @return the absolute path, or null if not found
     */
    public static String resolveBinaryPath(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        try {
            String cmd = isWindows() ? "where" : "which";
            ProcessBuilder pb = new ProcessBuilder(cmd, name.trim())
                    .redirectErrorStream(false);
            Process process = pb.start();
            String firstLine;
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream()))) {
                firstLine = reader.readLine();
            }
            boolean finished = process.waitFor(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return null;
            }
            if (process.exitValue() == 0 && firstLine != null && !firstLine.isBlank()) {
                return firstLine.trim();
            }
            return null;
        } catch (IOException e) {
            log.debug("Binary lookup for '{}' failed: {}", name, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private static boolean isWindows() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.contains("win");
    }
}
