package com.aviax.media.backend;

import com.aviax.common.infra.CancellationToken;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs an external executable with a hard timeout, capturing stdout and
 * stderr. The process and its descendants (yt-dlp's ffmpeg children) are
 * killed on timeout, cancellation or interrupt.
 */
@Slf4j
public class ProcessRunner {

    /**
     * Result of a finished (or killed) process.
     *
     * @param exitCode process exit code, -1 if killed
     * @param stdout   captured standard output
     * @param stderr   captured standard error
     * @param timedOut the timeout elapsed and the process was killed
     */
    public record Result(int exitCode, String stdout, String stderr, boolean timedOut) {

        public boolean ok() {
            return !timedOut && exitCode == 0;
        }

        /** First non-blank stdout line, trimmed, or empty. */
        public String firstLine() {
            for (String line : stdout.split("\\R")) {
                if (!line.isBlank()) {
                    return line.trim();
                }
            }
            return "";
        }
    }

    /**
     * Start the command and wait up to {@code timeout}.
     *
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if interrupted or cancelled; the process is killed
     */
    public Result run(List<String> command, Duration timeout, CancellationToken token)
            throws IOException, InterruptedException {
        token.throwIfCancelled();
        log.debug("exec: {}", command);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().put("PYTHONIOENCODING", "utf-8");
        Process process = pb.start();
        process.getOutputStream().close();

        StreamCollector out = new StreamCollector(process.getInputStream(), "stdout");
        StreamCollector err = new StreamCollector(process.getErrorStream(), "stderr");
        out.start();
        err.start();

        Runnable unregister = token.onCancel(() -> kill(process));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                kill(process);
                process.waitFor(5, TimeUnit.SECONDS);
                return new Result(-1, out.await(), err.await(), true);
            }
            token.throwIfCancelled();
            return new Result(process.exitValue(), out.await(), err.await(), false);
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        } finally {
            unregister.run();
        }
    }

    // Descendants are snapshotted first; once the parent dies they are reparented and unreachable
    static void kill(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        for (ProcessHandle child : descendants) {
            child.destroyForcibly();
        }
    }

    private static final class StreamCollector extends Thread {
        private final InputStream stream;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        StreamCollector(InputStream stream, String name) {
            super("process-" + name);
            this.stream = stream;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (InputStream in = stream) {
                in.transferTo(buffer);
            } catch (IOException e) {
                log.debug("Process stream closed: {}", e.getMessage());
            }
        }

        String await() throws InterruptedException {
            join(TimeUnit.SECONDS.toMillis(5));
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
