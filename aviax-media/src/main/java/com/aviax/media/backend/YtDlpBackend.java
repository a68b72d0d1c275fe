package com.aviax.media.backend;

import com.aviax.common.config.AviaxConfig;
import com.aviax.common.infra.Binaries;
import com.aviax.common.infra.CancellationToken;
import com.aviax.media.MediaException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extraction backend running the yt-dlp executable and reading its
 * single-JSON output.
 */
@Slf4j
public class YtDlpBackend implements ExtractionBackend {

    private static final Pattern NO_RESULTS = Pattern.compile(
            "no video results|no results|did not match any", Pattern.CASE_INSENSITIVE);
    private static final int STDERR_TAIL_CHARS = 400;

    private final ObjectMapper mapper = new ObjectMapper();
    private final String executable;
    private final Duration processTimeout;
    private final ProcessRunner runner;

    public YtDlpBackend(AviaxConfig.ExtractionConfig config) {
        this(Binaries.resolveExecutable(config.getExecutable()),
                Duration.ofSeconds(config.getProcessTimeoutSeconds()),
                new ProcessRunner());
    }

    public YtDlpBackend(String executable, Duration processTimeout, ProcessRunner runner) {
        this.executable = executable;
        this.processTimeout = processTimeout;
        this.runner = runner;
    }

    @Override
    public ExtractedInfo extract(String query, ExtractionOptions options, boolean download, CancellationToken token)
            throws MediaException, InterruptedException {
        List<String> command = buildCommand(query, options, download);
        ProcessRunner.Result result;
        try {
            result = runner.run(command, processTimeout, token);
        } catch (IOException e) {
            throw new MediaException.TransientExtractionException(
                    "failed to start " + executable + ": " + e.getMessage(), e);
        }
        return parseResult(query, result);
    }

    List<String> buildCommand(String query, ExtractionOptions options, boolean download) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(options.toArguments());
        command.add("--dump-single-json");
        if (download) {
            command.add("--no-simulate");
        }
        command.add("--");
        command.add(query);
        return command;
    }

    ExtractedInfo parseResult(String query, ProcessRunner.Result result) throws MediaException {
        if (result.timedOut()) {
            throw new MediaException.TransientExtractionException("yt-dlp timed out for " + query);
        }
        if (result.exitCode() != 0) {
            String tail = tail(result.stderr());
            if (NO_RESULTS.matcher(tail).find()) {
                throw new MediaException.NoResultsException("no results for " + query);
            }
            throw new MediaException.TransientExtractionException(
                    "yt-dlp exit code=" + result.exitCode() + ": " + tail);
        }
        String stdout = result.stdout().trim();
        if (stdout.isEmpty()) {
            throw new MediaException.TransientExtractionException("empty response for " + query);
        }
        try {
            JsonNode root = mapper.readTree(lastJsonLine(stdout));
            if (root == null || !root.isObject()) {
                throw new MediaException.TransientExtractionException("unexpected response for " + query);
            }
            return ExtractedInfo.fromJson(root);
        } catch (JsonProcessingException e) {
            throw new MediaException.TransientExtractionException(
                    "unparseable response for " + query + ": " + e.getOriginalMessage(), e);
        }
    }

    // Download mode may print progress lines before the JSON document.
    private static String lastJsonLine(String stdout) {
        String[] lines = stdout.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (line.startsWith("{")) {
                return line;
            }
        }
        return stdout;
    }

    private static String tail(String stderr) {
        String trimmed = stderr == null ? "" : stderr.trim();
        if (trimmed.length() > STDERR_TAIL_CHARS) {
            trimmed = trimmed.substring(trimmed.length() - STDERR_TAIL_CHARS);
        }
        return trimmed.isEmpty() ? "(no output)" : trimmed;
    }
}
