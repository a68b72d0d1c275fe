package com.aviax.media.acquire;

import com.aviax.common.config.AviaxConfig;
import com.aviax.common.infra.Binaries;
import com.aviax.common.infra.CancellationToken;
import com.aviax.media.MediaException;
import com.aviax.media.backend.ProcessRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs {@code yt-dlp -g} and takes the first stdout line as the stream URL.
 * The process is killed when the timeout elapses.
 */
@Slf4j
public class YtDlpDirectLinkResolver implements DirectLinkResolver {

    private final String executable;
    private final Duration timeout;
    private final ProcessRunner runner;

    public YtDlpDirectLinkResolver(AviaxConfig config) {
        this(Binaries.resolveExecutable(config.getExtraction().getExecutable()),
                Duration.ofSeconds(config.getDownload().getDirectLinkTimeoutSeconds()),
                new ProcessRunner());
    }

    public YtDlpDirectLinkResolver(String executable, Duration timeout, ProcessRunner runner) {
        this.executable = executable;
        this.timeout = timeout;
        this.runner = runner;
    }

    @Override
    public String resolve(String link, CancellationToken token)
            throws MediaException.DirectResolutionException, InterruptedException {
        List<String> command = List.of(executable, "-g", "-f", FormatSelector.PROGRESSIVE_VIDEO_FORMAT, "--", link);
        ProcessRunner.Result result;
        try {
            result = runner.run(command, timeout, token);
        } catch (IOException e) {
            throw new MediaException.DirectResolutionException("failed to start " + executable, e);
        }
        if (result.timedOut()) {
            throw new MediaException.DirectResolutionException("timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            throw new MediaException.DirectResolutionException("exit code " + result.exitCode());
        }
        String url = result.firstLine();
        if (url.isEmpty()) {
            throw new MediaException.DirectResolutionException("no URL printed for " + link);
        }
        return url;
    }
}
