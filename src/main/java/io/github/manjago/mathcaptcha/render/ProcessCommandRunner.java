package io.github.manjago.mathcaptcha.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 * <p>
 * stderr is merged into stdout, which is drained on a separate thread so a
 * chatty tool cannot block on a full pipe.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    /** Grace period for collecting output after the process exited. */
    private static final long OUTPUT_DRAIN_SECONDS = 5;

    @Override
    public Result run(List<String> command, Path workingDirectory, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());
        pb.redirectErrorStream(true);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);

        log.debug("Running: {}", String.join(" ", command));
        Process process = pb.start();
        // Nothing is ever sent; closing stdin makes an interactive TeX prompt fail fast
        process.getOutputStream().close();

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new TimeoutException(String.format("%s did not finish within %d ms",
                    command.get(0), timeout.toMillis()));
        }

        int exitCode = process.exitValue();
        String text;
        try {
            text = output.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Could not collect output of {}", command.get(0), e);
            text = "";
        }

        log.debug("{} exited with code {}", command.get(0), exitCode);
        return new Result(exitCode, text);
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
