package io.github.manjago.mathcaptcha.render;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands (LaTeX, dvipng).
 * <p>
 * Kept behind an interface so the pipeline can be exercised without a TeX
 * installation.
 */
public interface CommandRunner {

    /**
     * Run a command to completion.
     *
     * @param command          program and arguments, no shell interpretation
     * @param workingDirectory directory to run in
     * @param timeout          maximum time to wait
     * @return exit code and combined stdout/stderr
     * @throws IOException          if the process cannot be started
     * @throws TimeoutException     if it does not finish in time (it is killed)
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Result run(List<String> command, Path workingDirectory, Duration timeout)
            throws IOException, TimeoutException, InterruptedException;

    /**
     * Outcome of a finished process.
     */
    record Result(int exitCode, String output) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
