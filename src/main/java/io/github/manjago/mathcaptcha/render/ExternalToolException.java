package io.github.manjago.mathcaptcha.render;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Serial;

/**
 * A pipeline stage failed: the source file could not be written, or LaTeX or
 * dvipng could not be started, timed out, or exited with a non-zero status.
 */
public class ExternalToolException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    /** Marker for failures where no process exit code exists. */
    public static final int NO_EXIT_CODE = -1;

    private final PipelineStage stage;
    private final int exitCode;
    private final String output;

    public ExternalToolException(@NotNull PipelineStage stage, String message, Throwable cause) {
        super(stage.getDescription() + " failed: " + message, cause);
        this.stage = stage;
        this.exitCode = NO_EXIT_CODE;
        this.output = "";
    }

    public ExternalToolException(@NotNull PipelineStage stage, int exitCode, @Nullable String output) {
        super(String.format("%s failed with exit code %d%s",
                stage.getDescription(), exitCode, formatOutput(output)));
        this.stage = stage;
        this.exitCode = exitCode;
        this.output = output != null ? output : "";
    }

    public PipelineStage getStage() {
        return stage;
    }

    /**
     * @return process exit code, or {@link #NO_EXIT_CODE}
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * @return captured tool output (may be empty)
     */
    public String getOutput() {
        return output;
    }

    private static String formatOutput(String output) {
        if (output == null || output.isBlank()) {
            return "";
        }
        String trimmed = output.strip();
        // LaTeX puts the actual error at the end of its output
        if (trimmed.length() > 500) {
            trimmed = "..." + trimmed.substring(trimmed.length() - 500);
        }
        return ":\n" + trimmed;
    }
}
