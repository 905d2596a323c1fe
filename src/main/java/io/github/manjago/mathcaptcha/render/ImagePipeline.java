package io.github.manjago.mathcaptcha.render;

import io.github.manjago.mathcaptcha.config.CaptchaConfig;
import io.github.manjago.mathcaptcha.core.InvalidConfigException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Turns a LaTeX document into a PNG image through LaTeX and dvipng.
 * <p>
 * Stages run strictly in order: write {@code <key>.tex}, typeset it to
 * {@code <key>.dvi}, rasterize that to {@code <key>.png}. The first failing
 * stage aborts with an {@link ExternalToolException} naming it.
 * <p>
 * Colors are normalized once at construction, so a bad color fails fast
 * instead of on every captcha.
 */
public class ImagePipeline {

    private static final Logger log = LoggerFactory.getLogger(ImagePipeline.class);

    private final CaptchaConfig config;
    private final CommandRunner runner;
    private final String foregroundArg;
    private final String backgroundArg;

    /**
     * @throws InvalidConfigException if a configured color cannot be parsed
     */
    public ImagePipeline(@NotNull CaptchaConfig config, @NotNull CommandRunner runner) {
        this.config = config;
        this.runner = runner;
        this.foregroundArg = ColorParser.toDvipng(config.foreground());
        this.backgroundArg = ColorParser.toDvipng(config.background());
    }

    public @NotNull CaptchaFiles filesFor(@NotNull String key) {
        return CaptchaFiles.of(config.workDirectory(), key);
    }

    /**
     * Run all three stages.
     */
    public void render(@NotNull CaptchaFiles files, @NotNull String document) throws ExternalToolException {
        writeSource(files, document);
        typeset(files);
        rasterize(files);
    }

    public void writeSource(@NotNull CaptchaFiles files, @NotNull String document) throws ExternalToolException {
        try {
            Files.createDirectories(files.source().getParent());
            Files.writeString(files.source(), document, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExternalToolException(PipelineStage.WRITE_SOURCE,
                    "cannot write " + files.source() + ": " + e.getMessage(), e);
        }
    }

    public void typeset(@NotNull CaptchaFiles files) throws ExternalToolException {
        runStage(PipelineStage.TYPESET, typesetCommand(files));
    }

    public void rasterize(@NotNull CaptchaFiles files) throws ExternalToolException {
        runStage(PipelineStage.RASTERIZE, rasterizeCommand(files));
    }

    /**
     * {@code latex -halt-on-error -output-directory=<dir> <key>.tex}
     */
    public List<String> typesetCommand(@NotNull CaptchaFiles files) {
        return List.of(
            config.latexPath().toString(),
            "-halt-on-error",
            "-output-directory=" + config.workDirectory(),
            files.source().toString()
        );
    }

    /**
     * {@code dvipng -fg <fg> -bg <bg> -T <bounding> -D <dpi> -o <key>.png <key>.dvi}
     */
    public List<String> rasterizeCommand(@NotNull CaptchaFiles files) {
        return List.of(
            config.dvipngPath().toString(),
            "-fg", foregroundArg,
            "-bg", backgroundArg,
            "-T", config.bounding(),
            "-D", String.valueOf(config.resolution()),
            "-o", files.image().toString(),
            files.dvi().toString()
        );
    }

    /**
     * Delete every artifact of a captcha, ignoring failures.
     *
     * @return number of files actually deleted
     */
    public int deleteArtifacts(@NotNull CaptchaFiles files) {
        int deleted = 0;
        for (Path path : files.all()) {
            try {
                if (Files.deleteIfExists(path)) {
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Could not delete {}: {}", path, e.getMessage());
            }
        }
        return deleted;
    }

    private void runStage(PipelineStage stage, List<String> command) throws ExternalToolException {
        CommandRunner.Result result;
        try {
            result = runner.run(command, config.workDirectory(), config.processTimeout());
        } catch (IOException e) {
            throw new ExternalToolException(stage, "cannot run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new ExternalToolException(stage, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(stage, "interrupted", e);
        }

        if (!result.isSuccess()) {
            throw new ExternalToolException(stage, result.exitCode(), result.output());
        }
    }
}
