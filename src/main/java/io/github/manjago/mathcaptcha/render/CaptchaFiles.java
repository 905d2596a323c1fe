package io.github.manjago.mathcaptcha.render;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.List;

/**
 * Files produced for one captcha key, all named {@code <key>.<ext>} in the work directory.
 */
public record CaptchaFiles(Path source, Path aux, Path dvi, Path log, Path image) {

    public static @NotNull CaptchaFiles of(@NotNull Path directory, @NotNull String key) {
        return new CaptchaFiles(
            directory.resolve(key + ".tex"),
            directory.resolve(key + ".aux"),
            directory.resolve(key + ".dvi"),
            directory.resolve(key + ".log"),
            directory.resolve(key + ".png")
        );
    }

    /**
     * Every artifact that may exist, for cleanup.
     */
    public List<Path> all() {
        return List.of(source, aux, dvi, log, image);
    }
}
