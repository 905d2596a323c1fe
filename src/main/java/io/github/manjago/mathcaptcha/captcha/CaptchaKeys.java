package io.github.manjago.mathcaptcha.captcha;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content-derived captcha keys.
 * <p>
 * A key is the hex SHA-256 of the full LaTeX document, so identical documents
 * always map to the same key and the same files.
 */
public final class CaptchaKeys {

    private static final String ALGORITHM = "SHA-256";
    private static final int SHORT_LENGTH = 8;

    private CaptchaKeys() {}

    @Contract(pure = true)
    public static @NotNull String derive(@NotNull String document) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(document.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }

    /**
     * First few hex digits, for log lines.
     */
    @Contract(pure = true)
    public static @NotNull String shorten(@NotNull String key) {
        return key.length() <= SHORT_LENGTH ? key : key.substring(0, SHORT_LENGTH);
    }
}
