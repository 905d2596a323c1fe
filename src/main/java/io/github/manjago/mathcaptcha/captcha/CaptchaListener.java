package io.github.manjago.mathcaptcha.captcha;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Listener for captcha lifecycle events.
 * <p>
 * Called on pipeline and scheduler threads, so implementations must be
 * thread-safe and should return quickly.
 */
public interface CaptchaListener {

    /**
     * Called when a captcha image is ready.
     *
     * @param key   captcha key
     * @param image path to the PNG
     */
    default void onReady(String key, Path image) {}

    /**
     * Called when generation fails.
     *
     * @param key   captcha key, or null if the failure happened before a key existed
     * @param error the cause
     */
    default void onFailure(@Nullable String key, Throwable error) {}

    /**
     * Called when a captcha is removed and its files deleted.
     *
     * @param key     captcha key
     * @param expired true if removed by the expiry timer, false for an explicit cleanup
     */
    default void onCleanup(String key, boolean expired) {}

    /**
     * No-op listener that does nothing.
     */
    CaptchaListener NOOP = new CaptchaListener() {};
}
