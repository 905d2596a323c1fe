package io.github.manjago.mathcaptcha.captcha;

/**
 * Lifecycle of a captcha record.
 * <pre>
 * PENDING --(pipeline ok)----------------&gt; READY
 * PENDING --(pipeline failed / cleanup)--&gt; REMOVED
 * READY   --(cleanup / expiry)-----------&gt; REMOVED
 * </pre>
 * REMOVED is terminal.
 */
public enum CaptchaState {

    /** Image is being produced; not visible to getImage/check. */
    PENDING,

    /** Image exists; expiry timer armed. */
    READY,

    /** Cleaned up, expired, or failed. */
    REMOVED
}
