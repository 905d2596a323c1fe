package io.github.manjago.mathcaptcha.captcha;

import io.github.manjago.mathcaptcha.core.Expression;
import io.github.manjago.mathcaptcha.render.CaptchaFiles;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Everything the manager tracks for one captcha key.
 * <p>
 * State changes are compare-and-set, so when expiry and an explicit cleanup race,
 * exactly one of them performs the removal.
 */
public final class CaptchaRecord {

    private final String key;
    private final Expression expression;
    private final String markup;
    private final double answer;
    private final CaptchaFiles files;
    private final Instant createdAt;

    private final AtomicReference<CaptchaState> state = new AtomicReference<>(CaptchaState.PENDING);
    private final CompletableFuture<String> ready = new CompletableFuture<>();
    private final CompletableFuture<Void> released = new CompletableFuture<>();
    private volatile ScheduledFuture<?> expiry;

    CaptchaRecord(String key, Expression expression, String markup, double answer,
                  CaptchaFiles files, Instant createdAt) {
        this.key = key;
        this.expression = expression;
        this.markup = markup;
        this.answer = answer;
        this.files = files;
        this.createdAt = createdAt;
    }

    // ========== Getters ==========

    public String getKey() {
        return key;
    }

    public Expression getExpression() {
        return expression;
    }

    /**
     * LaTeX math, without document scaffolding.
     */
    public String getMarkup() {
        return markup;
    }

    public double getAnswer() {
        return answer;
    }

    public CaptchaFiles getFiles() {
        return files;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CaptchaState getState() {
        return state.get();
    }

    public boolean isReady() {
        return state.get() == CaptchaState.READY;
    }

    // ========== Lifecycle ==========

    /**
     * Completes with the key once the image exists, or fails with the pipeline error.
     */
    CompletableFuture<String> ready() {
        return ready;
    }

    /**
     * PENDING -&gt; READY.
     *
     * @return false if the record was removed in the meantime
     */
    boolean markReady() {
        return state.compareAndSet(CaptchaState.PENDING, CaptchaState.READY);
    }

    /**
     * Move to REMOVED from whatever state the record is in.
     *
     * @return the previous state; REMOVED means someone else got there first
     */
    CaptchaState markRemoved() {
        return state.getAndSet(CaptchaState.REMOVED);
    }

    /**
     * Completes once the record is removed and its files are deleted.
     */
    CompletableFuture<Void> released() {
        return released;
    }

    void markReleased() {
        released.complete(null);
    }

    void setExpiry(ScheduledFuture<?> expiry) {
        this.expiry = expiry;
        // cleanup may have run between markReady() and here
        if (state.get() == CaptchaState.REMOVED) {
            expiry.cancel(false);
        }
    }

    void cancelExpiry() {
        ScheduledFuture<?> current = expiry;
        if (current != null) {
            current.cancel(false);
        }
    }

    @Override
    public String toString() {
        return String.format("Captcha[%s, %s, answer=%s, created=%s]",
                CaptchaKeys.shorten(key), state.get(), answer, createdAt);
    }
}
