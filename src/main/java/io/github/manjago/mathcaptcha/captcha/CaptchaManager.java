package io.github.manjago.mathcaptcha.captcha;

import io.github.manjago.mathcaptcha.config.CaptchaConfig;
import io.github.manjago.mathcaptcha.core.*;
import io.github.manjago.mathcaptcha.render.CaptchaFiles;
import io.github.manjago.mathcaptcha.render.CommandRunner;
import io.github.manjago.mathcaptcha.render.ExternalToolException;
import io.github.manjago.mathcaptcha.render.ImagePipeline;
import io.github.manjago.mathcaptcha.render.ProcessCommandRunner;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Creates math captchas, answers checks against them, and removes them again.
 * <p>
 * {@link #generate()} draws a random expression, computes its answer, renders it
 * to LaTeX and keys it by the SHA-256 of the document. The image is produced on a
 * worker thread (write source, LaTeX, dvipng); once it exists the captcha is
 * READY and an expiry timer is armed. Expiry and {@link #cleanup(String)} take the
 * same path and only the first one to arrive does anything.
 * <p>
 * Keys come from clients and are untrusted: unknown keys never raise, they just
 * read as absent.
 * <p>
 * Two generations that produce the same document share one record: the second
 * call joins the first and completes with the same key. A record that is already
 * being removed is not joined; the new call takes its place and starts its
 * pipeline once the old files are gone.
 * <p>
 * All tracking is in memory. Files left behind by a crashed process are not
 * reclaimed on the next start.
 */
public class CaptchaManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CaptchaManager.class);

    private final CaptchaConfig config;
    private final OperatorRegistry registry;
    private final ExpressionGenerator generator;
    private final ImagePipeline pipeline;

    private final Map<String, CaptchaRecord> records = new ConcurrentHashMap<>();

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    // Statistics
    private final AtomicLong generated = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong deduplicated = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong cleanedUp = new AtomicLong();

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile CaptchaListener listener = CaptchaListener.NOOP;

    /**
     * Manager with the standard operators, running the real LaTeX and dvipng.
     */
    public CaptchaManager(@NotNull CaptchaConfig config) {
        this(config, OperatorRegistry.standard(), new ProcessCommandRunner());
    }

    /**
     * @param config   configuration
     * @param registry operators to draw from (more can be registered until the first generate)
     * @param runner   how external tools are executed
     * @throws InvalidConfigException if a configured color cannot be parsed
     */
    public CaptchaManager(@NotNull CaptchaConfig config,
                          @NotNull OperatorRegistry registry,
                          @NotNull CommandRunner runner) {
        this.config = config;
        this.registry = registry;
        CaptchaRng rng = CaptchaRng.forSeed(config.randomSeed());
        this.generator = new ExpressionGenerator(registry, rng);
        this.pipeline = new ImagePipeline(config, runner);
        this.workers = Executors.newFixedThreadPool(
                Math.max(1, config.pipelineThreads()), daemonThreads("captcha-pipeline"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("captcha-expiry"));

        log.info("Captcha manager created (work dir: {}, seed: {}, {} operators)",
                config.workDirectory(), rng.getSeed(), registry.size());
    }

    /**
     * Add an operator. Only allowed before the first {@link #generate()}.
     *
     * @throws IllegalStateException if generation has already started
     */
    public void registerOperator(@NotNull Operator operator) {
        registry.register(operator);
    }

    /**
     * Set event listener for lifecycle events.
     */
    public void setListener(CaptchaListener listener) {
        this.listener = listener != null ? listener : CaptchaListener.NOOP;
    }

    // ========== Generation ==========

    /**
     * Start generating a new captcha.
     *
     * @return future completing with the captcha key once its image exists; fails with
     *         {@link InvalidConfigException}, {@link EmptyRegistryException} or
     *         {@link ExternalToolException}
     */
    public CompletableFuture<String> generate() {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Captcha manager is closed"));
        }
        registry.freeze();

        Expression expression;
        try {
            expression = generator.generate(config.minOps(), config.maxOps(), config.values());
        } catch (InvalidConfigException | EmptyRegistryException e) {
            log.warn("Cannot generate captcha: {}", e.getMessage());
            failed.incrementAndGet();
            listener.onFailure(null, e);
            return CompletableFuture.failedFuture(e);
        }

        double answer = ExpressionEvaluator.evaluate(expression);
        String markup = LatexRenderer.render(expression);
        String document = LatexRenderer.wrapDocument(markup);
        String key = CaptchaKeys.derive(document);

        CaptchaRecord record = new CaptchaRecord(
                key, expression, markup, answer, pipeline.filesFor(key), Instant.now());

        // A REMOVED record is on its way out: take its slot instead of joining it
        CaptchaRecord predecessor = null;
        CaptchaRecord existing = records.putIfAbsent(key, record);
        while (existing != null) {
            if (existing.getState() != CaptchaState.REMOVED) {
                deduplicated.incrementAndGet();
                log.debug("Captcha {} already exists ({}), joining it", CaptchaKeys.shorten(key), existing.getState());
                return existing.ready().copy();
            }
            if (records.replace(key, existing, record)) {
                predecessor = existing;
                break;
            }
            existing = records.putIfAbsent(key, record);
        }

        log.debug("Captcha {}: {} = {}", CaptchaKeys.shorten(key), markup, answer);

        if (predecessor == null) {
            submit(record, document);
        } else {
            // Same files as the removed record: start once it has deleted them
            log.debug("Captcha {} replaces a removed record, waiting for its files", CaptchaKeys.shorten(key));
            predecessor.released().whenComplete((ignored, error) -> submit(record, document));
        }
        return record.ready().copy();
    }

    private void submit(CaptchaRecord record, String document) {
        try {
            workers.execute(() -> runPipeline(record, document));
        } catch (RejectedExecutionException e) {
            record.markRemoved();
            record.markReleased();
            records.remove(record.getKey(), record);
            failed.incrementAndGet();
            record.ready().completeExceptionally(new IllegalStateException("Captcha manager is closed", e));
        }
    }

    /**
     * Callback form of {@link #generate()}. Exactly one of the callbacks is invoked,
     * on a pipeline thread (or the calling thread if generation fails immediately).
     */
    public void generate(@NotNull Consumer<String> onSuccess, @NotNull Consumer<Throwable> onFailure) {
        generate().whenComplete((key, error) -> {
            if (error != null) {
                onFailure.accept(unwrap(error));
            } else {
                onSuccess.accept(key);
            }
        });
    }

    private void runPipeline(CaptchaRecord record, String document) {
        String key = record.getKey();
        CaptchaFiles files = record.getFiles();

        try {
            pipeline.render(files, document);
        } catch (ExternalToolException | RuntimeException e) {
            String stage = e instanceof ExternalToolException ete ? ete.getStage().getDescription() : "pipeline";
            log.warn("Captcha {} failed at {}: {}", CaptchaKeys.shorten(key), stage, e.getMessage());
            discard(record);
            failed.incrementAndGet();
            listener.onFailure(key, e);
            record.ready().completeExceptionally(e);
            return;
        }

        if (!record.markReady()) {
            // cleanup() ran while the image was being produced
            discard(record);
            cleanedUp.incrementAndGet();
            listener.onCleanup(key, false);
            record.ready().completeExceptionally(
                    new CancellationException("Captcha " + key + " was cleaned up before it was ready"));
            return;
        }

        try {
            record.setExpiry(scheduler.schedule(
                    () -> expire(key), config.cleanupTime().toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            // closing; close() removes whatever is left
            log.debug("Expiry not armed for {}: scheduler is shut down", CaptchaKeys.shorten(key));
        }

        generated.incrementAndGet();
        log.info("Captcha {} ready in {} ms ({} operators): {}",
                CaptchaKeys.shorten(key),
                Duration.between(record.getCreatedAt(), Instant.now()).toMillis(),
                record.getExpression().operatorCount(),
                files.image());
        listener.onReady(key, files.image());
        record.ready().complete(key);
    }

    /**
     * Remove a record whose pipeline has finished and delete its files.
     */
    private void discard(CaptchaRecord record) {
        record.markRemoved();
        record.cancelExpiry();
        pipeline.deleteArtifacts(record.getFiles());
        record.markReleased();
        records.remove(record.getKey(), record);
    }

    // ========== Queries ==========

    /**
     * Path to the image of a ready captcha.
     *
     * @return the PNG path, or null if the key is unknown or not ready yet
     */
    public @Nullable Path getImage(@Nullable String key) {
        CaptchaRecord record = readyRecord(key);
        return record != null ? record.getFiles().image() : null;
    }

    /**
     * LaTeX markup of a ready captcha.
     *
     * @return the markup, or null if the key is unknown or not ready yet
     */
    public @Nullable String getMarkup(@Nullable String key) {
        CaptchaRecord record = readyRecord(key);
        return record != null ? record.getMarkup() : null;
    }

    /**
     * Check an answer, rounding both sides to {@code places} decimal places
     * (half up) before comparing.
     *
     * @param key    captcha key
     * @param answer user's answer
     * @param places decimal places; negative counts as 0
     * @return true if the rounded values match; false for unknown or pending keys
     */
    public boolean check(@Nullable String key, double answer, int places) {
        CaptchaRecord record = readyRecord(key);
        if (record == null) {
            return false;
        }
        double expected = record.getAnswer();
        if (Double.isNaN(expected) || Double.isNaN(answer)) {
            return false;
        }
        double shift = Math.pow(10, Math.max(0, places));
        double scaledExpected = expected * shift;
        double scaledAnswer = answer * shift;
        if (Double.isInfinite(scaledExpected) || Double.isInfinite(scaledAnswer)) {
            // More places than a double can scale to: only the exact value matches
            return expected == answer;
        }
        return Math.floor(scaledExpected + 0.5) == Math.floor(scaledAnswer + 0.5);
    }

    private @Nullable CaptchaRecord readyRecord(@Nullable String key) {
        if (key == null) {
            return null;
        }
        CaptchaRecord record = records.get(key);
        return record != null && record.isReady() ? record : null;
    }

    // ========== Cleanup ==========

    /**
     * Remove a captcha and delete its files. Safe to call any number of times,
     * with any key; file deletion problems are logged, never thrown.
     * <p>
     * A captcha still being produced is marked removed; its pipeline deletes
     * the files when it finishes and its future fails with a {@link CancellationException}.
     */
    public void cleanup(@Nullable String key) {
        if (key == null) {
            return;
        }
        CaptchaRecord record = records.get(key);
        if (record != null) {
            remove(record, false);
        }
    }

    private void expire(String key) {
        CaptchaRecord record = records.get(key);
        if (record != null) {
            remove(record, true);
        }
    }

    private void remove(CaptchaRecord record, boolean byTimer) {
        CaptchaState previous = record.markRemoved();
        if (previous == CaptchaState.REMOVED) {
            return;
        }
        record.cancelExpiry();

        String key = record.getKey();
        if (previous == CaptchaState.PENDING) {
            log.debug("Captcha {} removed while pending, pipeline will clean up", CaptchaKeys.shorten(key));
            return;
        }

        int deleted = pipeline.deleteArtifacts(record.getFiles());
        record.markReleased();
        records.remove(key, record);
        if (byTimer) {
            expired.incrementAndGet();
        } else {
            cleanedUp.incrementAndGet();
        }
        log.debug("Captcha {} {} ({} files deleted)", CaptchaKeys.shorten(key), byTimer ? "expired" : "cleaned up", deleted);
        listener.onCleanup(key, byTimer);
    }

    // ========== Lifecycle ==========

    /**
     * Stop accepting work, wait for running pipelines, and remove every captcha.
     */
    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        log.info("Closing captcha manager ({} tracked)", records.size());

        workers.shutdown();
        try {
            long waitMillis = config.processTimeout().toMillis() * 2 + 1000;
            if (!workers.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Pipelines still running after {} ms, interrupting", waitMillis);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        scheduler.shutdownNow();
        for (CaptchaRecord record : new ArrayList<>(records.values())) {
            remove(record, false);
        }
    }

    // ========== Getters ==========

    public CaptchaConfig getConfig() { return config; }
    public List<Operator> getOperators() { return registry.operators(); }

    /**
     * Number of tracked captchas (pending and ready).
     */
    public int size() {
        return records.size();
    }

    /**
     * Get current statistics.
     */
    public CaptchaStats getStats() {
        return new CaptchaStats(
            generated.get(),
            failed.get(),
            deduplicated.get(),
            expired.get(),
            cleanedUp.get(),
            records.size()
        );
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
