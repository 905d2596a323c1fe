package io.github.manjago.mathcaptcha.captcha;

import io.github.manjago.mathcaptcha.config.CaptchaConfig;
import io.github.manjago.mathcaptcha.core.EmptyRegistryException;
import io.github.manjago.mathcaptcha.core.InvalidConfigException;
import io.github.manjago.mathcaptcha.core.LatexRenderer;
import io.github.manjago.mathcaptcha.core.Operator;
import io.github.manjago.mathcaptcha.core.OperatorRegistry;
import io.github.manjago.mathcaptcha.render.CaptchaFiles;
import io.github.manjago.mathcaptcha.render.ExternalToolException;
import io.github.manjago.mathcaptcha.render.FakeCommandRunner;
import io.github.manjago.mathcaptcha.render.PipelineStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class CaptchaManagerTest {

    private static final long WAIT_SECONDS = 10;

    /** Key of the only document the "2 + 2" configuration can produce. */
    private static final String TWO_PLUS_TWO = CaptchaKeys.derive(LatexRenderer.wrapDocument("2 + 2"));

    @TempDir
    Path workDir;

    private final List<CaptchaManager> managers = new ArrayList<>();

    @AfterEach
    void closeManagers() {
        managers.forEach(CaptchaManager::close);
    }

    private CaptchaConfig.Builder twoPlusTwo() {
        return CaptchaConfig.builder()
                .latexPath(Path.of("latex"))
                .dvipngPath(Path.of("dvipng"))
                .workDirectory(workDir)
                .minOps(1)
                .maxOps(1)
                .values(2)
                .randomSeed(42)
                .processTimeout(Duration.ofSeconds(WAIT_SECONDS));
    }

    private CaptchaManager manager(CaptchaConfig config, OperatorRegistry registry, FakeCommandRunner runner) {
        CaptchaManager manager = new CaptchaManager(config, registry, runner);
        managers.add(manager);
        return manager;
    }

    private CaptchaManager addOnly(CaptchaConfig config, FakeCommandRunner runner) {
        OperatorRegistry registry = OperatorRegistry.empty();
        registry.register(Operator.ADD);
        return manager(config, registry, runner);
    }

    private static Throwable failureOf(CompletableFuture<?> future) throws InterruptedException {
        try {
            Object value = future.get(WAIT_SECONDS, TimeUnit.SECONDS);
            return fail("Expected failure, got " + value);
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (CancellationException e) {
            return e;
        } catch (TimeoutException e) {
            return fail("Future did not complete");
        }
    }

    private static void awaitCondition(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(20);
        }
    }

    @Nested
    @DisplayName("Generation")
    class Generation {

        @Test
        @DisplayName("Single-operator config produces 2 + 2")
        void endToEnd() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner();
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertEquals(TWO_PLUS_TWO, key);
            assertEquals(64, key.length());
            assertEquals("2 + 2", manager.getMarkup(key));
            assertTrue(manager.check(key, 4, 0));
            assertFalse(manager.check(key, 5, 0));

            Path image = manager.getImage(key);
            assertNotNull(image);
            assertEquals(workDir.resolve(key + ".png"), image);
            assertTrue(Files.exists(image));
            assertTrue(Files.readString(workDir.resolve(key + ".tex")).contains("2 + 2"));
        }

        @Test
        @DisplayName("Pipeline runs LaTeX then dvipng")
        void stageOrder() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner();
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            List<List<String>> commands = runner.getCommands();
            assertEquals(2, commands.size());
            assertEquals("latex", commands.get(0).get(0));
            assertEquals("dvipng", commands.get(1).get(0));
        }

        @Test
        @DisplayName("Same document joins the existing captcha")
        void duplicateJoinsExisting() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner();
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            String first = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);
            String second = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertEquals(first, second);
            assertEquals(1, manager.size());
            assertEquals(2, runner.getCommands().size(), "Pipeline must run once");

            CaptchaStats stats = manager.getStats();
            assertEquals(1, stats.generated());
            assertEquals(1, stats.deduplicated());
        }

        @Test
        @DisplayName("Duplicate of a pending captcha completes when it does")
        void duplicateOfPending() throws Exception {
            CountDownLatch gate = new CountDownLatch(1);
            FakeCommandRunner runner = new FakeCommandRunner().holdTypesetting(gate);
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            CompletableFuture<String> first = manager.generate();
            assertTrue(runner.awaitStarted(WAIT_SECONDS * 1000));
            CompletableFuture<String> second = manager.generate();
            assertFalse(second.isDone());

            gate.countDown();

            assertEquals(TWO_PLUS_TWO, first.get(WAIT_SECONDS, TimeUnit.SECONDS));
            assertEquals(TWO_PLUS_TWO, second.get(WAIT_SECONDS, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Many captchas from the standard operators")
        void manyCaptchas() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner();
            CaptchaConfig config = twoPlusTwo()
                    .values(1, 2, 3, 4, 5, 6, 7, 8, 9)
                    .minOps(1)
                    .maxOps(3)
                    .pipelineThreads(4)
                    .build();
            CaptchaManager manager = manager(config, OperatorRegistry.standard(), runner);

            List<CompletableFuture<String>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(manager.generate());
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(WAIT_SECONDS, TimeUnit.SECONDS);

            Set<String> keys = new HashSet<>();
            for (CompletableFuture<String> future : futures) {
                String key = future.get();
                keys.add(key);
                assertNotNull(manager.getImage(key));
                assertNotNull(manager.getMarkup(key));
            }

            CaptchaStats stats = manager.getStats();
            assertEquals(20, stats.generated() + stats.deduplicated());
            assertEquals(keys.size(), stats.generated());
            assertEquals(keys.size(), manager.size());
        }

        @Test
        @DisplayName("Callback form reports the key")
        void callbackSuccess() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());
            CompletableFuture<String> received = new CompletableFuture<>();

            manager.generate(received::complete, received::completeExceptionally);

            assertEquals(TWO_PLUS_TWO, received.get(WAIT_SECONDS, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("LaTeX error fails the captcha and removes its files")
        void typesetFailure() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner().failAt(PipelineStage.TYPESET, 1);
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            Throwable error = failureOf(manager.generate());

            ExternalToolException e = assertInstanceOf(ExternalToolException.class, error);
            assertEquals(PipelineStage.TYPESET, e.getStage());
            assertEquals(1, e.getExitCode());
            assertTrue(e.getOutput().contains("Undefined control sequence"));

            assertEquals(0, manager.size());
            assertNull(manager.getImage(TWO_PLUS_TWO));
            for (Path path : CaptchaFiles.of(workDir, TWO_PLUS_TWO).all()) {
                assertFalse(Files.exists(path), path + " should be deleted");
            }
            assertEquals(1, manager.getStats().failed());
        }

        @Test
        @DisplayName("Missing dvipng fails at rasterize")
        void rasterizeCannotStart() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner().cannotStart(PipelineStage.RASTERIZE);
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            ExternalToolException e = assertInstanceOf(ExternalToolException.class, failureOf(manager.generate()));

            assertEquals(PipelineStage.RASTERIZE, e.getStage());
            assertEquals(ExternalToolException.NO_EXIT_CODE, e.getExitCode());
            assertFalse(Files.exists(workDir.resolve(TWO_PLUS_TWO + ".dvi")));
        }

        @Test
        @DisplayName("Unwritable work directory fails at write source")
        void writeSourceFailure() throws Exception {
            Path notADirectory = Files.writeString(workDir.resolve("occupied"), "file");
            CaptchaManager manager = addOnly(twoPlusTwo().workDirectory(notADirectory).build(), new FakeCommandRunner());

            ExternalToolException e = assertInstanceOf(ExternalToolException.class, failureOf(manager.generate()));

            assertEquals(PipelineStage.WRITE_SOURCE, e.getStage());
            assertEquals(0, manager.size());
        }

        @Test
        @DisplayName("A failed captcha can be generated again")
        void retryAfterFailure() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner().failAt(PipelineStage.TYPESET, 1);
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);
            failureOf(manager.generate());

            runner.failAt(null, 0);

            assertEquals(TWO_PLUS_TWO, manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Empty registry fails without running tools")
        void emptyRegistry() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner();
            CaptchaManager manager = manager(twoPlusTwo().build(), OperatorRegistry.empty(), runner);

            assertInstanceOf(EmptyRegistryException.class, failureOf(manager.generate()));
            assertTrue(runner.getCommands().isEmpty());
            assertEquals(0, manager.size());
        }

        @Test
        @DisplayName("Invalid expression bounds fail the future")
        void invalidBounds() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().minOps(4).maxOps(2).build(), new FakeCommandRunner());

            assertInstanceOf(InvalidConfigException.class, failureOf(manager.generate()));
        }

        @Test
        @DisplayName("Invalid color is rejected at construction")
        void invalidColor() {
            CaptchaConfig config = twoPlusTwo().foreground("chartreuse-ish").build();

            assertThrows(InvalidConfigException.class,
                    () -> new CaptchaManager(config, OperatorRegistry.standard(), new FakeCommandRunner()));
        }

        @Test
        @DisplayName("Callback form reports the unwrapped error")
        void callbackFailure() throws Exception {
            FakeCommandRunner runner = new FakeCommandRunner().failAt(PipelineStage.TYPESET, 2);
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);
            CompletableFuture<Throwable> received = new CompletableFuture<>();

            manager.generate(key -> received.complete(null), received::complete);

            ExternalToolException e = assertInstanceOf(ExternalToolException.class,
                    received.get(WAIT_SECONDS, TimeUnit.SECONDS));
            assertEquals(2, e.getExitCode());
        }
    }

    @Nested
    @DisplayName("Checking answers")
    class Checking {

        @Test
        @DisplayName("Answers are compared after rounding")
        void roundedComparison() throws Exception {
            OperatorRegistry registry = OperatorRegistry.empty();
            registry.register(new Operator("nudge", 1, false, false, "\\operatorname{n}($1)", 1,
                    args -> args[0] + 0.0049));
            CaptchaManager manager = manager(twoPlusTwo().values(7).build(), registry, new FakeCommandRunner());

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertTrue(manager.check(key, 7.001, 2));
            assertFalse(manager.check(key, 7.0051, 2));
            assertTrue(manager.check(key, 7, 0));
            assertTrue(manager.check(key, 7.2, -1), "Negative places count as 0");
            assertFalse(manager.check(key, 7.0048, 4));
        }

        @Test
        @DisplayName("Unknown keys read as absent")
        void unknownKey() {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());

            assertFalse(manager.check("no-such-key", 4, 0));
            assertFalse(manager.check(null, 4, 0));
            assertNull(manager.getImage("no-such-key"));
            assertNull(manager.getMarkup(null));
        }

        @Test
        @DisplayName("NaN never matches")
        void nanNeverMatches() throws Exception {
            OperatorRegistry registry = OperatorRegistry.empty();
            registry.register(Operator.DIVIDE);
            CaptchaManager manager = manager(twoPlusTwo().values(0).build(), registry, new FakeCommandRunner());

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertEquals("\\frac{0}{0}", manager.getMarkup(key));
            assertFalse(manager.check(key, Double.NaN, 2));
            assertFalse(manager.check(key, 0, 2));
        }

        @Test
        @DisplayName("Wrong answers stay wrong at any number of places")
        void manyPlaces() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertFalse(manager.check(key, 5, 19));
            assertFalse(manager.check(key, 1000, 20));
            assertFalse(manager.check(key, 5, 400));
            assertFalse(manager.check(key, 4.5, 400));
            assertTrue(manager.check(key, 4, 19));
            assertTrue(manager.check(key, 4, 400));
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @Test
        @DisplayName("Cleanup removes the captcha and its files")
        void cleanupRemoves() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());
            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);
            Path image = manager.getImage(key);

            manager.cleanup(key);

            assertNotNull(image);
            assertFalse(Files.exists(image));
            assertNull(manager.getImage(key));
            assertFalse(manager.check(key, 4, 0));
            assertEquals(0, manager.size());
            assertEquals(1, manager.getStats().cleanedUp());
        }

        @Test
        @DisplayName("Cleanup is idempotent and ignores unknown keys")
        void cleanupIdempotent() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());
            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            manager.cleanup(key);
            assertDoesNotThrow(() -> manager.cleanup(key));
            assertDoesNotThrow(() -> manager.cleanup("no-such-key"));
            assertDoesNotThrow(() -> manager.cleanup(null));

            assertEquals(1, manager.getStats().cleanedUp());
        }

        @Test
        @DisplayName("Cleanup tolerates files already deleted")
        void cleanupMissingFiles() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());
            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);
            for (Path path : CaptchaFiles.of(workDir, key).all()) {
                Files.deleteIfExists(path);
            }

            assertDoesNotThrow(() -> manager.cleanup(key));
            assertEquals(0, manager.size());
        }

        @Test
        @DisplayName("Ready captcha expires after the cleanup time")
        void expiry() throws Exception {
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            CaptchaManager manager = addOnly(twoPlusTwo().cleanupTime(Duration.ofMillis(500)).build(),
                    new FakeCommandRunner());
            manager.setListener(new CaptchaListener() {
                @Override
                public void onCleanup(String key, boolean expired) {
                    events.add(expired ? "expired" : "cleaned");
                }
            });

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);
            Path image = manager.getImage(key);
            assertNotNull(image);

            awaitCondition("expiry", () -> manager.size() == 0);

            assertFalse(Files.exists(image));
            assertEquals(1, manager.getStats().expired());
            assertEquals(List.of("expired"), events);
        }

        @Test
        @DisplayName("Cleanup before expiry cancels the timer")
        void cleanupBeatsExpiry() throws Exception {
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            CaptchaManager manager = addOnly(twoPlusTwo().cleanupTime(Duration.ofMillis(400)).build(),
                    new FakeCommandRunner());
            manager.setListener(new CaptchaListener() {
                @Override
                public void onCleanup(String key, boolean expired) {
                    events.add(expired ? "expired" : "cleaned");
                }
            });

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);
            manager.cleanup(key);
            Thread.sleep(800);

            assertEquals(List.of("cleaned"), events);
            assertEquals(0, manager.getStats().expired());
        }

        @Test
        @DisplayName("Cleanup of a pending captcha cancels it once the image is done")
        void cleanupWhilePending() throws Exception {
            CountDownLatch gate = new CountDownLatch(1);
            FakeCommandRunner runner = new FakeCommandRunner().holdTypesetting(gate);
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            CompletableFuture<String> future = manager.generate();
            assertTrue(runner.awaitStarted(WAIT_SECONDS * 1000));

            assertNull(manager.getImage(TWO_PLUS_TWO), "Pending captcha has no image yet");
            assertFalse(manager.check(TWO_PLUS_TWO, 4, 0), "Pending captcha cannot be checked");

            manager.cleanup(TWO_PLUS_TWO);
            gate.countDown();

            assertInstanceOf(CancellationException.class, failureOf(future));
            assertEquals(0, manager.size());
            for (Path path : CaptchaFiles.of(workDir, TWO_PLUS_TWO).all()) {
                assertFalse(Files.exists(path), path + " should be deleted");
            }
        }

        @Test
        @DisplayName("Generating again after cleanup of a pending captcha starts a fresh one")
        void regenerateAfterPendingCleanup() throws Exception {
            CountDownLatch gate = new CountDownLatch(1);
            FakeCommandRunner runner = new FakeCommandRunner().holdTypesetting(gate);
            CaptchaManager manager = addOnly(twoPlusTwo().build(), runner);

            CompletableFuture<String> first = manager.generate();
            assertTrue(runner.awaitStarted(WAIT_SECONDS * 1000));
            manager.cleanup(TWO_PLUS_TWO);

            CompletableFuture<String> second = manager.generate();
            assertFalse(second.isDone(), "Waits for the removed captcha to release its files");
            gate.countDown();

            assertInstanceOf(CancellationException.class, failureOf(first));
            assertEquals(TWO_PLUS_TWO, second.get(WAIT_SECONDS, TimeUnit.SECONDS));
            assertTrue(Files.exists(manager.getImage(TWO_PLUS_TWO)));
            assertTrue(manager.check(TWO_PLUS_TWO, 4, 0));
            assertEquals(1, manager.size());
            assertEquals(4, runner.getCommands().size(), "Both records ran latex and dvipng");
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Operators cannot be added after the first generate")
        void registryFrozenAfterGenerate() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());
            manager.registerOperator(Operator.MULTIPLY);
            assertEquals(2, manager.getOperators().size());

            manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertThrows(IllegalStateException.class, () -> manager.registerOperator(Operator.SUBTRACT));
        }

        @Test
        @DisplayName("Close removes every captcha and rejects new work")
        void closeRemovesEverything() throws Exception {
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());
            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);
            Path image = manager.getImage(key);

            manager.close();
            manager.close();

            assertNotNull(image);
            assertFalse(Files.exists(image));
            assertEquals(0, manager.size());
            assertInstanceOf(IllegalStateException.class, failureOf(manager.generate()));
        }

        @Test
        @DisplayName("Listener sees ready and cleanup events")
        void listenerEvents() throws Exception {
            List<String> events = Collections.synchronizedList(new ArrayList<>());
            CaptchaManager manager = addOnly(twoPlusTwo().build(), new FakeCommandRunner());
            manager.setListener(new CaptchaListener() {
                @Override
                public void onReady(String key, Path image) {
                    events.add("ready " + CaptchaKeys.shorten(key));
                }

                @Override
                public void onCleanup(String key, boolean expired) {
                    events.add("cleanup " + CaptchaKeys.shorten(key));
                }
            });

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);
            manager.cleanup(key);

            String shortKey = CaptchaKeys.shorten(key);
            assertEquals(List.of("ready " + shortKey, "cleanup " + shortKey), events);
        }

        @Test
        @DisplayName("Work directory is created on demand")
        void createsWorkDirectory() throws Exception {
            Path nested = workDir.resolve("a").resolve("b");
            CaptchaManager manager = addOnly(twoPlusTwo().workDirectory(nested).build(), new FakeCommandRunner());

            String key = manager.generate().get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertTrue(Files.isDirectory(nested));
            assertEquals(nested.resolve(key + ".png"), manager.getImage(key));
        }
    }

    @Test
    @DisplayName("Stats failure rate")
    void statsFailureRate() {
        CaptchaStats stats = new CaptchaStats(3, 1, 0, 0, 0, 3);
        assertEquals(0.25, stats.failureRate());
        assertEquals(0.0, new CaptchaStats(0, 0, 0, 0, 0, 0).failureRate());
    }
}
