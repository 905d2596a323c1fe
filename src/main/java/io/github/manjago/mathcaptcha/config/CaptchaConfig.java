package io.github.manjago.mathcaptcha.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Configuration for a captcha manager.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record CaptchaConfig(
    // External tools
    Path latexPath,
    Path dvipngPath,

    // Image
    String foreground,
    String background,
    String bounding,          // dvipng -T: tight, bbox, or a size
    int resolution,           // dots per inch

    // Files
    Path workDirectory,

    // Expressions
    int minOps,
    int maxOps,
    List<Double> values,
    long randomSeed,          // 0 = random

    // Lifecycle
    Duration cleanupTime,

    // Pipeline
    int pipelineThreads,
    Duration processTimeout
) {

    public CaptchaConfig {
        values = List.copyOf(values);
    }

    /**
     * Load default configuration.
     */
    public static CaptchaConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static CaptchaConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static CaptchaConfig fromConfig(Config config) {
        Config c = config.getConfig("mathcaptcha");

        return new CaptchaConfig(
            Path.of(c.getString("latex.path")),
            Path.of(c.getString("dvipng.path")),
            c.getString("image.foreground"),
            c.getString("image.background"),
            c.getString("image.bounding"),
            c.getInt("image.resolution"),
            Path.of(c.getString("work-directory")),
            c.getInt("expression.min-ops"),
            c.getInt("expression.max-ops"),
            c.getDoubleList("expression.values"),
            c.getLong("random-seed"),
            c.getDuration("cleanup-time"),
            c.getInt("pipeline.threads"),
            c.getDuration("pipeline.process-timeout")
        );
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with this configuration, for overriding a few values.
     */
    public Builder toBuilder() {
        return new Builder()
                .latexPath(latexPath)
                .dvipngPath(dvipngPath)
                .foreground(foreground)
                .background(background)
                .bounding(bounding)
                .resolution(resolution)
                .workDirectory(workDirectory)
                .minOps(minOps)
                .maxOps(maxOps)
                .values(values)
                .randomSeed(randomSeed)
                .cleanupTime(cleanupTime)
                .pipelineThreads(pipelineThreads)
                .processTimeout(processTimeout);
    }

    public static class Builder {
        private Path latexPath = Path.of("/usr/bin/latex");
        private Path dvipngPath = Path.of("/usr/bin/dvipng");
        private String foreground = "#ffffff";
        private String background = "Transparent";
        private String bounding = "tight";
        private int resolution = 100;
        private Path workDirectory = Path.of("/tmp/math-captcha");
        private int minOps = 3;
        private int maxOps = 5;
        private List<Double> values = IntStream.rangeClosed(1, 9)
                .mapToObj(i -> (double) i)
                .collect(Collectors.toList());
        private long randomSeed = 0;
        private Duration cleanupTime = Duration.ofSeconds(600);
        private int pipelineThreads = 2;
        private Duration processTimeout = Duration.ofSeconds(30);

        public Builder latexPath(Path path) { this.latexPath = path; return this; }
        public Builder dvipngPath(Path path) { this.dvipngPath = path; return this; }
        public Builder foreground(String color) { this.foreground = color; return this; }
        public Builder background(String color) { this.background = color; return this; }
        public Builder bounding(String mode) { this.bounding = mode; return this; }
        public Builder resolution(int dpi) { this.resolution = dpi; return this; }
        public Builder workDirectory(Path dir) { this.workDirectory = dir; return this; }
        public Builder minOps(int min) { this.minOps = min; return this; }
        public Builder maxOps(int max) { this.maxOps = max; return this; }
        public Builder values(List<Double> pool) { this.values = pool; return this; }
        public Builder values(double... pool) {
            this.values = Arrays.stream(pool).boxed().collect(Collectors.toList());
            return this;
        }
        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }
        public Builder cleanupTime(Duration delay) { this.cleanupTime = delay; return this; }
        public Builder pipelineThreads(int threads) { this.pipelineThreads = threads; return this; }
        public Builder processTimeout(Duration timeout) { this.processTimeout = timeout; return this; }

        public CaptchaConfig build() {
            return new CaptchaConfig(
                latexPath, dvipngPath,
                foreground, background, bounding, resolution,
                workDirectory,
                minOps, maxOps, values, randomSeed,
                cleanupTime,
                pipelineThreads, processTimeout
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            CaptchaConfig:
              latex.path:                %s
              dvipng.path:               %s
              image.foreground:          %s
              image.background:          %s
              image.bounding:            %s
              image.resolution:          %d dpi
              work-directory:            %s
              expression.ops:            %d..%d
              expression.values:         %s
              random-seed:               %s
              cleanup-time:              %d sec
              pipeline.threads:          %d
              pipeline.process-timeout:  %d sec
            """,
            latexPath,
            dvipngPath,
            foreground,
            background,
            bounding,
            resolution,
            workDirectory,
            minOps, maxOps,
            values,
            randomSeed == 0 ? "random" : String.valueOf(randomSeed),
            cleanupTime.toSeconds(),
            pipelineThreads,
            processTimeout.toSeconds()
        );
    }
}
