package io.github.manjago.mathcaptcha.cli;

import io.github.manjago.mathcaptcha.captcha.CaptchaManager;
import io.github.manjago.mathcaptcha.config.CaptchaConfig;
import io.github.manjago.mathcaptcha.core.InvalidConfigException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Render one captcha, ask for the answer on stdin, and check it.
 *
 * Examples:
 *   mathcaptcha challenge                        # defaults (needs latex + dvipng)
 *   mathcaptcha challenge --fg '#000000' -w ./out
 *   mathcaptcha challenge --places 0             # integer answers
 */
@Command(
    name = "challenge",
    description = "Generate a captcha image and check an answer typed on stdin",
    mixinStandardHelpOptions = true
)
public class ChallengeCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-w", "--work-dir"}, description = "Directory for generated files")
    private Path workDirectory;

    @Option(names = {"--fg"}, description = "Foreground color (#RRGGBB or rgb(r,g,b))")
    private String foreground;

    @Option(names = {"--bg"}, description = "Background color (#RRGGBB, rgb(r,g,b) or Transparent)")
    private String background;

    @Option(names = {"-D", "--resolution"}, description = "Image resolution in dpi")
    private Integer resolution;

    @Option(names = {"-p", "--places"}, description = "Decimal places compared (default: ${DEFAULT-VALUE})", defaultValue = "2")
    private int places;

    @Option(names = {"-t", "--timeout"}, description = "Seconds to wait for the image (default: ${DEFAULT-VALUE})", defaultValue = "60")
    private long timeoutSeconds;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CaptchaConfig config = buildConfig();

        try (CaptchaManager manager = new CaptchaManager(config)) {
            String key;
            try {
                key = manager.generate().get(timeoutSeconds, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                err.println("Could not generate captcha: " + e.getCause().getMessage());
                return 1;
            } catch (TimeoutException e) {
                err.println("Timed out after " + timeoutSeconds + " s waiting for the image");
                return 1;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 130;
            }

            out.println("Captcha: " + key);
            out.println("Image:   " + manager.getImage(key));
            out.print("Answer:  ");
            out.flush();

            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line = in.readLine();
            boolean correct = line != null && checkAnswer(manager, key, line.trim());
            out.println(correct ? "Correct!" : "Incorrect!");

            manager.cleanup(key);
            out.flush();
            return correct ? 0 : 3;
        } catch (InvalidConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
    }

    private boolean checkAnswer(CaptchaManager manager, String key, String text) {
        try {
            return manager.check(key, Double.parseDouble(text), places);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private CaptchaConfig buildConfig() {
        CaptchaConfig base = configFile != null ? CaptchaConfig.fromFile(configFile) : CaptchaConfig.defaults();
        CaptchaConfig.Builder builder = base.toBuilder();

        // Override from CLI options
        if (workDirectory != null) builder.workDirectory(workDirectory);
        if (foreground != null) builder.foreground(foreground);
        if (background != null) builder.background(background);
        if (resolution != null) builder.resolution(resolution);

        return builder.build();
    }
}
