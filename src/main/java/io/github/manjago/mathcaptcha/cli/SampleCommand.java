package io.github.manjago.mathcaptcha.cli;

import io.github.manjago.mathcaptcha.captcha.CaptchaKeys;
import io.github.manjago.mathcaptcha.config.CaptchaConfig;
import io.github.manjago.mathcaptcha.core.*;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Print random expressions without running any external tool.
 *
 * Examples:
 *   mathcaptcha sample                   # 5 expressions from the default config
 *   mathcaptcha sample -n 20 --seed 42   # reproducible list
 *   mathcaptcha sample --min-ops 1 --max-ops 1
 */
@Command(
    name = "sample",
    description = "Print random expressions with their LaTeX and answers",
    mixinStandardHelpOptions = true
)
public class SampleCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-n", "--count"}, description = "Number of expressions (default: ${DEFAULT-VALUE})", defaultValue = "5")
    private int count;

    @Option(names = {"-s", "--seed"}, description = "Random seed (0 = random)")
    private Long seed;

    @Option(names = {"--min-ops"}, description = "Minimum operators per expression")
    private Integer minOps;

    @Option(names = {"--max-ops"}, description = "Maximum operators per expression")
    private Integer maxOps;

    @Option(names = {"-d", "--document"}, description = "Print the full LaTeX document and key")
    private boolean document;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CaptchaConfig config = configFile != null ? CaptchaConfig.fromFile(configFile) : CaptchaConfig.defaults();
        long effectiveSeed = seed != null ? seed : config.randomSeed();
        int min = minOps != null ? minOps : config.minOps();
        int max = maxOps != null ? maxOps : config.maxOps();

        CaptchaRng rng = CaptchaRng.forSeed(effectiveSeed);
        ExpressionGenerator generator = new ExpressionGenerator(OperatorRegistry.standard(), rng);

        try {
            for (int i = 0; i < count; i++) {
                Expression expression = generator.generate(min, max, config.values());
                String markup = LatexRenderer.render(expression);
                double answer = ExpressionEvaluator.evaluate(expression);

                out.printf("%3d. %-50s = %s%n", i + 1, markup, formatAnswer(answer));
                if (document) {
                    String doc = LatexRenderer.wrapDocument(markup);
                    out.println("     key: " + CaptchaKeys.derive(doc));
                    out.println(doc.indent(5));
                }
            }
        } catch (InvalidConfigException e) {
            err.println("Invalid parameters: " + e.getMessage());
            return 2;
        }

        out.printf("%nSeed: %d%n", rng.getSeed());
        out.flush();
        return 0;
    }

    private static String formatAnswer(double answer) {
        if (answer == Math.rint(answer) && !Double.isInfinite(answer)) {
            return String.valueOf((long) answer);
        }
        return String.format(Locale.ROOT, "%.4f", answer);
    }
}
