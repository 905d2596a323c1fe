package io.github.manjago.mathcaptcha.cli;

import io.github.manjago.mathcaptcha.config.CaptchaConfig;
import io.github.manjago.mathcaptcha.core.Operator;
import io.github.manjago.mathcaptcha.core.OperatorRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Show information about Math Captcha.
 */
@Command(
    name = "info",
    description = "Show version, configuration and operators",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        out.println();
        out.println("╔═══════════════════════════════════════╗");
        out.println("║            MATH CAPTCHA               ║");
        out.println("║   LaTeX-rendered arithmetic puzzles   ║");
        out.println("║          Version 1.0.0                ║");
        out.println("╚═══════════════════════════════════════╝");
        out.println();

        out.println(configFile != null ? "Configuration (" + configFile + "):" : "Default Configuration:");
        out.println(configFile != null ? CaptchaConfig.fromFile(configFile) : CaptchaConfig.defaults());

        out.println("Operators:");
        for (Operator op : OperatorRegistry.standard().operators()) {
            out.printf("  %-10s %-16s prec=%d  %-9s %s%n",
                    op.name(),
                    op.template(),
                    op.precedence(),
                    op.associative() ? "assoc" : "non-assoc",
                    op.groups() ? "groups" : "self-grouping");
        }
        out.println();
        out.flush();

        return 0;
    }
}
