package io.github.manjago.mathcaptcha.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Math Captcha CLI.
 *
 * Usage:
 *   mathcaptcha sample [options]     - Print random expressions with answers
 *   mathcaptcha challenge [options]  - Render a captcha and check an answer
 *   mathcaptcha info                 - Show version, config and operators
 */
@Command(
    name = "mathcaptcha",
    description = "Math CAPTCHA generator - random arithmetic typeset with LaTeX",
    mixinStandardHelpOptions = true,
    version = "Math Captcha 1.0.0",
    subcommands = {
        SampleCommand.class,
        ChallengeCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MathCaptchaCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MathCaptchaCli()).execute(args);
        System.exit(exitCode);
    }
}
