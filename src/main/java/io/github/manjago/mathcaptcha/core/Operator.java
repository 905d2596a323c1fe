package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An operator that random expressions are built from.
 * <p>
 * Each operator knows how to evaluate itself and how to print itself in LaTeX.
 * The template uses {@code $1..$n} placeholders for the operands, in operand order.
 * <p>
 * Precedence follows the "lower binds tighter" convention:
 * <pre>
 * 3 - multiplication, fraction
 * 5 - addition, subtraction
 * </pre>
 *
 * @param name        display name, used in listings and logs
 * @param precedence  binding strength, lower value binds tighter
 * @param associative whether chains of this operator may be flattened on either side
 * @param groups      whether operands may need parentheses (false for self-delimiting
 *                    layouts like a fraction bar)
 * @param template    LaTeX template with {@code $1..$arity} placeholders
 * @param arity       number of operands (at least 1)
 * @param function    evaluation function, receives exactly {@code arity} arguments
 */
public record Operator(
    @NotNull String name,
    int precedence,
    boolean associative,
    boolean groups,
    @NotNull String template,
    int arity,
    @NotNull OperatorFunction function
) {

    // ========== Standard arithmetic ==========

    public static final Operator ADD = new Operator(
            "add", 5, true, true, "$1 + $2", 2, args -> args[0] + args[1]);

    public static final Operator SUBTRACT = new Operator(
            "subtract", 5, false, true, "$1 - $2", 2, args -> args[0] - args[1]);

    public static final Operator MULTIPLY = new Operator(
            "multiply", 3, true, true, "$1 \\times $2", 2, args -> args[0] * args[1]);

    /** Rendered as a fraction, so the bar groups the operands by itself. */
    public static final Operator DIVIDE = new Operator(
            "divide", 3, false, false, "\\frac{$1}{$2}", 2, args -> args[0] / args[1]);

    public Operator {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(function, "function");
        if (arity < 1) {
            throw new IllegalArgumentException("Operator '" + name + "' must have arity >= 1, got " + arity);
        }
        for (int i = 1; i <= arity; i++) {
            if (!template.contains("$" + i)) {
                throw new IllegalArgumentException(
                        "Template of operator '" + name + "' has no placeholder $" + i + ": " + template);
            }
        }
    }

    /**
     * Apply the evaluation function.
     *
     * @param args operand values in operand order
     * @return result (may be infinite or NaN, e.g. division by zero)
     */
    @Contract(pure = true)
    public double apply(double... args) {
        if (args.length != arity) {
            throw new IllegalArgumentException(String.format(
                    "Operator '%s' expects %d operands, got %d", name, arity, args.length));
        }
        return function.apply(args);
    }

    @Override
    public String toString() {
        return String.format("%s[prec=%d, %s, %s, arity=%d, '%s']",
                name, precedence,
                associative ? "assoc" : "non-assoc",
                groups ? "groups" : "no-group",
                arity, template);
    }
}
