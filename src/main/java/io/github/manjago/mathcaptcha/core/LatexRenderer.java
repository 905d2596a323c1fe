package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.util.List;

/**
 * Renders expression trees as LaTeX math.
 * <p>
 * Operands are substituted into the operator template and wrapped in parentheses
 * where the layout would otherwise misrepresent the tree:
 * <ul>
 *   <li>an operand that binds looser than its operator, in any position:
 *       {@code (1 + 2) \times 3}</li>
 *   <li>an operand of equal or looser precedence after the first position of a
 *       non-associative operator: {@code 3 - (4 - 5)}</li>
 * </ul>
 * Operators with {@code groups == false} (the fraction) never add parentheses,
 * and numbers are never grouped. A left-nested chain such as {@code (3 - 4) - 5}
 * prints flat as {@code 3 - 4 - 5}.
 */
public final class LatexRenderer {

    private static final String DOCUMENT_HEADER = """
            \\documentclass[12pt]{article}
            \\usepackage{amsmath}
            \\pagestyle{empty}

            \\begin{document}

            \\begin{displaymath}
            """;

    private static final String DOCUMENT_FOOTER = """

            \\end{displaymath}

            \\end{document}""";

    private LatexRenderer() {
        // Utility class
    }

    /**
     * Render an expression as a LaTeX math string (no document scaffolding).
     */
    @Contract(pure = true)
    public static @NotNull String render(@NotNull Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            return formatNumber(literal.value());
        }

        Expression.Application application = (Expression.Application) expression;
        Operator operator = application.operator();
        List<Expression> operands = application.operands();
        String[] rendered = new String[operands.size()];

        for (int i = 0; i < rendered.length; i++) {
            Expression operand = operands.get(i);
            String text = render(operand);
            rendered[i] = needsGrouping(operator, i, operand) ? "(" + text + ")" : text;
        }
        return substitute(operator.template(), rendered);
    }

    /**
     * Render a post-order stack. The list is left untouched.
     */
    public static @NotNull String render(@NotNull List<Token> tokens) {
        return render(Postfix.toExpression(tokens));
    }

    /**
     * Decide whether operand {@code index} of {@code operator} gets parentheses.
     */
    @Contract(pure = true)
    static boolean needsGrouping(@NotNull Operator operator, int index, @NotNull Expression operand) {
        int precedence = operand.precedence();
        if (!operator.groups() || precedence == 0) {
            return false;
        }
        if (precedence > operator.precedence()) {
            return true;
        }
        return !operator.associative() && index > 0 && precedence >= operator.precedence();
    }

    /**
     * Wrap math in a minimal LaTeX document suitable for dvipng.
     */
    @Contract(pure = true)
    public static @NotNull String wrapDocument(@NotNull String math) {
        return DOCUMENT_HEADER + math + DOCUMENT_FOOTER;
    }

    /**
     * Replace {@code $1..$n} with the given strings in one left-to-right pass.
     * Placeholders outside that range are left as they are.
     */
    @Contract(pure = true)
    static @NotNull String substitute(@NotNull String template, @NotNull String[] values) {
        StringBuilder sb = new StringBuilder(template.length() + 16 * values.length);
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            int end = i + 1;
            while (c == '$' && end < template.length() && Character.isDigit(template.charAt(end))) {
                end++;
            }
            if (end > i + 1) {
                int index = Integer.parseInt(template.substring(i + 1, end));
                if (index >= 1 && index <= values.length) {
                    sb.append(values[index - 1]);
                } else {
                    sb.append(template, i, end);
                }
                i = end;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Plain decimal form: {@code 2} rather than {@code 2.0}, no exponent.
     */
    @Contract(pure = true)
    static @NotNull String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
