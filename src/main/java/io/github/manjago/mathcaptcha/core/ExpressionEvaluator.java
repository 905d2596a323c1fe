package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Computes the numeric value of an expression.
 * <p>
 * Plain IEEE 754 double arithmetic: dividing by a zero from the value pool gives
 * {@code Infinity} or {@code NaN} rather than an error.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
        // Utility class
    }

    @Contract(pure = true)
    public static double evaluate(@NotNull Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            return literal.value();
        }

        Expression.Application application = (Expression.Application) expression;
        List<Expression> operands = application.operands();
        double[] args = new double[operands.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = evaluate(operands.get(i));
        }
        return application.operator().apply(args);
    }

    /**
     * Evaluate a post-order stack. The list is left untouched.
     *
     * @throws IllegalArgumentException if the stack is not well-formed
     */
    public static double evaluate(@NotNull List<Token> tokens) {
        return evaluate(Postfix.toExpression(tokens));
    }
}
