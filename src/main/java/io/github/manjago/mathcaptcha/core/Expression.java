package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree.
 * <p>
 * Built once by the generator and then read by the evaluator and the renderer,
 * neither of which modifies it.
 */
public sealed interface Expression permits Expression.Literal, Expression.Application {

    /**
     * Precedence used for grouping decisions. Numbers are 0 and never grouped.
     */
    int precedence();

    /**
     * Number of operators in this tree.
     */
    int operatorCount();

    /**
     * A number.
     */
    record Literal(double value) implements Expression {

        @Override
        public int precedence() {
            return 0;
        }

        @Override
        public int operatorCount() {
            return 0;
        }
    }

    /**
     * An operator applied to its operands, in operand order ($1 first).
     */
    record Application(@NotNull Operator operator, @NotNull List<Expression> operands) implements Expression {

        public Application {
            Objects.requireNonNull(operator, "operator");
            operands = List.copyOf(operands);
            if (operands.size() != operator.arity()) {
                throw new IllegalArgumentException(String.format(
                        "Operator '%s' needs %d operands, got %d",
                        operator.name(), operator.arity(), operands.size()));
            }
        }

        @Override
        public int precedence() {
            return operator.precedence();
        }

        @Override
        public int operatorCount() {
            int count = 1;
            for (Expression operand : operands) {
                count += operand.operatorCount();
            }
            return count;
        }
    }

    static Expression literal(double value) {
        return new Literal(value);
    }

    static Expression apply(Operator operator, Expression... operands) {
        return new Application(operator, List.of(operands));
    }
}
