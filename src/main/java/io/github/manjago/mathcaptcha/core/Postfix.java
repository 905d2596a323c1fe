package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Utilities for post-order token stacks.
 * <p>
 * A stack is consumed from the end. Popping an operator pops its operands next:
 * the first pop becomes operand 1, the second operand 2, and so on. For
 * {@code [4, 3, SUB]} this means {@code 3 - 4}.
 */
public final class Postfix {

    private Postfix() {
        // Utility class
    }

    /**
     * Count of values left after reducing the whole stack, scanning in push order.
     * <p>
     * A literal adds one pending operand; an operator takes {@code arity} and
     * leaves one. A well-formed expression has balance exactly 1.
     *
     * @param tokens stack in push order
     * @return pending operand count after the last token
     * @throws IllegalArgumentException if an operator finds fewer operands than its arity
     */
    @Contract(pure = true)
    public static int consumptionBalance(@NotNull List<Token> tokens) {
        int pending = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token instanceof Token.Op op) {
                int arity = op.operator().arity();
                if (pending < arity) {
                    throw new IllegalArgumentException(String.format(
                            "Stack underflow at token %d: '%s' needs %d operands, %d pending",
                            i, op.operator().name(), arity, pending));
                }
                pending -= arity - 1;
            } else {
                pending++;
            }
        }
        return pending;
    }

    /**
     * True if the stack reduces to exactly one value without underflow.
     */
    @Contract(pure = true)
    public static boolean isWellFormed(@NotNull List<Token> tokens) {
        try {
            return consumptionBalance(tokens) == 1;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Fold a stack into a tree. The list is not modified.
     *
     * @throws IllegalArgumentException if the stack is not well-formed
     */
    public static @NotNull Expression toExpression(@NotNull List<Token> tokens) {
        Cursor cursor = new Cursor(tokens.size());
        Expression root = pop(tokens, cursor);
        if (cursor.position != 0) {
            throw new IllegalArgumentException(
                    cursor.position + " token(s) left over after reducing the stack");
        }
        return root;
    }

    private static Expression pop(List<Token> tokens, Cursor cursor) {
        if (cursor.position == 0) {
            throw new IllegalArgumentException("Stack underflow: operator is missing operands");
        }
        Token token = tokens.get(--cursor.position);
        if (token instanceof Token.Literal literal) {
            return new Expression.Literal(literal.value());
        }

        Operator operator = ((Token.Op) token).operator();
        List<Expression> operands = new ArrayList<>(operator.arity());
        for (int i = 0; i < operator.arity(); i++) {
            operands.add(pop(tokens, cursor));
        }
        return new Expression.Application(operator, operands);
    }

    private static final class Cursor {
        private int position;

        Cursor(int position) {
            this.position = position;
        }
    }
}
