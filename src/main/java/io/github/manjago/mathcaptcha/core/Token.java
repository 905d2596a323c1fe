package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Element of a post-order expression stack: either a number or an operator.
 *
 * @see Postfix
 */
public sealed interface Token permits Token.Literal, Token.Op {

    /**
     * Numeric operand.
     */
    record Literal(double value) implements Token {
    }

    /**
     * Operator applied to the operands popped after it.
     */
    record Op(@NotNull Operator operator) implements Token {
        public Op {
            Objects.requireNonNull(operator, "operator");
        }
    }

    static Token literal(double value) {
        return new Literal(value);
    }

    static Token op(Operator operator) {
        return new Op(operator);
    }
}
