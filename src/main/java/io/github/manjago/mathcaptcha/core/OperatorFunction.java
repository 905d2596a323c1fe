package io.github.manjago.mathcaptcha.core;

/**
 * Pure numeric function behind an {@link Operator}.
 */
@FunctionalInterface
public interface OperatorFunction {

    /**
     * @param args operand values, one per operand, in operand order
     * @return the result
     */
    double apply(double[] args);
}
