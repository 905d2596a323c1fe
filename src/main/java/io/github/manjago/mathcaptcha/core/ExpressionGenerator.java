package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Random expression synthesis.
 * <p>
 * Builds a post-order stack operator by operator. Before each operator is pushed,
 * random values are pushed until enough operands are pending for its arity; the
 * operator then consumes {@code arity} operands and leaves one. Every stack built
 * this way reduces to exactly one value, whatever operators are drawn.
 * <p>
 * Thread-safe: draws from the shared RNG are serialized.
 */
public class ExpressionGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionGenerator.class);

    private final OperatorRegistry registry;
    private final CaptchaRng rng;

    public ExpressionGenerator(@NotNull OperatorRegistry registry, @NotNull CaptchaRng rng) {
        this.registry = registry;
        this.rng = rng;
    }

    /**
     * Generate a random expression tree.
     *
     * @param minOps minimum number of operators (at least 1)
     * @param maxOps maximum number of operators (at least minOps)
     * @param values pool of numbers to draw operands from (non-empty)
     * @throws InvalidConfigException if the parameters are malformed
     * @throws EmptyRegistryException if no operators are registered
     */
    public @NotNull Expression generate(int minOps, int maxOps, @NotNull List<Double> values) {
        return Postfix.toExpression(generateTokens(minOps, maxOps, values));
    }

    /**
     * Generate a random expression as a post-order stack (push order).
     *
     * @see #generate(int, int, List)
     */
    public @NotNull List<Token> generateTokens(int minOps, int maxOps, @NotNull List<Double> values) {
        validate(minOps, maxOps, values);
        if (registry.isEmpty()) {
            throw new EmptyRegistryException();
        }

        List<Token> stack = new ArrayList<>();
        synchronized (rng) {
            int opCount = rng.nextIntInclusive(minOps, maxOps);
            int pending = 0;

            for (int i = 0; i < opCount; i++) {
                Operator op = registry.pick(rng);

                while (pending < op.arity()) {
                    stack.add(Token.literal(rng.pick(values)));
                    pending++;
                }

                stack.add(Token.op(op));
                pending -= op.arity() - 1;
            }

            log.debug("Generated stack with {} operators, {} tokens", opCount, stack.size());
        }
        return stack;
    }

    private static void validate(int minOps, int maxOps, List<Double> values) {
        if (minOps < 1) {
            throw new InvalidConfigException("minOps must be >= 1, got " + minOps);
        }
        if (minOps > maxOps) {
            throw new InvalidConfigException("minOps (" + minOps + ") must not exceed maxOps (" + maxOps + ")");
        }
        if (values == null || values.isEmpty()) {
            throw new InvalidConfigException("Value pool must not be empty");
        }
        for (Double value : values) {
            if (value == null) {
                throw new InvalidConfigException("Value pool must not contain null");
            }
        }
    }
}
