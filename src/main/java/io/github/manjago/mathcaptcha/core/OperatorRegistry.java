package io.github.manjago.mathcaptcha.core;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered, append-only set of operators that expressions are built from.
 * <p>
 * Each captcha manager owns its own registry. Operators can be registered until
 * the registry is frozen, which the manager does on its first generation, so the
 * operator set never changes while expressions are being drawn.
 */
public class OperatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperatorRegistry.class);

    private final List<Operator> operators = new CopyOnWriteArrayList<>();
    private volatile boolean frozen = false;

    /**
     * Registry with no operators. At least one must be registered before generating.
     */
    public static OperatorRegistry empty() {
        return new OperatorRegistry();
    }

    /**
     * Registry seeded with addition, subtraction, multiplication and division.
     */
    public static OperatorRegistry standard() {
        OperatorRegistry registry = new OperatorRegistry();
        registry.register(Operator.ADD);
        registry.register(Operator.SUBTRACT);
        registry.register(Operator.MULTIPLY);
        registry.register(Operator.DIVIDE);
        return registry;
    }

    /**
     * Append an operator.
     *
     * @throws IllegalStateException if the registry is frozen
     */
    public synchronized void register(@NotNull Operator operator) {
        Objects.requireNonNull(operator, "operator");
        if (frozen) {
            throw new IllegalStateException(
                    "Operator registry is frozen, cannot register '" + operator.name() + "'");
        }
        operators.add(operator);
        log.debug("Registered operator {} (total: {})", operator.name(), operators.size());
    }

    /**
     * Pick a uniformly random operator.
     *
     * @throws EmptyRegistryException if no operators are registered
     */
    public @NotNull Operator pick(@NotNull CaptchaRng rng) {
        if (operators.isEmpty()) {
            throw new EmptyRegistryException();
        }
        return rng.pick(operators);
    }

    /**
     * Disallow further registration. Idempotent; once this returns, no
     * concurrent {@link #register} can still append.
     */
    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return operators.size();
    }

    public boolean isEmpty() {
        return operators.isEmpty();
    }

    /**
     * Snapshot of the registered operators, in registration order.
     */
    public List<Operator> operators() {
        return List.copyOf(operators);
    }
}
