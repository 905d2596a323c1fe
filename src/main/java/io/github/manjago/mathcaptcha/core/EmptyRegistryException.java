package io.github.manjago.mathcaptcha.core;

import java.io.Serial;

/**
 * Thrown when an expression is requested but no operators are registered.
 */
public class EmptyRegistryException extends IllegalStateException {

    @Serial
    private static final long serialVersionUID = 1L;

    public EmptyRegistryException() {
        super("No operators registered, cannot generate an expression");
    }
}
