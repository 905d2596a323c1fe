package io.github.manjago.mathcaptcha.core;

import java.io.Serial;

/**
 * Thrown for malformed generation parameters (operator range, value pool) or
 * unparseable color strings.
 */
public class InvalidConfigException extends IllegalArgumentException {

    @Serial
    private static final long serialVersionUID = 1L;

    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
