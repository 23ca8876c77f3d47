package io.github.flameyossnowy.associative.api.exceptions;

/**
 * Root of every error raised by record stores, registries and query plans.
 */
public class AssociativeException extends RuntimeException {
    public AssociativeException(String message) {
        super(message);
    }

    public AssociativeException(String message, Throwable cause) {
        super(message, cause);
    }
}
