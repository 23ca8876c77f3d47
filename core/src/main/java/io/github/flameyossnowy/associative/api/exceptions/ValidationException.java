package io.github.flameyossnowy.associative.api.exceptions;

/**
 * An attribute is missing, mistyped or not declared, or a definition references
 * an attribute that cannot serve its purpose.
 */
public class ValidationException extends AssociativeException {
    public ValidationException(String message) {
        super(message);
    }
}
