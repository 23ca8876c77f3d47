package io.github.flameyossnowy.associative.api.exceptions;

/**
 * A kind, attribute or scope was declared under a name that is already taken.
 */
public class DuplicateDefinitionException extends AssociativeException {
    public DuplicateDefinitionException(String message) {
        super(message);
    }
}
