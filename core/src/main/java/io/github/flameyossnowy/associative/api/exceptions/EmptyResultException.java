package io.github.flameyossnowy.associative.api.exceptions;

/**
 * Thrown when a single record is requested from a query that produced none.
 */
public class EmptyResultException extends AssociativeException {
    public EmptyResultException(String kind) {
        super("Query on kind " + kind + " returned no records");
    }
}
