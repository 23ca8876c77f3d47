package io.github.flameyossnowy.associative.api.meta;

public enum AssociationKind {
    /**
     * The source holds the foreign key of a single target.
     */
    ONE_TO_ONE,

    /**
     * Targets hold the foreign key of the source.
     */
    ONE_TO_MANY,

    /**
     * Join records hold one foreign key to the source and one to the target.
     */
    MANY_TO_MANY_THROUGH;

    public boolean isCollection() {
        return this != ONE_TO_ONE;
    }
}
