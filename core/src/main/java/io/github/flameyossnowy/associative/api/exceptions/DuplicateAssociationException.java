package io.github.flameyossnowy.associative.api.exceptions;

public class DuplicateAssociationException extends AssociativeException {
    private final String kind;
    private final String association;

    public DuplicateAssociationException(String kind, String association) {
        super("Association '" + association + "' is already defined on kind " + kind);
        this.kind = kind;
        this.association = association;
    }

    public String getKind() {
        return kind;
    }

    public String getAssociation() {
        return association;
    }
}
