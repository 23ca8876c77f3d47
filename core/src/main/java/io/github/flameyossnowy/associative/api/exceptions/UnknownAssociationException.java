package io.github.flameyossnowy.associative.api.exceptions;

public class UnknownAssociationException extends AssociativeException {
    private final String kind;
    private final String association;

    public UnknownAssociationException(String kind, String association) {
        super("No association '" + association + "' on kind " + kind);
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
