package io.github.flameyossnowy.associative.api.exceptions;

public class UnknownKindException extends AssociativeException {
    private final String kind;

    public UnknownKindException(String kind) {
        super("Unknown kind: " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
