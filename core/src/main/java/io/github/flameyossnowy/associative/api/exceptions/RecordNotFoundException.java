package io.github.flameyossnowy.associative.api.exceptions;

public class RecordNotFoundException extends AssociativeException {
    private final String kind;
    private final long id;

    public RecordNotFoundException(String kind, long id) {
        super("No " + kind + " record with id " + id);
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public long getId() {
        return id;
    }
}
