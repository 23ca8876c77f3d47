package io.github.flameyossnowy.associative.api.exceptions.json;

import io.github.flameyossnowy.associative.api.exceptions.AssociativeException;

public class RecordJsonException extends AssociativeException {
    private final JsonLocation location;

    public RecordJsonException(String message, Throwable cause, JsonLocation location) {
        super(message, cause);
        this.location = location;
    }

    public JsonLocation getLocation() {
        return location;
    }
}
