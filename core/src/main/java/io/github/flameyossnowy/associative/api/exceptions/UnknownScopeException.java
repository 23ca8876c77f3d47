package io.github.flameyossnowy.associative.api.exceptions;

public class UnknownScopeException extends AssociativeException {
    private final String kind;
    private final String scope;

    public UnknownScopeException(String kind, String scope) {
        super("No scope '" + scope + "' on kind " + kind);
        this.kind = kind;
        this.scope = scope;
    }

    public String getKind() {
        return kind;
    }

    public String getScope() {
        return scope;
    }
}
