package io.github.flameyossnowy.associative.api.meta;

import org.jetbrains.annotations.NotNull;

/**
 * An association registered on a source kind under a name unique within that kind.
 */
public record AssociationDefinition(@NotNull String sourceKind, @NotNull String name, @NotNull AssociationSpec spec) {
    public AssociationKind kind() {
        return spec.kind();
    }

    public String targetKind() {
        return spec.targetKind();
    }

    public String foreignKey() {
        return spec.foreignKey();
    }

    public boolean isCollection() {
        return spec.kind().isCollection();
    }

    public String owningKind() {
        return spec.owningKind(sourceKind);
    }

    public boolean isSelfReferential() {
        return sourceKind.equals(spec.targetKind());
    }
}
