package io.github.flameyossnowy.associative.api.meta;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Shape of an association, independent of the kind and name it is registered under.
 * Kinds are referenced by name and only looked up when the association is used.
 *
 * @param kind          association kind
 * @param targetKind    kind the association yields
 * @param foreignKey    on the source for {@link AssociationKind#ONE_TO_ONE}, on the target for
 *                      {@link AssociationKind#ONE_TO_MANY}, the join's source-side key for
 *                      {@link AssociationKind#MANY_TO_MANY_THROUGH}
 * @param joinKind      join kind of a through-association
 * @param joinTargetKey the join's target-side key of a through-association
 */
public record AssociationSpec(
    @NotNull AssociationKind kind,
    @NotNull String targetKind,
    @NotNull String foreignKey,
    @Nullable String joinKind,
    @Nullable String joinTargetKey
) {
    public AssociationSpec {
        Objects.requireNonNull(kind, "Association kind cannot be null");
        Objects.requireNonNull(targetKind, "Target kind cannot be null");
        Objects.requireNonNull(foreignKey, "Foreign key cannot be null");
        if (kind == AssociationKind.MANY_TO_MANY_THROUGH && (joinKind == null || joinTargetKey == null)) {
            throw new IllegalArgumentException("A through-association needs a join kind and a join target key");
        }
    }

    /**
     * {@code source.foreignKey} references one {@code targetKind} record.
     */
    @Contract("_, _ -> new")
    public static @NotNull AssociationSpec oneToOne(@NotNull String targetKind, @NotNull String foreignKey) {
        return new AssociationSpec(AssociationKind.ONE_TO_ONE, targetKind, foreignKey, null, null);
    }

    /**
     * Every {@code targetKind} record whose {@code foreignKey} equals the source id.
     */
    @Contract("_, _ -> new")
    public static @NotNull AssociationSpec oneToMany(@NotNull String targetKind, @NotNull String foreignKey) {
        return new AssociationSpec(AssociationKind.ONE_TO_MANY, targetKind, foreignKey, null, null);
    }

    /**
     * Targets reached through {@code joinKind} records whose {@code joinSourceKey} equals the source id
     * and whose {@code joinTargetKey} references the target.
     */
    @Contract("_, _, _, _ -> new")
    public static @NotNull AssociationSpec manyToManyThrough(
        @NotNull String joinKind,
        @NotNull String joinSourceKey,
        @NotNull String targetKind,
        @NotNull String joinTargetKey
    ) {
        return new AssociationSpec(AssociationKind.MANY_TO_MANY_THROUGH, targetKind, joinSourceKey, joinKind, joinTargetKey);
    }

    /**
     * Name of the kind that holds {@link #foreignKey()}.
     */
    public @NotNull String owningKind(@NotNull String sourceKind) {
        return switch (kind) {
            case ONE_TO_ONE -> sourceKind;
            case ONE_TO_MANY -> targetKind;
            case MANY_TO_MANY_THROUGH -> Objects.requireNonNull(joinKind);
        };
    }
}
