package io.github.flameyossnowy.associative.api.scope;

import org.jetbrains.annotations.NotNull;

public record ScopeDefinition(@NotNull String kind, @NotNull String name, @NotNull ScopeFunction function) {
}
