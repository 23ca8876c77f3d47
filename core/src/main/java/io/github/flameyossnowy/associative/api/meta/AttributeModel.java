package io.github.flameyossnowy.associative.api.meta;

import org.jetbrains.annotations.NotNull;

/**
 * A declared attribute of a kind.
 *
 * @param name     attribute name, unique within its kind
 * @param type     value type
 * @param nullable whether the attribute may be left unset; non-nullable attributes are required on insert
 */
public record AttributeModel(@NotNull String name, @NotNull AttributeType type, boolean nullable) {
}
