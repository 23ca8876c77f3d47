package io.github.flameyossnowy.associative.api.meta;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Value types an attribute of a kind may hold.
 * <p>
 * Values are normalized on write so comparisons downstream only ever see
 * {@link String}, {@link Long}, {@link Boolean} or {@link Double}.
 */
public enum AttributeType {
    STRING(String.class),
    INTEGER(Long.class),
    BOOLEAN(Boolean.class),
    FLOAT(Double.class);

    private final Class<?> storedType;

    AttributeType(Class<?> storedType) {
        this.storedType = storedType;
    }

    public Class<?> storedType() {
        return storedType;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    @Contract(pure = true)
    public boolean accepts(@NotNull Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> isIntegral(value);
            case FLOAT -> value instanceof Double || value instanceof Float || isIntegral(value);
        };
    }

    /**
     * Converts an accepted value to its stored representation.
     */
    @Contract(pure = true)
    public @NotNull Object normalize(@NotNull Object value) {
        return switch (this) {
            case STRING, BOOLEAN -> value;
            case INTEGER -> ((Number) value).longValue();
            case FLOAT -> ((Number) value).doubleValue();
        };
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }
}
