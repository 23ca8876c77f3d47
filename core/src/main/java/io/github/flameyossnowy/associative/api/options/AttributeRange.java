package io.github.flameyossnowy.associative.api.options;

import io.github.flameyossnowy.associative.api.utils.AttributeValues;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Inclusive range over attribute values. A {@code null} bound is open.
 *
 * <pre>{@code
 * AttributeRange.atLeast(100)     // duration >= 100
 * AttributeRange.between(30, 90)  // 30 <= duration <= 90
 * }</pre>
 */
public record AttributeRange(@Nullable Object lower, @Nullable Object upper) {
    public AttributeRange {
        if (lower == null && upper == null) {
            throw new IllegalArgumentException("A range needs at least one bound");
        }
    }

    @Contract("_, _ -> new")
    public static @NotNull AttributeRange between(@NotNull Object lower, @NotNull Object upper) {
        return new AttributeRange(lower, upper);
    }

    @Contract("_ -> new")
    public static @NotNull AttributeRange atLeast(@NotNull Object lower) {
        return new AttributeRange(lower, null);
    }

    @Contract("_ -> new")
    public static @NotNull AttributeRange atMost(@NotNull Object upper) {
        return new AttributeRange(null, upper);
    }

    /**
     * Whether {@code value} lies within the bounds. {@code null} is never contained.
     */
    public boolean contains(@Nullable Object value) {
        if (value == null) {
            return false;
        }
        if (lower != null && AttributeValues.compare(value, lower) < 0) {
            return false;
        }
        return upper == null || AttributeValues.compare(value, upper) <= 0;
    }

    @Override
    public String toString() {
        return (lower == null ? "(-inf" : "[" + lower) + ", " + (upper == null ? "+inf)" : upper + "]");
    }
}
