package io.github.flameyossnowy.associative.api.utils;

import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;
import java.util.Objects;

/**
 * Comparison rules shared by filters, ordering and aggregates.
 * <p>
 * Numbers compare numerically regardless of their boxed type, strings lexicographically,
 * booleans with {@code false} first. {@code null} sorts before any value.
 */
public final class AttributeValues {
    public static final Comparator<Object> NATURAL_ORDER = AttributeValues::compare;

    private AttributeValues() {
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    public static int compare(@Nullable Object left, @Nullable Object right) {
        if (left == right) return 0;
        if (left == null) return -1;
        if (right == null) return 1;

        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            return Double.compare(l.doubleValue(), r.doubleValue());
        }

        if (left.getClass() == right.getClass() && left instanceof Comparable comparable) {
            return comparable.compareTo(right);
        }

        throw new ValidationException("Cannot compare " + left.getClass().getSimpleName() + " (" + left + ") with "
            + right.getClass().getSimpleName() + " (" + right + ")");
    }

    public static boolean equal(@Nullable Object left, @Nullable Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compare(left, right) == 0;
        }
        return Objects.equals(left, right);
    }

    public static double toDouble(@Nullable Object value, String attribute) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ValidationException("Attribute '" + attribute + "' is not numeric: " + value);
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }
}
