package io.github.flameyossnowy.associative.memory;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.options.AttributeRange;
import io.github.flameyossnowy.associative.api.options.SortOrder;
import io.github.flameyossnowy.associative.api.utils.AttributeValues;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Built-in record set transformations. Scope functions are usually written in terms of these:
 *
 * <pre>{@code
 * database.defineScope("videos", "duration_min",
 *     (records, args) -> Scopes.where(records, "duration", AttributeRange.atLeast(args[0])));
 * }</pre>
 *
 * Every method returns a new list and never mutates its input.
 */
public final class Scopes {
    private Scopes() {
    }

    /**
     * Keeps records whose attribute equals {@code value}, or lies within it when it is an {@link AttributeRange}.
     */
    @Contract(pure = true)
    public static @NotNull List<DataRecord> where(
        @NotNull List<DataRecord> records,
        @NotNull String attribute,
        @Nullable Object value
    ) {
        List<DataRecord> filtered = new ArrayList<>(records.size());
        for (DataRecord record : records) {
            if (matches(record.get(attribute), value)) {
                filtered.add(record);
            }
        }
        return filtered;
    }

    /**
     * Stable ascending sort by the natural order of an attribute, {@code null} first.
     */
    @Contract(pure = true)
    public static @NotNull List<DataRecord> order(@NotNull List<DataRecord> records, @NotNull String column) {
        return order(records, column, SortOrder.ASCENDING);
    }

    @Contract(pure = true)
    public static @NotNull List<DataRecord> order(
        @NotNull List<DataRecord> records,
        @NotNull String column,
        @NotNull SortOrder order
    ) {
        Comparator<DataRecord> comparator = Comparator.comparing(record -> record.get(column), AttributeValues.NATURAL_ORDER);
        if (order == SortOrder.DESCENDING) {
            comparator = comparator.reversed();
        }

        List<DataRecord> sorted = new ArrayList<>(records);
        sorted.sort(comparator);
        return sorted;
    }

    /**
     * Keeps records of {@code left} whose identity appears in {@code right}, in the order of {@code left}.
     */
    @Contract(pure = true)
    public static @NotNull List<DataRecord> merge(
        @NotNull List<DataRecord> left,
        @NotNull Collection<DataRecord> right
    ) {
        Set<DataRecord> identities = new HashSet<>(right);
        List<DataRecord> merged = new ArrayList<>(Math.min(left.size(), identities.size()));
        for (DataRecord record : left) {
            if (identities.contains(record)) {
                merged.add(record);
            }
        }
        return merged;
    }

    @Contract(pure = true)
    public static @NotNull List<DataRecord> limit(@NotNull List<DataRecord> records, int limit) {
        if (limit < 0 || records.size() <= limit) {
            return new ArrayList<>(records);
        }
        return new ArrayList<>(records.subList(0, limit));
    }

    private static boolean matches(@Nullable Object actual, @Nullable Object expected) {
        if (expected instanceof AttributeRange range) {
            return range.contains(actual);
        }
        if (actual == null || expected == null) {
            return actual == expected;
        }
        return AttributeValues.equal(actual, expected);
    }
}
