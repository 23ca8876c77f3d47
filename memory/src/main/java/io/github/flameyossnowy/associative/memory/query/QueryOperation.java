package io.github.flameyossnowy.associative.memory.query;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.options.SortOrder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One step of a {@link QueryPlan}, evaluated in order by the {@link QueryExecutor}.
 */
public sealed interface QueryOperation {

    /**
     * A named scope of {@code kind}, built-in or user defined.
     */
    record Scope(@NotNull String kind, @NotNull String name, @NotNull List<Object> arguments) implements QueryOperation {
    }

    /**
     * Equality, or inclusive range when {@code value} is an
     * {@link io.github.flameyossnowy.associative.api.options.AttributeRange}.
     */
    record Filter(@NotNull String attribute, @Nullable Object value) implements QueryOperation {
    }

    record Order(@NotNull String column, @NotNull SortOrder order) implements QueryOperation {
    }

    /**
     * Replaces every record by its associated records.
     */
    record Join(@NotNull String sourceKind, @NotNull String association) implements QueryOperation {
    }

    /**
     * Intersects by identity with the result of another plan, evaluated when this plan is.
     */
    record MergePlan(@NotNull String kind, @NotNull List<QueryOperation> operations) implements QueryOperation {
    }

    /**
     * Intersects by identity with a fixed set of records.
     */
    record MergeRecords(@NotNull List<DataRecord> records) implements QueryOperation {
    }

    record Limit(int limit) implements QueryOperation {
    }
}
