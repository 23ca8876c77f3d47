package io.github.flameyossnowy.associative.memory.query;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.EmptyResultException;
import io.github.flameyossnowy.associative.api.utils.AttributeValues;
import io.github.flameyossnowy.associative.memory.AssociationRegistry;
import io.github.flameyossnowy.associative.memory.RecordStore;
import io.github.flameyossnowy.associative.memory.ScopeEngine;
import io.github.flameyossnowy.associative.memory.Scopes;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Evaluates query plans against a record store.
 * <p>
 * Evaluation starts from every record of the base kind in insertion order and applies
 * each operation to the output of the previous one.
 */
public class QueryExecutor {
    private final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final RecordStore store;
    private final AssociationRegistry associations;
    private final ScopeEngine scopes;

    public QueryExecutor(@NotNull RecordStore store, @NotNull AssociationRegistry associations, @NotNull ScopeEngine scopes) {
        this.store = store;
        this.associations = associations;
        this.scopes = scopes;
    }

    /**
     * Starts a plan over every record of {@code kind}.
     *
     * @throws io.github.flameyossnowy.associative.api.exceptions.UnknownKindException if the kind is not defined
     */
    public @NotNull QueryPlan query(@NotNull String kind) {
        store.kind(kind);
        return new QueryPlan(this, kind, kind, List.of());
    }

    public @NotNull List<DataRecord> execute(@NotNull String baseKind, @NotNull List<QueryOperation> operations) {
        List<DataRecord> records = store.all(baseKind);
        logger.trace("Evaluating {} operations over {} {} records", operations.size(), records.size(), baseKind);

        for (QueryOperation operation : operations) {
            records = apply(records, operation);
        }
        return records;
    }

    /**
     * Maps every source record through an association, source order first, then each
     * source's target order. Duplicates are kept.
     */
    public @NotNull List<DataRecord> joins(@NotNull List<DataRecord> source, @NotNull String association) {
        List<DataRecord> targets = new ArrayList<>(source.size());
        for (DataRecord record : source) {
            targets.addAll(associations.resolve(record, association));
        }
        return targets;
    }

    public @NotNull List<DataRecord> merge(@NotNull List<DataRecord> left, @NotNull Collection<DataRecord> right) {
        return Scopes.merge(left, right);
    }

    public long count(@NotNull List<DataRecord> records) {
        return records.size();
    }

    /**
     * Mean of the non-null values of a numeric attribute, {@code 0.0} when there are none.
     */
    public double average(@NotNull List<DataRecord> records, @NotNull String attribute) {
        double sum = 0d;
        long count = 0;
        for (DataRecord record : records) {
            Object value = record.get(attribute);
            if (value == null) {
                continue;
            }
            sum += AttributeValues.toDouble(value, attribute);
            count++;
        }
        return count == 0 ? 0d : sum / count;
    }

    public double sum(@NotNull List<DataRecord> records, @NotNull String attribute) {
        double sum = 0d;
        for (DataRecord record : records) {
            Object value = record.get(attribute);
            if (value != null) {
                sum += AttributeValues.toDouble(value, attribute);
            }
        }
        return sum;
    }

    /**
     * @throws EmptyResultException if {@code records} is empty
     */
    public @NotNull DataRecord first(@NotNull List<DataRecord> records, @NotNull String kind) {
        if (records.isEmpty()) {
            throw new EmptyResultException(kind);
        }
        return records.get(0);
    }

    RecordStore store() {
        return store;
    }

    AssociationRegistry associations() {
        return associations;
    }

    ScopeEngine scopes() {
        return scopes;
    }

    private List<DataRecord> apply(List<DataRecord> records, QueryOperation operation) {
        if (operation instanceof QueryOperation.Scope scope) {
            return scopes.applyScope(records, scope.kind(), scope.name(), scope.arguments().toArray());
        }
        if (operation instanceof QueryOperation.Filter filter) {
            return Scopes.where(records, filter.attribute(), filter.value());
        }
        if (operation instanceof QueryOperation.Order order) {
            return Scopes.order(records, order.column(), order.order());
        }
        if (operation instanceof QueryOperation.Join join) {
            return joins(records, join.association());
        }
        if (operation instanceof QueryOperation.MergePlan mergePlan) {
            return merge(records, execute(mergePlan.kind(), mergePlan.operations()));
        }
        if (operation instanceof QueryOperation.MergeRecords mergeRecords) {
            return merge(records, mergeRecords.records());
        }
        if (operation instanceof QueryOperation.Limit limit) {
            return Scopes.limit(records, limit.limit());
        }
        throw new IllegalStateException("Unsupported query operation: " + operation);
    }
}
