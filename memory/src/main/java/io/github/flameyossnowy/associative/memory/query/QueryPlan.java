package io.github.flameyossnowy.associative.memory.query;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.UnknownScopeException;
import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import io.github.flameyossnowy.associative.api.meta.AssociationDefinition;
import io.github.flameyossnowy.associative.api.meta.KindModel;
import io.github.flameyossnowy.associative.api.options.SortOrder;
import io.github.flameyossnowy.associative.memory.ScopeEngine;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Stream;

/**
 * Immutable, lazily evaluated chain of query operations over a base kind.
 * <p>
 * Chaining methods validate their arguments against the current kind and return a new plan;
 * nothing touches the store until a terminal operation ({@link #toList()}, {@link #stream()},
 * {@link #iterator()}, {@link #count()}, {@link #average(String)}, {@link #sum(String)},
 * {@link #first()}) runs. A plan can be materialized once; build a new one to query again.
 *
 * <pre>{@code
 * double animals = database.query("playlists")
 *     .where("name", "Animals")
 *     .join("videos")
 *     .average("duration");
 * }</pre>
 */
public final class QueryPlan implements Iterable<DataRecord> {
    private final QueryExecutor executor;
    private final String baseKind;
    private final String currentKind;
    private final List<QueryOperation> operations;

    private QueryState state = QueryState.BUILT;

    QueryPlan(QueryExecutor executor, String baseKind, String currentKind, List<QueryOperation> operations) {
        this.executor = executor;
        this.baseKind = baseKind;
        this.currentKind = currentKind;
        this.operations = operations;
    }

    public @NotNull String baseKind() {
        return baseKind;
    }

    /**
     * Kind of the records this plan yields; differs from the base kind after a join.
     */
    public @NotNull String currentKind() {
        return currentKind;
    }

    public @NotNull List<QueryOperation> operations() {
        return operations;
    }

    public @NotNull QueryState state() {
        return state;
    }

    /* =========================
       Chaining
       ========================= */

    /**
     * Applies a named scope of the current kind.
     *
     * The built-in {@code where} and {@code order} scopes are checked like {@link #where} and {@link #order}.
     *
     * @throws UnknownScopeException if the current kind has no such scope
     */
    @Contract("_, _ -> new")
    public @NotNull QueryPlan scope(@NotNull String name, Object @NotNull ... args) {
        checkBuilt();
        if (ScopeEngine.isBuiltIn(name)) {
            String attribute = ScopeEngine.builtInAttribute(name, args);
            return ScopeEngine.WHERE.equals(name)
                ? where(attribute, args[1])
                : order(attribute, ScopeEngine.builtInSortOrder(args));
        }
        if (!executor.scopes().hasScope(currentKind, name)) {
            throw new UnknownScopeException(currentKind, name);
        }
        return then(new QueryOperation.Scope(currentKind, name, Collections.unmodifiableList(Arrays.asList(args.clone()))));
    }

    /**
     * Keeps records whose attribute equals {@code value}, or lies within it when it is an
     * {@link io.github.flameyossnowy.associative.api.options.AttributeRange}.
     */
    @Contract("_, _ -> new")
    public @NotNull QueryPlan where(@NotNull String attribute, @Nullable Object value) {
        checkBuilt();
        checkAttribute(attribute);
        return then(new QueryOperation.Filter(attribute, value));
    }

    @Contract("_ -> new")
    public @NotNull QueryPlan order(@NotNull String column) {
        return order(column, SortOrder.ASCENDING);
    }

    @Contract("_, _ -> new")
    public @NotNull QueryPlan order(@NotNull String column, @NotNull SortOrder order) {
        checkBuilt();
        checkAttribute(column);
        return then(new QueryOperation.Order(column, order));
    }

    /**
     * Moves to the records associated with the current ones. The resulting plan yields the
     * association's target kind.
     *
     * @throws io.github.flameyossnowy.associative.api.exceptions.UnknownAssociationException if the
     *         current kind has no such association
     */
    @Contract("_ -> new")
    public @NotNull QueryPlan join(@NotNull String association) {
        checkBuilt();
        AssociationDefinition definition = executor.associations().definition(currentKind, association);
        List<QueryOperation> next = append(new QueryOperation.Join(currentKind, association));
        return new QueryPlan(executor, baseKind, definition.targetKind(), next);
    }

    /**
     * Keeps the records whose identity also appears in the result of {@code other}.
     * {@code other} is evaluated along with this plan and is not materialized itself.
     */
    @Contract("_ -> new")
    public @NotNull QueryPlan merge(@NotNull QueryPlan other) {
        checkBuilt();
        other.checkBuilt();
        if (!other.currentKind.equals(currentKind)) {
            throw new IllegalArgumentException(
                "Cannot merge a plan yielding " + other.currentKind + " into a plan yielding " + currentKind);
        }
        return then(new QueryOperation.MergePlan(other.baseKind, other.operations));
    }

    /**
     * Keeps the records whose identity appears in {@code records}.
     */
    @Contract("_ -> new")
    public @NotNull QueryPlan merge(@NotNull Collection<DataRecord> records) {
        checkBuilt();
        return then(new QueryOperation.MergeRecords(List.copyOf(records)));
    }

    @Contract("_ -> new")
    public @NotNull QueryPlan limit(int limit) {
        checkBuilt();
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        return then(new QueryOperation.Limit(limit));
    }

    /* =========================
       Terminal operations
       ========================= */

    public @NotNull List<DataRecord> toList() {
        return List.copyOf(materialize());
    }

    public @NotNull Stream<DataRecord> stream() {
        return materialize().stream();
    }

    @Override
    public @NotNull Iterator<DataRecord> iterator() {
        return Collections.unmodifiableList(materialize()).iterator();
    }

    public long count() {
        return executor.count(materialize());
    }

    /**
     * Mean of a numeric attribute over the results, {@code 0.0} when there are none.
     *
     * @throws ValidationException if the attribute is not numeric
     */
    public double average(@NotNull String attribute) {
        checkNumeric(attribute);
        return executor.average(materialize(), attribute);
    }

    public double sum(@NotNull String attribute) {
        checkNumeric(attribute);
        return executor.sum(materialize(), attribute);
    }

    /**
     * @throws io.github.flameyossnowy.associative.api.exceptions.EmptyResultException if the plan yields nothing
     */
    public @NotNull DataRecord first() {
        return executor.first(materialize(), currentKind);
    }

    @Override
    public String toString() {
        return "QueryPlan{" + baseKind + " -> " + currentKind + ", " + operations + ", " + state + '}';
    }

    /**
     * Runs the plan. The plan is consumed only when evaluation succeeds.
     */
    private List<DataRecord> materialize() {
        checkBuilt();
        List<DataRecord> records = executor.execute(baseKind, operations);
        state = QueryState.MATERIALIZED;
        return records;
    }

    private QueryPlan then(QueryOperation operation) {
        return new QueryPlan(executor, baseKind, currentKind, append(operation));
    }

    private List<QueryOperation> append(QueryOperation operation) {
        List<QueryOperation> next = new ArrayList<>(operations.size() + 1);
        next.addAll(operations);
        next.add(operation);
        return Collections.unmodifiableList(next);
    }

    private void checkBuilt() {
        if (state != QueryState.BUILT) {
            throw new IllegalStateException("Query plan over " + baseKind + " was already materialized");
        }
    }

    private void checkAttribute(String attribute) {
        KindModel model = executor.store().kind(currentKind);
        if (!model.hasAttribute(attribute)) {
            throw new ValidationException("Unknown attribute '" + attribute + "' on kind " + currentKind);
        }
    }

    private void checkNumeric(String attribute) {
        checkBuilt();
        KindModel model = executor.store().kind(currentKind);
        if (!model.hasAttribute(attribute)) {
            throw new ValidationException("Unknown attribute '" + attribute + "' on kind " + currentKind);
        }
        if (!model.typeOf(attribute).isNumeric()) {
            throw new ValidationException(
                "Attribute '" + attribute + "' of kind " + currentKind + " is " + model.typeOf(attribute) + ", not numeric");
        }
    }
}
