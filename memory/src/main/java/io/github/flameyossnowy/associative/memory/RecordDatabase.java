package io.github.flameyossnowy.associative.memory;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.json.RecordJsonCodec;
import io.github.flameyossnowy.associative.api.meta.AssociationDefinition;
import io.github.flameyossnowy.associative.api.meta.AssociationSpec;
import io.github.flameyossnowy.associative.api.meta.AttributeType;
import io.github.flameyossnowy.associative.api.meta.KindModel;
import io.github.flameyossnowy.associative.api.options.DatabaseOptions;
import io.github.flameyossnowy.associative.api.options.JoinAppendPolicy;
import io.github.flameyossnowy.associative.api.scope.ScopeDefinition;
import io.github.flameyossnowy.associative.api.scope.ScopeFunction;
import io.github.flameyossnowy.associative.memory.query.QueryExecutor;
import io.github.flameyossnowy.associative.memory.query.QueryPlan;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Entry point tying a {@link RecordStore}, an {@link AssociationRegistry}, a {@link ScopeEngine}
 * and a {@link QueryExecutor} together.
 *
 * <pre>{@code
 * RecordDatabase database = RecordDatabase.builder().build();
 * database.defineKind(KindModel.builder("videos")
 *     .attribute("title", AttributeType.STRING)
 *     .attribute("duration", AttributeType.INTEGER)
 *     .build());
 * database.insert("videos", Map.of("title", "Cat", "duration", 90));
 * long count = database.query("videos").where("duration", AttributeRange.atLeast(60)).count();
 * }</pre>
 */
public final class RecordDatabase {
    private final Logger logger = LoggerFactory.getLogger(RecordDatabase.class);

    private final DatabaseOptions options;
    private final RecordStore store;
    private final AssociationRegistry associations;
    private final ScopeEngine scopes;
    private final QueryExecutor executor;
    private final RecordJsonCodec codec;

    private RecordDatabase(DatabaseOptions options, RecordJsonCodec codec) {
        this.options = options;
        this.store = new RecordStore(options);
        this.associations = new AssociationRegistry(store, options.joinAppendPolicy());
        this.scopes = new ScopeEngine();
        this.executor = new QueryExecutor(store, associations, scopes);
        this.codec = codec;
        logger.debug("Created record database with {}", options);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RecordDatabase create() {
        return builder().build();
    }

    /* =========================
       Definitions
       ========================= */

    public RecordDatabase defineKind(@NotNull KindModel model) {
        store.defineKind(model);
        return this;
    }

    /**
     * Defines a kind whose attributes are all nullable.
     */
    public RecordDatabase defineKind(@NotNull String name, @NotNull Map<String, AttributeType> schema) {
        return defineKind(KindModel.of(name, schema));
    }

    public AssociationDefinition defineAssociation(@NotNull String kind, @NotNull String name, @NotNull AssociationSpec spec) {
        return associations.define(kind, name, spec);
    }

    public ScopeDefinition defineScope(@NotNull String kind, @NotNull String name, @NotNull ScopeFunction function) {
        return scopes.defineScope(kind, name, function);
    }

    /* =========================
       Records
       ========================= */

    public @NotNull DataRecord insert(@NotNull String kind, @NotNull Map<String, ?> attributes) {
        return store.insert(kind, attributes);
    }

    public @NotNull DataRecord get(@NotNull String kind, long id) {
        return store.get(kind, id);
    }

    public @Nullable DataRecord find(@NotNull String kind, long id) {
        return store.find(kind, id);
    }

    public @NotNull List<DataRecord> all(@NotNull String kind) {
        return store.all(kind);
    }

    public void update(@NotNull DataRecord record, @NotNull String attribute, @Nullable Object value) {
        store.update(record, attribute, value);
    }

    public boolean delete(@NotNull DataRecord record) {
        return store.delete(record.kind(), record.id());
    }

    /* =========================
       Associations
       ========================= */

    public @NotNull List<DataRecord> resolve(@NotNull DataRecord record, @NotNull String association) {
        return associations.resolve(record, association);
    }

    public @Nullable DataRecord resolveOne(@NotNull DataRecord record, @NotNull String association) {
        return associations.resolveOne(record, association);
    }

    public void assign(@NotNull DataRecord record, @NotNull String association, @Nullable DataRecord target) {
        associations.assign(record, association, target);
    }

    public @NotNull List<DataRecord> append(@NotNull DataRecord owner, @NotNull String association, @NotNull DataRecord... items) {
        return associations.append(owner, association, items);
    }

    public @NotNull AssociationCollection collection(@NotNull DataRecord owner, @NotNull String association) {
        return new AssociationCollection(associations, owner, association);
    }

    /* =========================
       Queries
       ========================= */

    public @NotNull QueryPlan query(@NotNull String kind) {
        return executor.query(kind);
    }

    public @NotNull List<DataRecord> applyScope(
        @NotNull List<DataRecord> records,
        @NotNull String kind,
        @NotNull String name,
        Object @NotNull ... args
    ) {
        return scopes.applyScope(records, kind, name, args);
    }

    /* =========================
       JSON
       ========================= */

    public @NotNull String toJson(@NotNull Collection<DataRecord> records) {
        return codec.write(records);
    }

    /**
     * Inserts one record per object of a JSON array, in document order.
     */
    public @NotNull List<DataRecord> importJson(@NotNull String kind, @NotNull String json) {
        List<Map<String, Object>> rows = codec.readAttributes(json);
        List<DataRecord> inserted = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            inserted.add(store.insert(kind, row));
        }
        logger.info("Imported {} {} records", inserted.size(), kind);
        return inserted;
    }

    /* =========================
       Components
       ========================= */

    public DatabaseOptions options() {
        return options;
    }

    public RecordStore store() {
        return store;
    }

    public AssociationRegistry associations() {
        return associations;
    }

    public ScopeEngine scopes() {
        return scopes;
    }

    public static final class Builder {
        private DatabaseOptions options = DatabaseOptions.defaults();
        private RecordJsonCodec codec;

        private Builder() {
        }

        public Builder options(@NotNull DatabaseOptions options) {
            this.options = options;
            return this;
        }

        public Builder joinAppendPolicy(@NotNull JoinAppendPolicy policy) {
            this.options = options.withJoinAppendPolicy(policy);
            return this;
        }

        public Builder strictAttributes(boolean strict) {
            this.options = options.withStrictAttributes(strict);
            return this;
        }

        public Builder jsonCodec(@NotNull RecordJsonCodec codec) {
            this.codec = codec;
            return this;
        }

        public RecordDatabase build() {
            return new RecordDatabase(options, codec == null ? new RecordJsonCodec() : codec);
        }
    }
}
