package io.github.flameyossnowy.associative.memory;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.DuplicateDefinitionException;
import io.github.flameyossnowy.associative.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.associative.api.exceptions.UnknownKindException;
import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import io.github.flameyossnowy.associative.api.meta.KindModel;
import io.github.flameyossnowy.associative.api.options.DatabaseOptions;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Holds the records of every declared kind.
 * <p>
 * Ids are assigned per kind starting at 1 and never reused. {@link #all(String)} yields
 * insertion order, which is the default order of every query.
 * <p>
 * Not thread-safe: callers serialize all mutations.
 */
public class RecordStore {
    private final Logger logger = LoggerFactory.getLogger(RecordStore.class);

    private final Map<String, KindTable> tables = new LinkedHashMap<>(16);
    private final DatabaseOptions options;

    public RecordStore(@NotNull DatabaseOptions options) {
        this.options = options;
    }

    public void defineKind(@NotNull KindModel model) {
        if (tables.containsKey(model.name())) {
            throw new DuplicateDefinitionException("Kind " + model.name() + " is already defined");
        }
        tables.put(model.name(), new KindTable(model));
        logger.debug("Defined kind {} with attributes {}", model.name(), model.attributes());
    }

    public boolean hasKind(@NotNull String kind) {
        return tables.containsKey(kind);
    }

    public @NotNull KindModel kind(@NotNull String kind) {
        return table(kind).model;
    }

    public @NotNull DataRecord insert(@NotNull String kind, @NotNull Map<String, ?> attributes) {
        KindTable table = table(kind);
        if (attributes.containsKey(KindModel.ID)) {
            throw new ValidationException("The identity of a " + kind + " record is assigned by the store");
        }

        Map<String, ?> accepted = attributes;
        Set<String> undeclared = table.model.undeclared(attributes);
        if (!undeclared.isEmpty()) {
            if (options.strictAttributes()) {
                throw new ValidationException("Unknown attributes " + undeclared + " on kind " + kind);
            }
            logger.warn("Dropping undeclared attributes {} on insert into {}", undeclared, kind);
            Map<String, Object> filtered = new LinkedHashMap<>(attributes);
            filtered.keySet().removeAll(undeclared);
            accepted = filtered;
        }

        Map<String, Object> normalized = table.model.validateInsert(accepted);
        long id = table.nextId++;
        DataRecord record = new DataRecord(table.model, id, normalized);
        table.rows.put(id, record);
        logger.debug("Inserted {}", record);
        return record;
    }

    /**
     * @throws RecordNotFoundException if no record of {@code kind} has {@code id}
     */
    public @NotNull DataRecord get(@NotNull String kind, long id) {
        DataRecord record = find(kind, id);
        if (record == null) {
            throw new RecordNotFoundException(kind, id);
        }
        return record;
    }

    public @Nullable DataRecord find(@NotNull String kind, long id) {
        return table(kind).rows.get(id);
    }

    public @NotNull List<DataRecord> all(@NotNull String kind) {
        return List.copyOf(table(kind).rows.values());
    }

    public long count(@NotNull String kind) {
        return table(kind).rows.size();
    }

    /**
     * Writes an attribute of a stored record. The write is visible to every later read.
     *
     * @throws RecordNotFoundException if the record is no longer stored
     */
    public void update(@NotNull DataRecord record, @NotNull String attribute, @Nullable Object value) {
        DataRecord stored = find(record.kind(), record.id());
        if (stored == null) {
            throw new RecordNotFoundException(record.kind(), record.id());
        }
        stored.set(attribute, value);
        logger.debug("Updated {}.{} = {}", stored.kind() + "#" + stored.id(), attribute, value);
    }

    /**
     * Removes a record. Records referencing it through foreign keys are left as they are.
     *
     * @return whether a record was removed
     */
    public boolean delete(@NotNull String kind, long id) {
        DataRecord removed = table(kind).rows.remove(id);
        if (removed != null) {
            logger.debug("Deleted {}", removed);
        }
        return removed != null;
    }

    private KindTable table(String kind) {
        KindTable table = tables.get(kind);
        if (table == null) {
            throw new UnknownKindException(kind);
        }
        return table;
    }

    private static final class KindTable {
        private final KindModel model;
        private final Map<Long, DataRecord> rows = new LinkedHashMap<>(32);
        private long nextId = 1L;

        private KindTable(KindModel model) {
            this.model = model;
        }
    }
}
