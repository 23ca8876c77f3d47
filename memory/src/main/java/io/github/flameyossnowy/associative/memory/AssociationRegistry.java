package io.github.flameyossnowy.associative.memory;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.DuplicateAssociationException;
import io.github.flameyossnowy.associative.api.exceptions.UnknownAssociationException;
import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import io.github.flameyossnowy.associative.api.meta.AssociationDefinition;
import io.github.flameyossnowy.associative.api.meta.AssociationKind;
import io.github.flameyossnowy.associative.api.meta.AssociationSpec;
import io.github.flameyossnowy.associative.api.meta.AttributeModel;
import io.github.flameyossnowy.associative.api.meta.AttributeType;
import io.github.flameyossnowy.associative.api.meta.KindModel;
import io.github.flameyossnowy.associative.api.options.JoinAppendPolicy;
import io.github.flameyossnowy.associative.api.utils.AttributeValues;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Declares associations between kinds and resolves them against a {@link RecordStore}.
 * <p>
 * Kinds are looked up by name on every resolution, so associations may be declared
 * before the kinds they reference, and kinds may reference each other or themselves.
 */
public class AssociationRegistry {
    private final Logger logger = LoggerFactory.getLogger(AssociationRegistry.class);

    private final RecordStore store;
    private final JoinAppendPolicy appendPolicy;

    // source kind -> association name -> definition
    private final Map<String, Map<String, AssociationDefinition>> definitions = new HashMap<>(16);

    public AssociationRegistry(@NotNull RecordStore store, @NotNull JoinAppendPolicy appendPolicy) {
        this.store = store;
        this.appendPolicy = appendPolicy;
    }

    public @NotNull AssociationDefinition define(
        @NotNull String sourceKind,
        @NotNull String name,
        @NotNull AssociationSpec spec
    ) {
        Map<String, AssociationDefinition> byName = definitions.computeIfAbsent(sourceKind, ignored -> new LinkedHashMap<>());
        if (byName.containsKey(name)) {
            throw new DuplicateAssociationException(sourceKind, name);
        }

        AssociationDefinition definition = new AssociationDefinition(sourceKind, name, spec);
        String owningKind = definition.owningKind();
        if (store.hasKind(owningKind)) {
            checkKeys(definition);
        } else {
            logger.warn("Kind {} is not defined yet, keys of association {}.{} are checked on first use",
                owningKind, sourceKind, name);
        }

        byName.put(name, definition);
        logger.debug("Defined {} association {}.{} -> {}", spec.kind(), sourceKind, name, spec.targetKind());
        return definition;
    }

    public boolean has(@NotNull String kind, @NotNull String name) {
        Map<String, AssociationDefinition> byName = definitions.get(kind);
        return byName != null && byName.containsKey(name);
    }

    public @NotNull AssociationDefinition definition(@NotNull String kind, @NotNull String name) {
        Map<String, AssociationDefinition> byName = definitions.get(kind);
        AssociationDefinition definition = byName == null ? null : byName.get(name);
        if (definition == null) {
            throw new UnknownAssociationException(kind, name);
        }
        return definition;
    }

    /**
     * Resolves an association of {@code record}. A one-to-one association yields at most one record.
     */
    public @NotNull List<DataRecord> resolve(@NotNull DataRecord record, @NotNull String name) {
        AssociationDefinition definition = definition(record.kind(), name);
        checkKeys(definition);

        return switch (definition.kind()) {
            case ONE_TO_ONE -> {
                DataRecord target = resolveTarget(record, definition);
                yield target == null ? List.of() : List.of(target);
            }
            case ONE_TO_MANY -> resolveOneToMany(record, definition);
            case MANY_TO_MANY_THROUGH -> resolveThrough(record, definition);
        };
    }

    /**
     * Resolves a one-to-one association.
     *
     * @return the target, or {@code null} when the foreign key is unset
     * @throws io.github.flameyossnowy.associative.api.exceptions.RecordNotFoundException if the key references no record
     */
    public @Nullable DataRecord resolveOne(@NotNull DataRecord record, @NotNull String name) {
        AssociationDefinition definition = requireKind(record, name, AssociationKind.ONE_TO_ONE);
        checkKeys(definition);
        return resolveTarget(record, definition);
    }

    /**
     * Points a one-to-one association of {@code record} at {@code target}, or clears it when
     * {@code target} is {@code null}. The foreign key is written to the store immediately.
     */
    public void assign(@NotNull DataRecord record, @NotNull String name, @Nullable DataRecord target) {
        AssociationDefinition definition = requireKind(record, name, AssociationKind.ONE_TO_ONE);
        checkKeys(definition);
        if (target != null) {
            checkTarget(definition, target);
        }
        store.update(record, definition.foreignKey(), target == null ? null : target.id());
    }

    /**
     * Appends items to a collection association of {@code owner}.
     * <p>
     * For a many-to-many-through association a join record is inserted per item, subject to the
     * configured {@link JoinAppendPolicy}. For a one-to-many association each item's foreign key
     * is pointed at the owner.
     *
     * @return the records written: new join records, or the re-pointed items
     */
    public @NotNull List<DataRecord> append(@NotNull DataRecord owner, @NotNull String name, @NotNull DataRecord... items) {
        AssociationDefinition definition = definition(owner.kind(), name);
        if (!definition.isCollection()) {
            throw new IllegalArgumentException(
                "Association " + owner.kind() + "." + name + " is one-to-one, assign it instead of appending");
        }
        checkKeys(definition);
        for (DataRecord item : items) {
            checkTarget(definition, item);
        }

        List<DataRecord> written = new ArrayList<>(items.length);
        if (definition.kind() == AssociationKind.ONE_TO_MANY) {
            for (DataRecord item : items) {
                store.update(item, definition.foreignKey(), owner.id());
                written.add(item);
            }
            return written;
        }

        AssociationSpec spec = definition.spec();
        String joinKind = Objects.requireNonNull(spec.joinKind());
        String joinTargetKey = Objects.requireNonNull(spec.joinTargetKey());
        for (DataRecord item : items) {
            if (appendPolicy == JoinAppendPolicy.SKIP_EXISTING && isJoined(owner, item, definition)) {
                logger.debug("Skipping {} already joined to {} through {}", item, owner, joinKind);
                continue;
            }

            Map<String, Object> attributes = new HashMap<>(4);
            attributes.put(spec.foreignKey(), owner.id());
            attributes.put(joinTargetKey, item.id());
            written.add(store.insert(joinKind, attributes));
        }
        return written;
    }

    private @Nullable DataRecord resolveTarget(DataRecord record, AssociationDefinition definition) {
        Object key = record.get(definition.foreignKey());
        if (key == null) {
            return null;
        }
        return store.get(definition.targetKind(), (Long) key);
    }

    private List<DataRecord> resolveOneToMany(DataRecord record, AssociationDefinition definition) {
        List<DataRecord> targets = new ArrayList<>();
        for (DataRecord candidate : store.all(definition.targetKind())) {
            if (AttributeValues.equal(candidate.get(definition.foreignKey()), record.id())) {
                targets.add(candidate);
            }
        }
        return targets;
    }

    private List<DataRecord> resolveThrough(DataRecord record, AssociationDefinition definition) {
        AssociationSpec spec = definition.spec();
        List<DataRecord> targets = new ArrayList<>();
        for (DataRecord join : store.all(Objects.requireNonNull(spec.joinKind()))) {
            if (!AttributeValues.equal(join.get(spec.foreignKey()), record.id())) {
                continue;
            }
            Object targetId = join.get(Objects.requireNonNull(spec.joinTargetKey()));
            if (targetId == null) {
                continue;
            }
            targets.add(store.get(spec.targetKind(), (Long) targetId));
        }
        return targets;
    }

    private boolean isJoined(DataRecord owner, DataRecord item, AssociationDefinition definition) {
        AssociationSpec spec = definition.spec();
        for (DataRecord join : store.all(Objects.requireNonNull(spec.joinKind()))) {
            if (AttributeValues.equal(join.get(spec.foreignKey()), owner.id())
                && AttributeValues.equal(join.get(Objects.requireNonNull(spec.joinTargetKey())), item.id())) {
                return true;
            }
        }
        return false;
    }

    private AssociationDefinition requireKind(DataRecord record, String name, AssociationKind expected) {
        AssociationDefinition definition = definition(record.kind(), name);
        if (definition.kind() != expected) {
            throw new IllegalArgumentException(
                "Association " + record.kind() + "." + name + " is " + definition.kind() + ", expected " + expected);
        }
        return definition;
    }

    private static void checkTarget(AssociationDefinition definition, DataRecord target) {
        if (!definition.targetKind().equals(target.kind())) {
            throw new ValidationException("Association " + definition.sourceKind() + "." + definition.name()
                + " expects " + definition.targetKind() + " records but got " + target.kind());
        }
    }

    private void checkKeys(AssociationDefinition definition) {
        KindModel owner = store.kind(definition.owningKind());
        checkKey(definition, owner, definition.foreignKey());
        String joinTargetKey = definition.spec().joinTargetKey();
        if (joinTargetKey != null) {
            checkKey(definition, owner, joinTargetKey);
        }
    }

    private static void checkKey(AssociationDefinition definition, KindModel owner, String key) {
        AttributeModel attribute = owner.attribute(key);
        if (attribute == null) {
            throw new ValidationException("Foreign key '" + key + "' of association " + definition.sourceKind() + "."
                + definition.name() + " is not an attribute of kind " + owner.name());
        }
        if (attribute.type() != AttributeType.INTEGER) {
            throw new ValidationException("Foreign key '" + key + "' of kind " + owner.name() + " must be INTEGER, not "
                + attribute.type());
        }
    }
}
