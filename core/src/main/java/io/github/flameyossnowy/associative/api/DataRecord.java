package io.github.flameyossnowy.associative.api;

import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import io.github.flameyossnowy.associative.api.meta.KindModel;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored instance of a kind.
 * <p>
 * The identity never changes; attributes are mutable and every write is validated against
 * the kind's schema. Records are identified by (kind, id), which is what {@link #equals(Object)}
 * compares.
 */
public final class DataRecord {
    private final KindModel kind;
    private final long id;
    private final Map<String, Object> attributes;

    /**
     * Created by the record store with attributes already validated by
     * {@link KindModel#validateInsert(Map)}.
     */
    @ApiStatus.Internal
    public DataRecord(@NotNull KindModel kind, long id, @NotNull Map<String, Object> attributes) {
        this.kind = kind;
        this.id = id;
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public @NotNull String kind() {
        return kind.name();
    }

    public @NotNull KindModel model() {
        return kind;
    }

    public long id() {
        return id;
    }

    /**
     * Reads an attribute; {@value KindModel#ID} reads the identity.
     *
     * @throws ValidationException if the attribute is not declared on the kind
     */
    public @Nullable Object get(@NotNull String attribute) {
        if (KindModel.ID.equals(attribute)) {
            return id;
        }
        kind.require(attribute);
        return attributes.get(attribute);
    }

    public @Nullable String getString(@NotNull String attribute) {
        return (String) get(attribute);
    }

    public @Nullable Long getLong(@NotNull String attribute) {
        return (Long) get(attribute);
    }

    public @Nullable Double getDouble(@NotNull String attribute) {
        return (Double) get(attribute);
    }

    public @Nullable Boolean getBoolean(@NotNull String attribute) {
        return (Boolean) get(attribute);
    }

    /**
     * Writes an attribute in place.
     *
     * @throws ValidationException if the attribute is unknown, required and {@code null}, or mistyped
     */
    public void set(@NotNull String attribute, @Nullable Object value) {
        attributes.put(attribute, kind.validateValue(attribute, value));
    }

    /**
     * Unmodifiable view of the attributes, without the identity.
     */
    public @NotNull Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public boolean sameIdentity(@NotNull DataRecord other) {
        return id == other.id && kind.name().equals(other.kind.name());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataRecord that)) return false;
        return sameIdentity(that);
    }

    @Override
    public int hashCode() {
        return 31 * kind.name().hashCode() + Long.hashCode(id);
    }

    @Override
    public String toString() {
        return kind.name() + "#" + id + attributes;
    }
}
