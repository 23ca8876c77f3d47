package io.github.flameyossnowy.associative.api.meta;

import io.github.flameyossnowy.associative.api.exceptions.DuplicateDefinitionException;
import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Schema of an entity kind: its name and its ordered attributes.
 * <p>
 * The attribute name {@value #ID} is reserved for the identity assigned by the store.
 */
public final class KindModel {
    public static final String ID = "id";

    private final String name;
    private final Map<String, AttributeModel> attributes;

    private KindModel(String name, Map<String, AttributeModel> attributes) {
        this.name = name;
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static Builder builder(@NotNull String name) {
        return new Builder(name);
    }

    /**
     * Creates a kind whose attributes are all nullable, in the iteration order of {@code schema}.
     */
    public static KindModel of(@NotNull String name, @NotNull Map<String, AttributeType> schema) {
        Builder builder = new Builder(name);
        schema.forEach(builder::optional);
        return builder.build();
    }

    public String name() {
        return name;
    }

    public Collection<AttributeModel> attributes() {
        return attributes.values();
    }

    public @Nullable AttributeModel attribute(@NotNull String attribute) {
        return attributes.get(attribute);
    }

    public boolean hasAttribute(@NotNull String attribute) {
        return ID.equals(attribute) || attributes.containsKey(attribute);
    }

    /**
     * Returns the type of an attribute, {@link AttributeType#INTEGER} for the identity.
     *
     * @throws ValidationException if the attribute is not declared on this kind
     */
    public @NotNull AttributeType typeOf(@NotNull String attribute) {
        if (ID.equals(attribute)) {
            return AttributeType.INTEGER;
        }
        return require(attribute).type();
    }

    public @NotNull AttributeModel require(@NotNull String attribute) {
        AttributeModel model = attributes.get(attribute);
        if (model == null) {
            throw new ValidationException("Unknown attribute '" + attribute + "' on kind " + name);
        }
        return model;
    }

    /**
     * Validates a single attribute write and returns the normalized value.
     */
    public @Nullable Object validateValue(@NotNull String attribute, @Nullable Object value) {
        if (ID.equals(attribute)) {
            throw new ValidationException("The identity of a " + name + " record is assigned by the store");
        }

        AttributeModel model = require(attribute);
        if (value == null) {
            if (!model.nullable()) {
                throw new ValidationException("Attribute '" + attribute + "' of kind " + name + " is required");
            }
            return null;
        }

        if (!model.type().accepts(value)) {
            throw new ValidationException(
                "Attribute '" + attribute + "' of kind " + name + " expects " + model.type()
                    + " but got " + value.getClass().getSimpleName() + " (" + value + ")");
        }
        return model.type().normalize(value);
    }

    /**
     * Validates a full set of attributes for insertion.
     *
     * @param values attribute values; must only contain declared attributes
     * @return every declared attribute in schema order, unset nullable attributes mapped to {@code null}
     */
    public @NotNull Map<String, Object> validateInsert(@NotNull Map<String, ?> values) {
        for (String key : values.keySet()) {
            if (ID.equals(key)) {
                throw new ValidationException("The identity of a " + name + " record is assigned by the store");
            }
            require(key);
        }

        Map<String, Object> normalized = new LinkedHashMap<>(attributes.size());
        for (AttributeModel model : attributes.values()) {
            normalized.put(model.name(), validateValue(model.name(), values.get(model.name())));
        }
        return normalized;
    }

    /**
     * Keys of {@code values} that are not declared on this kind, the identity included.
     */
    public @NotNull Set<String> undeclared(@NotNull Map<String, ?> values) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String key : values.keySet()) {
            if (ID.equals(key) || !attributes.containsKey(key)) {
                unknown.add(key);
            }
        }
        return unknown;
    }

    @Override
    public String toString() {
        return "KindModel{" + name + ", " + attributes.values() + '}';
    }

    public static final class Builder {
        private final String name;
        private final Map<String, AttributeModel> attributes = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Kind name cannot be blank");
            }
            this.name = name;
        }

        /**
         * Declares a required attribute.
         */
        public Builder attribute(@NotNull String attribute, @NotNull AttributeType type) {
            return add(new AttributeModel(attribute, type, false));
        }

        /**
         * Declares a nullable attribute.
         */
        public Builder optional(@NotNull String attribute, @NotNull AttributeType type) {
            return add(new AttributeModel(attribute, type, true));
        }

        private Builder add(AttributeModel model) {
            if (ID.equals(model.name())) {
                throw new IllegalArgumentException("'" + ID + "' is reserved for the record identity");
            }
            if (attributes.putIfAbsent(model.name(), model) != null) {
                throw new DuplicateDefinitionException("Attribute '" + model.name() + "' declared twice on kind " + name);
            }
            return this;
        }

        public KindModel build() {
            return new KindModel(name, new LinkedHashMap<>(attributes));
        }
    }
}
