package io.github.flameyossnowy.associative.memory;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.meta.AssociationDefinition;
import org.jetbrains.annotations.NotNull;

import java.util.AbstractList;
import java.util.List;

/**
 * Read-only list view of a collection association, resolved on first access.
 * <p>
 * {@link #append(DataRecord...)} writes through the {@link AssociationRegistry} and drops the
 * loaded contents, so the next read sees the appended records.
 */
public class AssociationCollection extends AbstractList<DataRecord> {
    private final AssociationRegistry registry;
    private final DataRecord owner;
    private final AssociationDefinition definition;

    private List<DataRecord> records;

    public AssociationCollection(@NotNull AssociationRegistry registry, @NotNull DataRecord owner, @NotNull String name) {
        this.registry = registry;
        this.owner = owner;
        this.definition = registry.definition(owner.kind(), name);
        if (!definition.isCollection()) {
            throw new IllegalArgumentException("Association " + owner.kind() + "." + name + " is not a collection");
        }
    }

    protected List<DataRecord> load() {
        return records == null ? (records = List.copyOf(registry.resolve(owner, definition.name()))) : records;
    }

    public boolean isLoaded() {
        return records != null;
    }

    public void reload() {
        records = null;
    }

    public @NotNull DataRecord owner() {
        return owner;
    }

    public @NotNull AssociationDefinition definition() {
        return definition;
    }

    /**
     * Appends items to the association, in order.
     *
     * @return this collection
     */
    public AssociationCollection append(@NotNull DataRecord... items) {
        registry.append(owner, definition.name(), items);
        records = null;
        return this;
    }

    @Override
    public DataRecord get(int index) {
        return load().get(index);
    }

    @Override
    public int size() {
        return load().size();
    }
}
