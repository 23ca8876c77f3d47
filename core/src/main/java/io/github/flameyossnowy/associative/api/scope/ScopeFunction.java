package io.github.flameyossnowy.associative.api.scope;

import io.github.flameyossnowy.associative.api.DataRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A named transformation of a record set. Implementations return a new list and leave
 * the records themselves untouched.
 */
@FunctionalInterface
public interface ScopeFunction {
    @NotNull List<DataRecord> apply(@NotNull List<DataRecord> records, Object @NotNull [] args);
}
