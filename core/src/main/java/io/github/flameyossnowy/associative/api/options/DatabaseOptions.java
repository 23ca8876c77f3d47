package io.github.flameyossnowy.associative.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Configuration of a record database.
 *
 * @param joinAppendPolicy how many-to-many-through appends treat pairs that are already joined
 * @param strictAttributes whether inserting an undeclared attribute fails; when {@code false} it is dropped
 */
public record DatabaseOptions(@NotNull JoinAppendPolicy joinAppendPolicy, boolean strictAttributes) {
    public DatabaseOptions {
        Objects.requireNonNull(joinAppendPolicy, "Join append policy cannot be null");
    }

    public static DatabaseOptions defaults() {
        return new DatabaseOptions(JoinAppendPolicy.ALLOW_DUPLICATES, true);
    }

    public DatabaseOptions withJoinAppendPolicy(@NotNull JoinAppendPolicy policy) {
        return new DatabaseOptions(policy, strictAttributes);
    }

    public DatabaseOptions withStrictAttributes(boolean strict) {
        return new DatabaseOptions(joinAppendPolicy, strict);
    }
}
