package io.github.flameyossnowy.associative.api.exceptions.json;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Position in a JSON document where reading failed.
 */
public record JsonLocation(long line, long column, long charOffset) {
    public static final JsonLocation UNKNOWN = new JsonLocation(-1, -1, -1);

    @Contract("null -> !null")
    public static @NotNull JsonLocation from(@Nullable com.fasterxml.jackson.core.JsonLocation location) {
        if (location == null) {
            return UNKNOWN;
        }
        return new JsonLocation(location.getLineNr(), location.getColumnNr(), location.getCharOffset());
    }
}
