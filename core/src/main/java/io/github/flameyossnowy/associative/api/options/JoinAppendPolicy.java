package io.github.flameyossnowy.associative.api.options;

/**
 * What appending to a many-to-many-through collection does when the pair is already joined.
 */
public enum JoinAppendPolicy {
    /**
     * Every appended item creates a new join record, repeats included.
     */
    ALLOW_DUPLICATES,

    /**
     * An item already joined to the owner is skipped.
     */
    SKIP_EXISTING
}
