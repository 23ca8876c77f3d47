package io.github.flameyossnowy.associative.api.options;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
