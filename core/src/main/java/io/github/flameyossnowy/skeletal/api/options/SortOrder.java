package io.github.flameyossnowy.skeletal.api.options;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
