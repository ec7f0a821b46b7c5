package io.github.flameyossnowy.skeletal.api.options;

import org.jetbrains.annotations.NotNull;

public record SortOption(@NotNull String field, @NotNull SortOrder order) {
    public SortOption withField(@NotNull String newField) {
        return new SortOption(newField, order);
    }
}
