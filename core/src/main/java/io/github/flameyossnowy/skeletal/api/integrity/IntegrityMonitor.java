package io.github.flameyossnowy.skeletal.api.integrity;

import org.jetbrains.annotations.NotNull;

@FunctionalInterface
public interface IntegrityMonitor {
    void report(@NotNull IntegrityWarning warning);
}
