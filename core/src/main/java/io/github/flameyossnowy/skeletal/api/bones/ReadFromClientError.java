package io.github.flameyossnowy.skeletal.api.bones;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A validation problem found while reading client data into a skeleton.
 *
 * @param fieldPath         path to the offending value, e.g. {@code ["tags", "2"]}
 * @param invalidatedFields other fields invalidated by this value, for {@link ReadFromClientErrorSeverity#INVALIDATES_OTHER}
 */
public record ReadFromClientError(
    @NotNull ReadFromClientErrorSeverity severity,
    @NotNull String message,
    @NotNull List<String> fieldPath,
    @NotNull List<String> invalidatedFields
) {
    public ReadFromClientError {
        fieldPath = List.copyOf(fieldPath);
        invalidatedFields = List.copyOf(invalidatedFields);
    }

    public ReadFromClientError(@NotNull ReadFromClientErrorSeverity severity, @NotNull String message) {
        this(severity, message, List.of(), List.of());
    }

    @Contract("_, _ -> new")
    public static @NotNull ReadFromClientError invalid(@NotNull String message, String... fieldPath) {
        return new ReadFromClientError(ReadFromClientErrorSeverity.INVALID, message, Arrays.asList(fieldPath), List.of());
    }

    /**
     * Returns a copy with {@code prefix} prepended to the field path.
     */
    public @NotNull ReadFromClientError prefixed(String... prefix) {
        List<String> path = new ArrayList<>(prefix.length + fieldPath.size());
        path.addAll(Arrays.asList(prefix));
        path.addAll(fieldPath);
        return new ReadFromClientError(severity, message, path, invalidatedFields);
    }

    public @NotNull String pathString() {
        return String.join(".", fieldPath);
    }
}
