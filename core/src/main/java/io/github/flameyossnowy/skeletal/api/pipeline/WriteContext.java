package io.github.flameyossnowy.skeletal.api.pipeline;

import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.integrity.IntegrityWarning;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of one write or delete as it moves through its pipeline.
 *
 * <p>Created per operation and discarded afterwards. Bones receive it to report integrity
 * warnings and to stash data for later stages through {@link #setAttribute(String, Object)}.</p>
 */
public final class WriteContext {
    private final Skeletal runtime;
    private final SkeletonInstance skeleton;
    private final WriteOptions options;
    private final Map<String, Object> attributes = new HashMap<>();
    private final List<IntegrityWarning> warnings = new ArrayList<>();
    private final List<String> changeList = new ArrayList<>();
    private WriteState state = WriteState.BEGIN;
    private boolean add;
    private boolean joined;

    public WriteContext(@NotNull Skeletal runtime, @NotNull SkeletonInstance skeleton, @NotNull WriteOptions options) {
        this.runtime = runtime;
        this.skeleton = skeleton;
        this.options = options;
    }

    public @NotNull Skeletal runtime() {
        return runtime;
    }

    public @NotNull SkeletonInstance skeleton() {
        return skeleton;
    }

    public @NotNull WriteOptions options() {
        return options;
    }

    public @NotNull WriteState state() {
        return state;
    }

    void transition(@NotNull WriteState next) {
        WriteState previous = state;
        this.state = next;
        Logging.deepInfo(() -> "Write of " + skeleton.kind() + ": " + previous + " -> " + next);
    }

    public boolean isAdd() {
        return add;
    }

    void setAdd(boolean add) {
        this.add = add;
    }

    /**
     * True when the operation runs inside a transaction opened by the caller.
     */
    public boolean isJoined() {
        return joined;
    }

    void setJoined(boolean joined) {
        this.joined = joined;
    }

    /**
     * Names of the bones whose stored value changed.
     */
    public @NotNull List<String> changeList() {
        return Collections.unmodifiableList(changeList);
    }

    void addChange(@NotNull String boneName) {
        changeList.add(boneName);
    }

    void resetChanges() {
        changeList.clear();
    }

    /**
     * Publishes an integrity problem and remembers it; the operation carries on.
     */
    public void reportIntegrity(@NotNull IntegrityWarning warning) {
        warnings.add(warning);
        runtime.integrityMonitor().report(warning);
    }

    public @NotNull List<IntegrityWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void setAttribute(@NotNull String key, Object value) {
        attributes.put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> getAttribute(@NotNull String key) {
        return Optional.ofNullable((T) attributes.get(key));
    }
}
