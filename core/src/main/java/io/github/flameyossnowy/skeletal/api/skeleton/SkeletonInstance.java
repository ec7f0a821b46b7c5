package io.github.flameyossnowy.skeletal.api.skeleton;

import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.bones.NumericBone;
import io.github.flameyossnowy.skeletal.api.bones.ReadFromClientError;
import io.github.flameyossnowy.skeletal.api.bones.ReadFromClientErrorSeverity;
import io.github.flameyossnowy.skeletal.api.exceptions.EntityNotFoundException;
import io.github.flameyossnowy.skeletal.api.exceptions.ReadFromClientException;
import io.github.flameyossnowy.skeletal.api.exceptions.SkeletalException;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.api.pipeline.WriteOptions;
import io.github.flameyossnowy.skeletal.api.result.TransactionResult;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A live record: a {@link SkeletonDefinition} bound to values.
 *
 * <p>Values are read lazily from the backing entity on first access and remembered as
 * <em>accessed</em>; the write pipeline only re-serializes accessed bones. Reading a bone that has
 * no value yields its default.</p>
 *
 * <p>Instances are not thread-safe and are meant to live for a single operation.</p>
 */
public class SkeletonInstance {
    private final Skeletal runtime;
    private final SkeletonDefinition definition;
    private final Map<String, Object> accessedValues = new LinkedHashMap<>();
    private final List<ReadFromClientError> errors = new ArrayList<>();
    private @Nullable Entity entity;
    private boolean cascadeDeletion;

    public SkeletonInstance(@NotNull Skeletal runtime, @NotNull SkeletonDefinition definition) {
        this.runtime = runtime;
        this.definition = definition;
    }

    public @NotNull Skeletal runtime() {
        return runtime;
    }

    public @NotNull SkeletonDefinition definition() {
        return definition;
    }

    public @NotNull String kind() {
        return definition.kind();
    }

    public @Nullable Entity entity() {
        return entity;
    }

    /**
     * Rebinds this instance to {@code entity}, forgetting every accessed value.
     */
    public void setEntity(@Nullable Entity entity) {
        this.entity = entity;
        this.accessedValues.clear();
    }

    /**
     * The key of the backing entity, or null for a record that was never written.
     */
    public @Nullable Key key() {
        return entity == null || !entity.key().isComplete() ? null : entity.key();
    }

    private BaseBone<?> requireBone(String name) {
        BaseBone<?> bone = definition.bone(name);
        if (bone == null) {
            throw new IllegalArgumentException(kind() + " has no bone named '" + name + "'");
        }
        return bone;
    }

    public @Nullable Object get(@NotNull String name) {
        if (accessedValues.containsKey(name)) {
            return accessedValues.get(name);
        }
        BaseBone<?> bone = requireBone(name);
        Object value = entity != null ? bone.unserialize(this, name) : bone.getDefaultValue(this);
        accessedValues.put(name, value);
        return value;
    }

    /**
     * Stores an already validated value. Bones use this; callers assigning new values should use
     * {@link #set(String, Object)}.
     */
    public void setValue(@NotNull String name, @Nullable Object value) {
        requireBone(name);
        accessedValues.put(name, value);
    }

    /**
     * Assigns a value with the bone's client validation.
     *
     * @throws IllegalArgumentException if the bone rejects the value
     */
    public SkeletonInstance set(@NotNull String name, @Nullable Object value) {
        if (!setBoneValue(name, value, false, null)) {
            throw new IllegalArgumentException("Value rejected by bone '" + name + "' of " + kind() + ": " + value);
        }
        return this;
    }

    public boolean setBoneValue(@NotNull String name, @Nullable Object value, boolean append, @Nullable String language) {
        return requireBone(name).setBoneValue(this, name, value, append, language);
    }

    public boolean isAccessed(@NotNull String name) {
        return accessedValues.containsKey(name);
    }

    public @NotNull Set<String> accessedNames() {
        return Collections.unmodifiableSet(accessedValues.keySet());
    }

    public @NotNull List<ReadFromClientError> errors() {
        return errors;
    }

    public void markForCascadeDeletion() {
        this.cascadeDeletion = true;
    }

    public boolean isMarkedForCascadeDeletion() {
        return cascadeDeletion;
    }

    /**
     * Reads every writable bone from client supplied data.
     *
     * @param amend true when updating an existing record, so bones missing from {@code data} keep their value
     * @return true if the data was complete and valid; {@link #errors()} lists the problems otherwise
     */
    public boolean fromClient(@NotNull Map<String, ?> data, boolean amend) {
        errors.clear();
        boolean complete = true;
        for (Map.Entry<String, BaseBone<?>> entry : definition.bones().entrySet()) {
            String name = entry.getKey();
            BaseBone<?> bone = entry.getValue();
            if (bone.isReadOnly()) continue;
            if (amend && !data.containsKey(name)) continue;

            for (ReadFromClientError error : bone.fromClient(this, name, data)) {
                errors.add(error.prefixed(name));
                if (error.severity() == ReadFromClientErrorSeverity.INVALID
                    || (bone.isRequired() && error.fieldPath().isEmpty()
                        && (error.severity() == ReadFromClientErrorSeverity.EMPTY
                            || (error.severity() == ReadFromClientErrorSeverity.NOT_SET && !amend)))) {
                    complete = false;
                }
            }
        }

        // an empty submission only asks for the form; it is incomplete but not erroneous
        if (data.isEmpty() || (data.size() == 1 && data.containsKey(SkeletonDefinition.KEY_BONE))) {
            errors.clear();
        }
        return complete;
    }

    public boolean fromClient(@NotNull Map<String, ?> data) {
        return fromClient(data, false);
    }

    /**
     * Loads the entity stored under {@code key} into this instance.
     *
     * @return false if nothing is stored under that key
     */
    public boolean read(@NotNull Key key) {
        if (!key.kind().equals(kind())) {
            throw new IllegalArgumentException("Cannot read " + key + " into a skeleton of kind " + kind());
        }
        Entity stored = runtime.store().get(key);
        if (stored == null) return false;
        setEntity(stored);
        cascadeDeletion = false;
        return true;
    }

    /**
     * Reads {@code data} like {@link #fromClient(Map, boolean)} and writes the record if the data
     * was complete. Nothing is written otherwise and the failure carries the collected errors.
     */
    public @NotNull TransactionResult<Key> writeFromClient(@NotNull Map<String, ?> data, boolean amend) {
        if (!fromClient(data, amend)) {
            return TransactionResult.failure(new ReadFromClientException(errors));
        }
        return write();
    }

    public @NotNull TransactionResult<Key> write() {
        return runtime.write(this, WriteOptions.defaults());
    }

    public @NotNull TransactionResult<Key> write(@NotNull WriteOptions options) {
        return runtime.write(this, options);
    }

    public @NotNull TransactionResult<Boolean> delete() {
        return runtime.delete(this);
    }

    /**
     * Re-derives every bone's cached content from authoritative sources.
     */
    public void refresh() {
        for (Map.Entry<String, BaseBone<?>> entry : definition.bones().entrySet()) {
            entry.getValue().refresh(this, entry.getKey());
        }
    }

    /**
     * Transactional read-modify-write of this record. Names prefixed with {@code +} or {@code -}
     * increment or decrement numeric bones; every other entry is assigned.
     */
    public @NotNull TransactionResult<SkeletonInstance> patch(@NotNull Map<String, ?> values, int retries) {
        return patch(skel -> {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                String name = entry.getKey();
                if (name.startsWith("+") || name.startsWith("-")) {
                    increment(skel, name.substring(1), entry.getValue(), name.charAt(0) == '-');
                } else {
                    skel.set(name, entry.getValue());
                }
            }
        }, retries);
    }

    private static void increment(SkeletonInstance skel, String name, Object amount, boolean negate) {
        if (!(skel.requireBone(name) instanceof NumericBone numeric)) {
            throw new IllegalArgumentException("Cannot increment non-numeric bone '" + name + "'");
        }
        Number delta = numeric.parse(amount);
        if (delta == null) {
            throw new IllegalArgumentException("Not a number: " + amount);
        }
        Number current = skel.get(name) instanceof Number number ? number : 0L;
        double sum = current.doubleValue() + (negate ? -delta.doubleValue() : delta.doubleValue());
        skel.set(name, numeric.precision() == 0 ? (Object) Math.round(sum) : (Object) sum);
    }

    /**
     * Transactional read-modify-write: re-reads the record, applies {@code mutator} and writes it,
     * retrying up to {@code retries} times on transaction conflicts. On success this instance
     * reflects the written state.
     */
    public @NotNull TransactionResult<SkeletonInstance> patch(@NotNull Consumer<SkeletonInstance> mutator, int retries) {
        Key key = key();
        if (key == null) {
            throw new IllegalStateException("Cannot patch a record that was never written");
        }

        TransactionConflictException lastConflict = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                SkeletonInstance patched = runtime.store().runInTransaction(() -> {
                    SkeletonInstance fresh = new SkeletonInstance(runtime, definition);
                    if (!fresh.read(key)) {
                        throw new EntityNotFoundException(key);
                    }
                    mutator.accept(fresh);
                    fresh.write().orElseThrow();
                    return fresh;
                });
                setEntity(patched.entity());
                return TransactionResult.success(this);
            } catch (TransactionConflictException e) {
                lastConflict = e;
                Logging.deepInfo(() -> "Patch of " + key + " conflicted: " + e.getMessage());
            } catch (SkeletalException e) {
                return TransactionResult.failure(e);
            }
        }
        return TransactionResult.failure(lastConflict);
    }

    @Override
    public String toString() {
        return "SkeletonInstance{" + kind() + ", key=" + key() + ", accessed=" + accessedValues.keySet() + '}';
    }
}
