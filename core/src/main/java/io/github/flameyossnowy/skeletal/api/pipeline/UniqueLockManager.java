package io.github.flameyossnowy.skeletal.api.pipeline;

import io.github.flameyossnowy.skeletal.api.bones.BaseBone;
import io.github.flameyossnowy.skeletal.api.bones.UniqueConstraint;
import io.github.flameyossnowy.skeletal.api.exceptions.UniqueValueConflictException;
import io.github.flameyossnowy.skeletal.api.integrity.IntegrityWarning;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.tasks.ReleaseUniqueLocks;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maintains the unique value lock records of unique bones.
 *
 * <p>A lock lives in kind {@code {kind}_{bone}_uniquePropertyIndex}, is named after the value hash
 * and records the owner's key path under {@code references}. The hashes an owner claims are
 * mirrored in its {@code unique_index_values} property so stale locks can be told apart from
 * live ones.</p>
 */
public final class UniqueLockManager {
    public static final String REFERENCES = "references";

    private final EntityStore store;

    public UniqueLockManager(@NotNull EntityStore store) {
        this.store = store;
    }

    public static @NotNull String lockKind(@NotNull String kind, @NotNull String bone) {
        return kind + "_" + bone + "_uniquePropertyIndex";
    }

    /**
     * Claims the current unique values of every unique bone. Must run inside the write transaction,
     * after the owner's key is known.
     *
     * @return per bone, the hashes the owner claimed before but no longer does
     * @throws UniqueValueConflictException if a value is claimed by another record
     */
    public @NotNull Map<String, List<String>> acquire(@NotNull SkeletonInstance skel, @NotNull WriteContext context) {
        Entity owner = skel.entity();
        String ownerPath = owner.key().path();
        Map<String, Object> claimed = owner.getMap(SystemProperties.UNIQUE_INDEX_VALUES);
        Map<String, List<String>> released = new LinkedHashMap<>();

        for (String name : skel.definition().uniqueBones()) {
            BaseBone<?> bone = skel.definition().bone(name);
            UniqueConstraint unique = bone.unique();
            List<String> hashes = bone.getUniquePropertyIndexValues(skel, name);
            Set<String> previous = hashesOf(claimed.get(name));

            for (String hash : hashes) {
                Key lockKey = Key.of(lockKind(skel.kind(), name), hash);
                Entity lock = store.get(lockKey);
                if (lock == null) {
                    if (previous.contains(hash)) {
                        context.reportIntegrity(new IntegrityWarning(IntegrityWarning.Type.MISSING_UNIQUE_LOCK, lockKey,
                            "lock claimed by " + ownerPath + " was missing and has been recreated"));
                    }
                    store.put(new Entity(lockKey).put(REFERENCES, ownerPath));
                } else if (!ownerPath.equals(lock.get(REFERENCES))) {
                    Logging.deepInfo(() -> "Unique value of " + skel.kind() + "." + name + " already taken by " + lock.get(REFERENCES));
                    throw new UniqueValueConflictException(skel.kind(), name, unique.message());
                }
            }

            if (hashes.isEmpty()) {
                claimed.remove(name);
            } else {
                claimed.put(name, new ArrayList<>(hashes));
            }
            Set<String> stale = new LinkedHashSet<>(previous);
            hashes.forEach(stale::remove);
            if (!stale.isEmpty()) {
                released.put(name, new ArrayList<>(stale));
            }
        }

        if (claimed.isEmpty()) {
            owner.remove(SystemProperties.UNIQUE_INDEX_VALUES);
        } else {
            owner.put(SystemProperties.UNIQUE_INDEX_VALUES, claimed);
        }
        return released;
    }

    /**
     * Deletes every lock the owner claims. Runs inside the delete transaction.
     */
    public void releaseAll(@NotNull SkeletonInstance skel, @NotNull WriteContext context) {
        Entity owner = skel.entity();
        String ownerPath = owner.key().path();
        Object raw = owner.get(SystemProperties.UNIQUE_INDEX_VALUES);
        if (!(raw instanceof Map<?, ?> claimed)) return;

        for (Map.Entry<?, ?> entry : claimed.entrySet()) {
            String name = String.valueOf(entry.getKey());
            for (String hash : hashesOf(entry.getValue())) {
                Key lockKey = Key.of(lockKind(skel.kind(), name), hash);
                Entity lock = store.get(lockKey);
                if (lock == null) {
                    context.reportIntegrity(new IntegrityWarning(IntegrityWarning.Type.MISSING_UNIQUE_LOCK, lockKey,
                        "lock claimed by " + ownerPath + " does not exist"));
                } else if (!ownerPath.equals(lock.get(REFERENCES))) {
                    context.reportIntegrity(new IntegrityWarning(IntegrityWarning.Type.FOREIGN_UNIQUE_LOCK, lockKey,
                        "claimed by " + ownerPath + " but held by " + lock.get(REFERENCES)));
                } else {
                    store.delete(lockKey);
                }
            }
        }
        owner.remove(SystemProperties.UNIQUE_INDEX_VALUES);
    }

    /**
     * Deletes the locks listed in {@code task} that the owner no longer claims. Safe to run any
     * number of times, and after the owner claimed a value again.
     */
    public void releaseStale(@NotNull ReleaseUniqueLocks task) {
        String ownerPath = task.owner().path();
        store.runInTransaction(() -> {
            Entity owner = store.get(task.owner());
            Set<String> stillClaimed = Set.of();
            if (owner != null && owner.get(SystemProperties.UNIQUE_INDEX_VALUES) instanceof Map<?, ?> claimed) {
                stillClaimed = hashesOf(claimed.get(task.bone()));
            }
            for (String hash : task.hashes()) {
                if (stillClaimed.contains(hash)) continue;
                Key lockKey = Key.of(lockKind(task.kind(), task.bone()), hash);
                Entity lock = store.get(lockKey);
                if (lock == null) continue;
                if (ownerPath.equals(lock.get(REFERENCES))) {
                    store.delete(lockKey);
                } else {
                    Logging.deepInfo(() -> "Not releasing " + lockKey + ", it now belongs to " + lock.get(REFERENCES));
                }
            }
            return null;
        });
    }

    private static Set<String> hashesOf(Object list) {
        Set<String> hashes = new LinkedHashSet<>();
        if (list instanceof List<?> elements) {
            for (Object element : elements) {
                if (element instanceof String hash) hashes.add(hash);
            }
        }
        return hashes;
    }
}
