package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.Skeletal;
import io.github.flameyossnowy.skeletal.api.exceptions.SchemaException;
import io.github.flameyossnowy.skeletal.api.integrity.IntegrityWarning;
import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.pipeline.WriteContext;
import io.github.flameyossnowy.skeletal.api.query.QueryHook;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonDefinition;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonRegistry;
import io.github.flameyossnowy.skeletal.api.skeleton.SystemProperties;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.EntityQuery;
import io.github.flameyossnowy.skeletal.api.store.EntityStore;
import io.github.flameyossnowy.skeletal.api.store.Key;
import io.github.flameyossnowy.skeletal.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A reference to records of another kind that keeps a cached copy of selected fields of the
 * referenced record.
 *
 * <p>Every reference held by a relational bone is mirrored by a relation edge, an entity of the
 * configured relation kind stored as a child of the owner. Edges let background workers find all
 * owners caching a given record, and let queries on multiple bones filter by cached fields.</p>
 *
 * <pre>{@code
 * RelationalBone.builder("tag")
 *     .cacheFields("name", "color")
 *     .consistency(RelationalConsistency.PREVENT_DELETION)
 *     .build();
 * }</pre>
 */
public class RelationalBone extends BaseBone<RelationalValue>
    implements Filterable, Orderable, RelationHolder, LockParticipant {

    public static final String EDGE_DEST = "dest";
    public static final String EDGE_REL = "rel";
    public static final String EDGE_SRC = "src";
    public static final String EDGE_SRC_KIND = "src_kind";
    public static final String EDGE_SRC_PROPERTY = "src_property";
    public static final String EDGE_DEST_KIND = "dest_kind";
    public static final String EDGE_UPDATE_LEVEL = "update_level";
    public static final String EDGE_CONSISTENCY = "consistency";
    public static final String EDGE_FOREIGN_KEYS = "foreign_keys";

    private final String targetKind;
    private final List<String> cacheFieldPatterns;
    private final List<String> edgeFields;
    private final @Nullable SkeletonDefinition using;
    private final RelationalConsistency consistency;
    private final RelationalUpdateLevel updateLevel;

    private volatile List<String> cacheFields;
    private volatile SkeletonDefinition target;
    private volatile String ownerKind;
    private volatile String boundName;

    protected RelationalBone(@NotNull Builder builder) {
        super(builder);
        this.targetKind = builder.targetKind;
        this.cacheFieldPatterns = List.copyOf(builder.cacheFields);
        this.edgeFields = List.copyOf(builder.edgeFields);
        this.using = builder.using;
        this.consistency = builder.consistency;
        this.updateLevel = builder.updateLevel;
    }

    @Contract("_ -> new")
    public static @NotNull Builder builder(@NotNull String targetKind) {
        return new Builder(targetKind);
    }

    @Override
    public @NotNull String targetKind() {
        return targetKind;
    }

    @Override
    public @NotNull RelationalConsistency consistency() {
        return consistency;
    }

    @Override
    public @NotNull RelationalUpdateLevel updateLevel() {
        return updateLevel;
    }

    public @Nullable SkeletonDefinition using() {
        return using;
    }

    public @NotNull List<String> edgeFields() {
        return edgeFields;
    }

    /**
     * The resolved cached fields of the target, {@code key} first.
     */
    public @NotNull List<String> cacheFields() {
        return requireBound();
    }

    private List<String> requireBound() {
        List<String> fields = cacheFields;
        if (fields == null) {
            throw new IllegalStateException("Relational bone to " + targetKind + " is not bound; build the registry first");
        }
        return fields;
    }

    @Override
    @ApiStatus.Internal
    public void bind(@NotNull SkeletonRegistry registry, @NotNull String ownerKind, @NotNull String name) {
        if (this.ownerKind != null && !(this.ownerKind.equals(ownerKind) && name.equals(this.boundName))) {
            throw new SchemaException("Relational bone " + ownerKind + "." + name + " is already bound to "
                + this.ownerKind + "; bones cannot be shared between kinds");
        }
        SkeletonDefinition targetDefinition = registry.find(targetKind).orElseThrow(() ->
            new SchemaException(ownerKind + "." + name + " references unknown kind '" + targetKind + "'"));
        SkeletonDefinition ownerDefinition = registry.definition(ownerKind);

        Set<String> resolved = new LinkedHashSet<>();
        resolved.add(SkeletonDefinition.KEY_BONE);
        for (String pattern : cacheFieldPatterns) {
            if (pattern.contains("*")) {
                Pattern glob = Pattern.compile(Pattern.quote(pattern).replace("*", "\\E.*\\Q"));
                for (String bone : targetDefinition.bones().keySet()) {
                    if (glob.matcher(bone).matches()) resolved.add(bone);
                }
            } else if (!targetDefinition.hasBone(pattern)) {
                throw new SchemaException(ownerKind + "." + name + " caches unknown field '" + pattern + "' of " + targetKind);
            } else {
                resolved.add(pattern);
            }
        }
        for (String field : edgeFields) {
            if (!ownerDefinition.hasBone(field)) {
                throw new SchemaException(ownerKind + "." + name + " lists unknown edge field '" + field + "'");
            }
        }
        if (using != null) {
            for (BaseBone<?> bone : using.bones().values()) {
                if (bone instanceof RelationHolder) {
                    throw new SchemaException(ownerKind + "." + name + ": relational bones are not supported in edge data");
                }
            }
        }

        this.target = targetDefinition;
        this.cacheFields = List.copyOf(resolved);
        this.ownerKind = ownerKind;
        this.boundName = name;
    }

    // ------------------------------------------------------------------
    // Values
    // ------------------------------------------------------------------

    @Override
    protected @Nullable Object singleValueSerialize(@NotNull Object value) {
        return ((RelationalValue) value).toMap();
    }

    @Override
    protected @Nullable Object singleValueUnserialize(@NotNull Object raw) {
        if (raw instanceof RelationalValue value) return value;
        return raw instanceof Map<?, ?> map ? RelationalValue.fromMap(map) : null;
    }

    @Override
    protected boolean isEmptyRaw(@Nullable Object raw) {
        if (raw instanceof Map<?, ?> map) {
            return super.isEmptyRaw(map.get(SkeletonDefinition.KEY_BONE));
        }
        return super.isEmptyRaw(raw);
    }

    /**
     * Accepts a {@link Key}, a key path, a {@link Reference}, or a map holding {@code key} plus
     * edge data.
     */
    @Override
    protected @Nullable RelationalValue singleValueFromClient(@NotNull Object raw, @NotNull SkeletonInstance skel,
                                                              @NotNull String name, @NotNull List<ReadFromClientError> errors) {
        Key destKey;
        Map<String, ?> relRaw = Map.of();
        try {
            if (raw instanceof Reference reference) {
                destKey = reference.key();
                relRaw = reference.rel();
            } else if (raw instanceof RelationalValue value) {
                destKey = value.key();
                relRaw = value.rel() == null ? Map.of() : value.rel();
            } else if (raw instanceof Map<?, ?> map) {
                Map<String, Object> rest = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) rest.put(String.valueOf(entry.getKey()), entry.getValue());
                Object key = rest.remove(SkeletonDefinition.KEY_BONE);
                if (key == null) {
                    errors.add(ReadFromClientError.invalid("No key given"));
                    return null;
                }
                destKey = KeyBone.toKey(key);
                relRaw = rest;
            } else {
                destKey = KeyBone.toKey(raw);
            }
        } catch (IllegalArgumentException e) {
            errors.add(ReadFromClientError.invalid("Invalid key"));
            return null;
        }
        if (!destKey.kind().equals(targetKind)) {
            errors.add(ReadFromClientError.invalid("Expected a key of kind " + targetKind));
            return null;
        }

        Map<String, Object> rel = using == null ? null : readRel(skel.runtime(), relRaw, errors);

        Entity targetEntity = skel.runtime().store().get(destKey);
        if (targetEntity != null) {
            return new RelationalValue(buildDest(targetEntity), rel);
        }

        errors.add(ReadFromClientError.invalid("Referenced entry " + destKey + " does not exist"));
        // keep the previously cached copy rather than losing it
        for (Object existing : singleValues(skel.get(name))) {
            RelationalValue previous = (RelationalValue) existing;
            if (previous.key().equals(destKey)) {
                return rel == null ? previous : previous.withRel(rel);
            }
        }
        return null;
    }

    private Map<String, Object> readRel(Skeletal runtime, Map<String, ?> relRaw, List<ReadFromClientError> errors) {
        SkeletonInstance relSkel = new SkeletonInstance(runtime, using);
        if (!relSkel.fromClient(relRaw)) {
            errors.add(ReadFromClientError.invalid("Incomplete data"));
        }
        for (ReadFromClientError error : relSkel.errors()) {
            if (error.severity() == ReadFromClientErrorSeverity.INVALID) {
                errors.add(error.prefixed(RelationalValue.REL));
            }
        }
        Map<String, Object> rel = new LinkedHashMap<>();
        for (Map.Entry<String, BaseBone<?>> entry : using.bones().entrySet()) {
            if (entry.getKey().equals(SkeletonDefinition.KEY_BONE)) continue;
            rel.put(entry.getKey(), entry.getValue().serializeValue(relSkel.get(entry.getKey())));
        }
        return rel;
    }

    private Map<String, Object> buildDest(Entity targetEntity) {
        Map<String, Object> dest = new LinkedHashMap<>();
        dest.put(SkeletonDefinition.KEY_BONE, targetEntity.key());
        for (String field : requireBound()) {
            if (field.equals(SkeletonDefinition.KEY_BONE)) continue;
            dest.put(field, Entity.deepCopy(targetEntity.get(field)));
        }
        return dest;
    }

    /**
     * Every referenced key held in {@code value}, without duplicates.
     */
    public @NotNull Set<Key> referencedKeys(@Nullable Object value) {
        Set<Key> keys = new LinkedHashSet<>();
        for (Object single : singleValues(value)) {
            keys.add(((RelationalValue) single).key());
        }
        return keys;
    }

    @Override
    protected @NotNull List<Object> uniqueIndexSource(@NotNull Object value) {
        return new ArrayList<>(referencedKeys(value));
    }

    @Override
    public @NotNull Set<String> referencedBlobsOf(@Nullable Object value) {
        Set<String> blobs = new HashSet<>();
        SkeletonDefinition targetDefinition = target;
        for (Object single : singleValues(value)) {
            RelationalValue relational = (RelationalValue) single;
            if (targetDefinition != null) {
                collectBlobs(targetDefinition, relational.dest(), blobs);
            }
            if (using != null && relational.rel() != null) {
                collectBlobs(using, relational.rel(), blobs);
            }
        }
        return blobs;
    }

    private static void collectBlobs(SkeletonDefinition definition, Map<String, Object> values, Set<String> into) {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            BaseBone<?> bone = definition.bone(entry.getKey());
            if (bone != null && !(bone instanceof KeyBone)) {
                into.addAll(bone.referencedBlobsOf(bone.unserializeValue(entry.getValue())));
            }
        }
    }

    // ------------------------------------------------------------------
    // Refresh and reference removal
    // ------------------------------------------------------------------

    @Override
    public void refresh(@NotNull SkeletonInstance skel, @NotNull String name) {
        Object value = skel.get(name);
        if (updateLevel == RelationalUpdateLevel.NEVER || isEmpty(value)) {
            return;
        }

        Map<Key, Entity> targets = skel.runtime().store().getMulti(referencedKeys(value));
        Object refreshed = mapSingleValues(value, single -> {
            RelationalValue relational = (RelationalValue) single;
            Entity targetEntity = targets.get(relational.key());
            if (targetEntity != null) {
                return new RelationalValue(buildDest(targetEntity), relational.rel());
            }
            switch (consistency) {
                case CASCADE_DELETION:
                    Logging.info(name + ": cascade deleting " + skel.key() + " due to removal of " + relational.key());
                    skel.markForCascadeDeletion();
                    return relational;
                case SET_NULL:
                    Logging.info(name + ": emptying relation of " + skel.key() + " due to removal of " + relational.key());
                    return null;
                default:
                    Logging.info(name + ": relation from " + skel.key() + " refers to deleted " + relational.key() + ", skipping");
                    return relational;
            }
        });
        skel.setValue(name, refreshed);
    }

    @Override
    public boolean removeReference(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull Key key) {
        boolean[] removed = {false};
        Object updated = mapSingleValues(skel.get(name), single -> {
            if (((RelationalValue) single).key().equals(key)) {
                removed[0] = true;
                return null;
            }
            return single;
        });
        if (removed[0]) {
            skel.setValue(name, updated);
        }
        return removed[0];
    }

    // ------------------------------------------------------------------
    // Relational locks
    // ------------------------------------------------------------------

    @Override
    public void reconcileLocks(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context) {
        Entity owner = skel.entity();
        Set<Key> newLocks = consistency == RelationalConsistency.PREVENT_DELETION
            ? referencedKeys(skel.get(name)) : Set.of();

        Map<String, Object> outgoing = owner.getMap(SystemProperties.OUTGOING_RELATIONAL_LOCKS);
        Set<Key> oldLocks = keysOf(outgoing.get(name));
        if (newLocks.isEmpty()) {
            outgoing.remove(name);
        } else {
            outgoing.put(name, new ArrayList<>(newLocks));
        }
        Set<Key> heldElsewhere = locksHeldByOtherBones(outgoing, name);
        if (outgoing.isEmpty()) {
            owner.remove(SystemProperties.OUTGOING_RELATIONAL_LOCKS);
        } else {
            owner.put(SystemProperties.OUTGOING_RELATIONAL_LOCKS, outgoing);
        }

        for (Key added : newLocks) {
            if (!oldLocks.contains(added) && !heldElsewhere.contains(added)) {
                addIncomingLock(skel, added, context);
            }
        }
        for (Key removed : oldLocks) {
            if (!newLocks.contains(removed) && !heldElsewhere.contains(removed)) {
                removeIncomingLock(skel, removed, context);
            }
        }
    }

    @Override
    public void releaseLocks(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context) {
        Entity owner = skel.entity();
        if (owner == null || !(owner.get(SystemProperties.OUTGOING_RELATIONAL_LOCKS) instanceof Map<?, ?>)) {
            return;
        }
        Map<String, Object> outgoing = owner.getMap(SystemProperties.OUTGOING_RELATIONAL_LOCKS);
        Set<Key> held = keysOf(outgoing.remove(name));
        Set<Key> heldElsewhere = locksHeldByOtherBones(outgoing, name);
        owner.put(SystemProperties.OUTGOING_RELATIONAL_LOCKS, outgoing);
        for (Key key : held) {
            if (!heldElsewhere.contains(key)) {
                removeIncomingLock(skel, key, context);
            }
        }
    }

    @Override
    public void delete(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context) {
        releaseLocks(skel, name, context);
    }

    private static Set<Key> keysOf(@Nullable Object list) {
        Set<Key> keys = new LinkedHashSet<>();
        if (list instanceof List<?> elements) {
            for (Object element : elements) {
                if (element instanceof Key key) keys.add(key);
            }
        }
        return keys;
    }

    private static Set<Key> locksHeldByOtherBones(Map<String, Object> outgoing, String name) {
        Set<Key> keys = new HashSet<>();
        for (Map.Entry<String, Object> entry : outgoing.entrySet()) {
            if (!entry.getKey().equals(name)) keys.addAll(keysOf(entry.getValue()));
        }
        return keys;
    }

    private void addIncomingLock(SkeletonInstance skel, Key targetKey, WriteContext context) {
        Entity owner = skel.entity();
        boolean self = targetKey.equals(owner.key());
        Entity targetEntity = self ? owner : skel.runtime().store().get(targetKey);
        if (targetEntity == null) {
            context.reportIntegrity(new IntegrityWarning(IntegrityWarning.Type.MISSING_LOCK_TARGET, targetKey,
                "cannot lock missing entity for " + owner.key()));
            return;
        }
        List<Object> incoming = targetEntity.getList(SystemProperties.INCOMING_RELATIONAL_LOCKS);
        if (incoming.contains(owner.key())) {
            context.reportIntegrity(new IntegrityWarning(IntegrityWarning.Type.ASYMMETRIC_RELATIONAL_LOCK, targetKey,
                owner.key() + " already listed as incoming lock"));
            return;
        }
        incoming.add(owner.key());
        targetEntity.put(SystemProperties.INCOMING_RELATIONAL_LOCKS, incoming);
        if (!self) skel.runtime().store().put(targetEntity);
    }

    private void removeIncomingLock(SkeletonInstance skel, Key targetKey, WriteContext context) {
        Entity owner = skel.entity();
        boolean self = targetKey.equals(owner.key());
        Entity targetEntity = self ? owner : skel.runtime().store().get(targetKey);
        if (targetEntity == null) {
            context.reportIntegrity(new IntegrityWarning(IntegrityWarning.Type.MISSING_LOCK_TARGET, targetKey,
                "cannot release lock of " + owner.key() + " on missing entity"));
            return;
        }
        List<Object> incoming = targetEntity.getList(SystemProperties.INCOMING_RELATIONAL_LOCKS);
        if (!incoming.remove(owner.key())) {
            context.reportIntegrity(new IntegrityWarning(IntegrityWarning.Type.ASYMMETRIC_RELATIONAL_LOCK, targetKey,
                owner.key() + " is not listed as incoming lock"));
            return;
        }
        targetEntity.put(SystemProperties.INCOMING_RELATIONAL_LOCKS, incoming);
        if (!self) skel.runtime().store().put(targetEntity);
    }

    // ------------------------------------------------------------------
    // Relation edges
    // ------------------------------------------------------------------

    /**
     * Brings the relation edges of this bone in line with the owner's saved value. Runs in its own
     * transaction scoped to the owner's entity group.
     */
    @Override
    public void postSavedHandler(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull Key key) {
        Skeletal runtime = skel.runtime();
        EntityStore store = runtime.store();
        String relationKind = runtime.config().relationKind();

        Map<Key, RelationalValue> values = new LinkedHashMap<>();
        for (Object single : singleValues(skel.get(name))) {
            RelationalValue relational = (RelationalValue) single;
            values.putIfAbsent(relational.key(), relational);
        }
        Map<String, Object> src = new LinkedHashMap<>();
        src.put(SkeletonDefinition.KEY_BONE, key);
        Entity ownerEntity = skel.entity();
        for (String field : edgeFields) {
            src.put(field, ownerEntity == null ? null : Entity.deepCopy(ownerEntity.get(field)));
        }
        long now = runtime.clock().next();

        store.runInTransaction(() -> {
            for (Entity edge : store.queryAll(edgeQuery(relationKind, key, name))) {
                Key dest = edgeDestKey(edge);
                RelationalValue value = dest == null ? null : values.remove(dest);
                if (value == null) {
                    store.delete(edge.key());
                } else {
                    store.put(fillEdge(edge, value, src, name, now));
                }
            }
            for (RelationalValue value : values.values()) {
                Entity edge = new Entity(store.allocateKey(relationKind, key));
                store.put(fillEdge(edge, value, src, name, now));
            }
            return null;
        });
    }

    @Override
    public void postDeletedHandler(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull Key key) {
        EntityStore store = skel.runtime().store();
        List<Key> edges = new ArrayList<>();
        for (Entity edge : store.queryAll(edgeQuery(skel.runtime().config().relationKind(), key, name))) {
            edges.add(edge.key());
        }
        store.deleteMulti(edges);
    }

    private EntityQuery edgeQuery(String relationKind, Key owner, String name) {
        return EntityQuery.builder(relationKind)
            .ancestor(owner)
            .where(EDGE_SRC_KIND).eq(owner.kind())
            .where(EDGE_DEST_KIND).eq(targetKind)
            .where(EDGE_SRC_PROPERTY).eq(name)
            .build();
    }

    /**
     * The referenced key recorded on a relation edge.
     */
    public static @Nullable Key edgeDestKey(@NotNull Entity edge) {
        return edge.get(EDGE_DEST) instanceof Map<?, ?> dest && dest.get(SkeletonDefinition.KEY_BONE) instanceof Key key
            ? key : null;
    }

    private Entity fillEdge(Entity edge, RelationalValue value, Map<String, Object> src, String name, long now) {
        edge.put(EDGE_DEST, value.dest());
        edge.put(EDGE_REL, value.rel());
        edge.put(EDGE_SRC, src);
        edge.put(EDGE_SRC_KIND, ownerKind);
        edge.put(EDGE_SRC_PROPERTY, name);
        edge.put(EDGE_DEST_KIND, targetKind);
        edge.put(SystemProperties.DELAYED_UPDATE_TAG, now);
        edge.put(EDGE_UPDATE_LEVEL, updateLevel.value());
        edge.put(EDGE_CONSISTENCY, consistency.value());
        edge.put(EDGE_FOREIGN_KEYS, requireBound());
        return edge;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Override
    public void buildFilter(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                            @NotNull String operator, @Nullable Object value) {
        if (property.equals(name)) {
            if (!multiple && value == null) {
                query.addFilter(new FilterOption(name, operator, null));
                return;
            }
            throw new IllegalArgumentException("Filtering " + name + " requires a sub-property, e.g. " + name + ".dest.key");
        }
        String[] target = subProperty(name, property.substring(name.length() + 1));
        Object filterValue = target[1].equals(SkeletonDefinition.KEY_BONE) && target[0].equals(EDGE_DEST)
            ? toKeys(value) : value;
        if (multiple) {
            rewriteToEdges(name, query);
            query.addRawFilter(new FilterOption(target[0] + "." + target[1], operator, filterValue));
        } else {
            query.addFilter(new FilterOption(name + "." + target[0] + "." + target[1], operator, filterValue));
        }
    }

    @Override
    public void buildOrder(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                           @NotNull SortOrder order) {
        if (property.equals(name)) {
            throw new IllegalArgumentException("Ordering by " + name + " requires a sub-property, e.g. " + name + ".dest.name");
        }
        String[] target = subProperty(name, property.substring(name.length() + 1));
        if (multiple) {
            rewriteToEdges(name, query);
            query.addRawOrder(new SortOption(target[0] + "." + target[1], order));
        } else {
            query.addOrder(new SortOption(name + "." + target[0] + "." + target[1], order));
        }
    }

    /**
     * Splits a sub-property into {@code [dest|rel, field path]} and validates it against the cached
     * and edge fields.
     */
    private String[] subProperty(String name, String sub) {
        String type;
        String field;
        if (sub.startsWith(EDGE_DEST + ".")) {
            type = EDGE_DEST;
            field = sub.substring(EDGE_DEST.length() + 1);
        } else if (sub.startsWith(EDGE_REL + ".")) {
            type = EDGE_REL;
            field = sub.substring(EDGE_REL.length() + 1);
        } else {
            type = EDGE_DEST;
            field = sub;
        }
        String root = field.split("\\.")[0];
        if (type.equals(EDGE_DEST) && !requireBound().contains(root)) {
            throw new IllegalArgumentException(root + " is not a cached field of relational bone " + name);
        }
        if (type.equals(EDGE_REL) && (using == null || !using.hasBone(root))) {
            throw new IllegalArgumentException(root + " is not an edge data field of relational bone " + name);
        }
        return new String[]{type, field};
    }

    private static Object toKeys(@Nullable Object value) {
        if (value instanceof Collection<?> collection) {
            List<Key> keys = new ArrayList<>(collection.size());
            for (Object element : collection) keys.add(KeyBone.toKey(element));
            return keys;
        }
        return value == null ? null : KeyBone.toKey(value);
    }

    private void rewriteToEdges(String name, SkeletonQuery query) {
        if (query.isRewritten()) {
            if (query.rewrittenBy() != this) {
                throw new IllegalArgumentException("Query is already rewritten for another relational bone; "
                    + "only one multiple relational bone can be filtered per query");
            }
            return;
        }
        String relationKind = query.runtime().config().relationKind();
        query.rewriteTo(relationKind, this, new EdgeQueryHook(name));
        query.addRawFilter(new FilterOption(EDGE_SRC_KIND, "=", ownerKind));
        query.addRawFilter(new FilterOption(EDGE_DEST_KIND, "=", targetKind));
        query.addRawFilter(new FilterOption(EDGE_SRC_PROPERTY, "=", name));
    }

    /**
     * Translates filters and orders on the owner kind into their relation edge counterparts.
     */
    private final class EdgeQueryHook implements QueryHook {
        private final String name;

        EdgeQueryHook(String name) {
            this.name = name;
        }

        @Override
        public @Nullable FilterOption rewriteFilter(@NotNull SkeletonQuery query, @NotNull FilterOption filter) {
            String field = filter.field();
            if (isEdgeField(field)) {
                return filter;
            }
            if (filter.isKeyFilter()) {
                if (!"=".equals(filter.operator()) || !(filter.value() instanceof Key key)) {
                    throw new IllegalArgumentException("Relational queries on " + name + " support a single key= filter only");
                }
                query.ancestor(key);
                return null;
            }
            if (field.startsWith(name + ".")) {
                String[] target = subProperty(name, field.substring(name.length() + 1));
                return filter.withField(target[0] + "." + target[1]);
            }
            requireEdgeField(field);
            return filter.withField(EDGE_SRC + "." + field);
        }

        @Override
        public @NotNull SortOption rewriteOrder(@NotNull SkeletonQuery query, @NotNull SortOption order) {
            String field = order.field();
            if (isEdgeField(field) || FilterOption.KEY_PROPERTY.equals(field)) {
                return order;
            }
            if (field.startsWith(name + ".")) {
                String[] target = subProperty(name, field.substring(name.length() + 1));
                return order.withField(target[0] + "." + target[1]);
            }
            requireEdgeField(field);
            return order.withField(EDGE_SRC + "." + field);
        }

        private boolean isEdgeField(String field) {
            return field.startsWith(EDGE_SRC + ".") || field.startsWith(EDGE_DEST + ".") || field.startsWith(EDGE_REL + ".")
                || field.equals(EDGE_SRC_KIND) || field.equals(EDGE_DEST_KIND) || field.equals(EDGE_SRC_PROPERTY);
        }

        private void requireEdgeField(String field) {
            String root = field.split("\\.")[0];
            if (!edgeFields.contains(root) && !root.equals(SkeletonDefinition.KEY_BONE)) {
                throw new IllegalArgumentException(root + " is not an edge field of relational bone " + name);
            }
        }
    }

    public static class Builder extends BaseBone.Builder<RelationalValue, Builder> {
        private final String targetKind;
        private final List<String> cacheFields = new ArrayList<>();
        private final List<String> edgeFields = new ArrayList<>();
        private SkeletonDefinition using;
        private RelationalConsistency consistency = RelationalConsistency.IGNORE;
        private RelationalUpdateLevel updateLevel = RelationalUpdateLevel.ALWAYS;

        Builder(String targetKind) {
            this.targetKind = targetKind;
            cacheFields.add("name");
        }

        /**
         * Fields of the target copied into the cache; {@code *} globs are allowed. Replaces the
         * default of {@code name}.
         */
        public Builder cacheFields(String... fields) {
            cacheFields.clear();
            cacheFields.addAll(Arrays.asList(fields));
            return this;
        }

        /**
         * Fields of the owner copied onto each relation edge, making them filterable in queries on
         * this bone.
         */
        public Builder edgeFields(String... fields) {
            edgeFields.clear();
            edgeFields.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder using(@Nullable SkeletonDefinition using) {
            this.using = using;
            return this;
        }

        public Builder consistency(@NotNull RelationalConsistency consistency) {
            this.consistency = consistency;
            return this;
        }

        public Builder updateLevel(@NotNull RelationalUpdateLevel updateLevel) {
            this.updateLevel = updateLevel;
            return this;
        }

        @Override
        public RelationalBone build() {
            return new RelationalBone(this);
        }
    }
}
