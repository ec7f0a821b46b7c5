package io.github.flameyossnowy.skeletal.api.bones;

import io.github.flameyossnowy.skeletal.api.options.FilterOption;
import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.api.pipeline.WriteContext;
import io.github.flameyossnowy.skeletal.api.query.SkeletonQuery;
import io.github.flameyossnowy.skeletal.api.skeleton.SkeletonInstance;
import io.github.flameyossnowy.skeletal.api.store.Entity;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Base class of all field types.
 *
 * <p>A bone is stateless schema: it never holds a value itself. Values live in the
 * {@link SkeletonInstance}, and the bone is handed the instance and its own name on every call.
 * A value has one of three shapes depending on the bone's configuration:</p>
 * <ul>
 *     <li>a single value of type {@code V} (or {@code null}),</li>
 *     <li>a {@code List<V>} when the bone is {@link #isMultiple() multiple},</li>
 *     <li>a {@code Map<String, ...>} from language to one of the above when the bone has languages.</li>
 * </ul>
 * Subclasses only deal with single values; the shape handling is done here.
 *
 * @param <V> type of a single value in memory
 */
public abstract class BaseBone<V> {
    protected final boolean required;
    protected final boolean readOnly;
    protected final boolean multiple;
    protected final boolean indexed;
    protected final List<String> languages;
    protected final @Nullable V defaultValue;
    protected final @Nullable UniqueConstraint unique;
    protected final @Nullable String descr;

    protected BaseBone(@NotNull Builder<V, ?> builder) {
        this.required = builder.required;
        this.readOnly = builder.readOnly;
        this.multiple = builder.multiple;
        this.indexed = builder.indexed;
        this.languages = List.copyOf(builder.languages);
        this.defaultValue = builder.defaultValue;
        this.unique = builder.unique;
        this.descr = builder.descr;
        if (unique != null && !languages.isEmpty()) {
            throw new IllegalArgumentException("Unique constraints are not supported on localized bones");
        }
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean isMultiple() {
        return multiple;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public @NotNull List<String> languages() {
        return languages;
    }

    public @Nullable UniqueConstraint unique() {
        return unique;
    }

    public @Nullable String descr() {
        return descr;
    }

    // ------------------------------------------------------------------
    // Value shape
    // ------------------------------------------------------------------

    public @Nullable Object getDefaultValue(@NotNull SkeletonInstance skel) {
        if (!languages.isEmpty()) {
            Map<String, Object> byLanguage = new LinkedHashMap<>();
            for (String language : languages) {
                byLanguage.put(language, multiple ? new ArrayList<>() : singleDefault());
            }
            return byLanguage;
        }
        return multiple ? new ArrayList<>() : singleDefault();
    }

    protected @Nullable Object singleDefault() {
        return Entity.deepCopy(defaultValue);
    }

    /**
     * Every non-null single value held in {@code value}, across languages and list entries.
     */
    public @NotNull List<Object> singleValues(@Nullable Object value) {
        List<Object> result = new ArrayList<>();
        if (value == null) return result;
        if (!languages.isEmpty() && value instanceof Map<?, ?> byLanguage) {
            for (Object languageValue : byLanguage.values()) {
                collectSingles(languageValue, result);
            }
        } else {
            collectSingles(value, result);
        }
        return result;
    }

    private void collectSingles(@Nullable Object value, List<Object> into) {
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null) into.add(element);
            }
        } else if (value != null) {
            into.add(value);
        }
    }

    /**
     * Applies {@code fn} to every single value in {@code value}. A {@code null} result removes
     * the entry from lists and resets single values to {@code null}.
     */
    public @Nullable Object mapSingleValues(@Nullable Object value, @NotNull UnaryOperator<Object> fn) {
        if (value == null) return null;
        if (!languages.isEmpty() && value instanceof Map<?, ?> byLanguage) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : byLanguage.entrySet()) {
                result.put((String) entry.getKey(), mapShape(entry.getValue(), fn));
            }
            return result;
        }
        return mapShape(value, fn);
    }

    private Object mapShape(Object value, UnaryOperator<Object> fn) {
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object element : list) {
                Object mapped = element == null ? null : fn.apply(element);
                if (mapped != null) result.add(mapped);
            }
            return result;
        }
        return value == null ? null : fn.apply(value);
    }

    public boolean isEmpty(@Nullable Object value) {
        for (Object single : singleValues(value)) {
            if (!isEmptySingle(single)) return false;
        }
        return true;
    }

    protected boolean isEmptySingle(@Nullable Object value) {
        return value == null;
    }

    // ------------------------------------------------------------------
    // Serialization
    // ------------------------------------------------------------------

    /**
     * Writes the current value into the instance's entity.
     *
     * @return true if the stored representation changed
     */
    public boolean serialize(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context) {
        Entity entity = Objects.requireNonNull(skel.entity(), "serialize requires an entity");
        Object previous = entity.get(name);
        boolean existed = entity.contains(name);
        entity.put(name, serializeValue(skel.get(name)));

        // drop flattened properties left behind by an older storage layout
        for (String property : new ArrayList<>(entity.propertyNames())) {
            if (property.startsWith(name + ".")) entity.remove(property);
        }
        return !existed || !Objects.equals(previous, entity.get(name));
    }

    public @Nullable Object serializeValue(@Nullable Object value) {
        if (!languages.isEmpty()) {
            Map<String, Object> byLanguage = new LinkedHashMap<>();
            Map<?, ?> source = value instanceof Map<?, ?> map ? map : Map.of();
            for (String language : languages) {
                byLanguage.put(language, serializeShape(source.get(language)));
            }
            return byLanguage;
        }
        return serializeShape(value);
    }

    private Object serializeShape(Object value) {
        if (multiple) {
            List<Object> result = new ArrayList<>();
            if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element != null) result.add(singleValueSerialize(element));
                }
            }
            return result;
        }
        return value == null ? null : singleValueSerialize(value);
    }

    protected @Nullable Object singleValueSerialize(@NotNull Object value) {
        return value;
    }

    /**
     * Reads this bone's value from the instance's entity, falling back to the default when
     * the entity does not carry it.
     */
    public @Nullable Object unserialize(@NotNull SkeletonInstance skel, @NotNull String name) {
        Entity entity = skel.entity();
        if (entity == null || !entity.contains(name)) {
            return getDefaultValue(skel);
        }
        return unserializeValue(entity.get(name));
    }

    public @Nullable Object unserializeValue(@Nullable Object raw) {
        if (!languages.isEmpty()) {
            Map<String, Object> byLanguage = new LinkedHashMap<>();
            Map<?, ?> source = raw instanceof Map<?, ?> map && isLanguageMap(map) ? map : null;
            for (String language : languages) {
                Object languageRaw = source != null ? source.get(language)
                    : language.equals(languages.get(0)) ? raw : null;
                byLanguage.put(language, unserializeShape(languageRaw));
            }
            return byLanguage;
        }
        return unserializeShape(raw);
    }

    private boolean isLanguageMap(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!languages.contains(key)) return false;
        }
        return true;
    }

    private Object unserializeShape(Object raw) {
        if (multiple) {
            List<Object> result = new ArrayList<>();
            if (raw == null) return result;
            Collection<?> items = raw instanceof List<?> list ? list : List.of(raw);
            for (Object item : items) {
                Object value = item == null ? null : singleValueUnserialize(item);
                if (value != null) result.add(value);
            }
            return result;
        }
        if (raw instanceof List<?> list) {
            raw = list.isEmpty() ? null : list.get(0);
        }
        return raw == null ? singleDefault() : singleValueUnserialize(raw);
    }

    protected @Nullable Object singleValueUnserialize(@NotNull Object raw) {
        return raw;
    }

    // ------------------------------------------------------------------
    // Client input
    // ------------------------------------------------------------------

    /**
     * Reads this bone's value from client supplied data and stores it in {@code skel}.
     * The stored value is always safe to write, even when errors are returned.
     */
    public @NotNull List<ReadFromClientError> fromClient(@NotNull SkeletonInstance skel, @NotNull String name,
                                                         @NotNull Map<String, ?> data) {
        if (!data.containsKey(name)) {
            return List.of(new ReadFromClientError(ReadFromClientErrorSeverity.NOT_SET, "Field not submitted"));
        }
        Object raw = data.get(name);
        List<ReadFromClientError> errors = new ArrayList<>();
        Object value;
        if (!languages.isEmpty()) {
            Map<String, Object> byLanguage = new LinkedHashMap<>();
            Map<?, ?> source = raw instanceof Map<?, ?> map ? map : Map.of();
            for (String language : languages) {
                List<ReadFromClientError> languageErrors = new ArrayList<>();
                byLanguage.put(language, shapeFromClient(skel, name, source.get(language), languageErrors));
                for (ReadFromClientError error : languageErrors) {
                    errors.add(error.prefixed(language));
                }
            }
            value = byLanguage;
        } else {
            value = shapeFromClient(skel, name, raw, errors);
        }

        skel.setValue(name, value);
        if (errors.isEmpty() && isEmpty(value)) {
            return List.of(new ReadFromClientError(ReadFromClientErrorSeverity.EMPTY, "Field not set"));
        }
        return errors;
    }

    private Object shapeFromClient(SkeletonInstance skel, String name, Object raw, List<ReadFromClientError> errors) {
        if (multiple) {
            List<Object> result = new ArrayList<>();
            Collection<?> items = raw instanceof Collection<?> collection ? collection
                : isEmptyRaw(raw) ? List.of() : List.of(raw);
            int index = 0;
            for (Object item : items) {
                String position = String.valueOf(index++);
                if (isEmptyRaw(item)) continue;
                List<ReadFromClientError> itemErrors = new ArrayList<>();
                V parsed = singleValueFromClient(item, skel, name, itemErrors);
                if (parsed != null) {
                    result.add(parsed);
                } else if (itemErrors.isEmpty()) {
                    itemErrors.add(ReadFromClientError.invalid("Invalid value"));
                }
                for (ReadFromClientError error : itemErrors) {
                    errors.add(error.prefixed(position));
                }
            }
            return result;
        }

        if (isEmptyRaw(raw)) {
            return singleDefault();
        }
        V parsed = singleValueFromClient(raw, skel, name, errors);
        if (parsed == null) {
            if (errors.isEmpty()) errors.add(ReadFromClientError.invalid("Invalid value"));
            return singleDefault();
        }
        return parsed;
    }

    protected boolean isEmptyRaw(@Nullable Object raw) {
        return raw == null || (raw instanceof String string && string.isBlank());
    }

    /**
     * Parses one submitted value. Problems are appended to {@code errors}; returning
     * {@code null} discards the value.
     */
    protected abstract @Nullable V singleValueFromClient(@NotNull Object raw, @NotNull SkeletonInstance skel,
                                                         @NotNull String name, @NotNull List<ReadFromClientError> errors);

    /**
     * Programmatic assignment with the same validation as client input.
     *
     * @param append   add to a multiple bone's value instead of replacing it
     * @param language the language to assign; required for localized bones, forbidden otherwise
     * @return false if the value was rejected; the bone's value is then left untouched
     */
    public boolean setBoneValue(@NotNull SkeletonInstance skel, @NotNull String name, @Nullable Object value,
                                boolean append, @Nullable String language) {
        if (languages.isEmpty() ? language != null : language == null || !languages.contains(language)) {
            throw new IllegalArgumentException("Bone " + name + (languages.isEmpty()
                ? " is not localized" : " requires one of the languages " + languages));
        }
        if (append && !multiple) {
            throw new IllegalArgumentException("Cannot append to single-valued bone " + name);
        }

        List<ReadFromClientError> errors = new ArrayList<>();
        Object parsed;
        if (multiple && !append) {
            List<Object> list = new ArrayList<>();
            Collection<?> items = value instanceof Collection<?> collection ? collection
                : value == null ? List.of() : List.of(value);
            for (Object item : items) {
                V single = item == null ? null : singleValueFromClient(item, skel, name, errors);
                if (single == null || hasInvalid(errors)) return false;
                list.add(single);
            }
            parsed = list;
        } else if (value == null) {
            if (append) return false;
            parsed = singleDefault();
        } else {
            V single = singleValueFromClient(value, skel, name, errors);
            if (single == null || hasInvalid(errors)) return false;
            parsed = single;
        }

        Object current = skel.get(name);
        Object updated;
        if (language != null) {
            @SuppressWarnings("unchecked")
            Map<String, Object> byLanguage = current instanceof Map<?, ?> map
                ? new LinkedHashMap<>((Map<String, Object>) map) : new LinkedHashMap<>();
            byLanguage.put(language, append ? appended(byLanguage.get(language), parsed) : parsed);
            updated = byLanguage;
        } else {
            updated = append ? appended(current, parsed) : parsed;
        }
        skel.setValue(name, updated);
        return true;
    }

    private static List<Object> appended(Object current, Object addition) {
        List<Object> list = current instanceof List<?> existing ? new ArrayList<>(existing) : new ArrayList<>();
        list.add(addition);
        return list;
    }

    private static boolean hasInvalid(List<ReadFromClientError> errors) {
        for (ReadFromClientError error : errors) {
            if (error.severity() == ReadFromClientErrorSeverity.INVALID) return true;
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Unique index
    // ------------------------------------------------------------------

    /**
     * Hashes of the current value for the unique property index; empty when the bone is
     * not unique or there is nothing to lock.
     */
    public @NotNull List<String> getUniquePropertyIndexValues(@NotNull SkeletonInstance skel, @NotNull String name) {
        if (unique == null) return List.of();
        Object value = skel.get(name);
        if (value == null) return List.of();
        return hashForUniqueIndex(uniqueIndexSource(value));
    }

    /**
     * The single values that take part in uniqueness.
     */
    protected @NotNull List<Object> uniqueIndexSource(@NotNull Object value) {
        return singleValues(value);
    }

    protected @NotNull List<String> hashForUniqueIndex(@NotNull List<Object> values) {
        boolean lockEmpty = unique != null && unique.lockEmpty();
        if (!multiple) {
            if (values.isEmpty()) return List.of();
            Object value = values.get(0);
            if (isEmptySingle(value) && !lockEmpty) return List.of();
            return List.of(uniqueHash(value));
        }
        if (values.isEmpty() && !lockEmpty) return List.of();

        List<String> hashes = new ArrayList<>(values.size());
        for (Object value : values) hashes.add(uniqueHash(value));
        UniqueLockMethod method = unique == null ? UniqueLockMethod.SAME_VALUE : unique.method();
        if (method == UniqueLockMethod.SAME_VALUE) {
            return hashes;
        }
        if (method == UniqueLockMethod.SAME_SET) {
            hashes.sort(null);
        }
        return List.of(uniqueHash(String.join(", ", hashes)));
    }

    /**
     * Stable hash of a single value. Keys are hashed component by component so the result does
     * not depend on any key encoding.
     */
    public static @NotNull String uniqueHash(@NotNull Object value) {
        if (value instanceof Key key) {
            return "K-" + keyHash(key);
        }
        if (value instanceof Boolean bool) {
            return "I-" + sha256(bool ? "True" : "False");
        }
        if (value instanceof Number) {
            return "I-" + sha256(value.toString());
        }
        if (value instanceof String string) {
            return "S-" + sha256(string);
        }
        throw new IllegalArgumentException("Values of type " + value.getClass().getName()
            + " can't be used in a unique property index");
    }

    private static String keyHash(@Nullable Key key) {
        if (key == null) return "-";
        return uniqueHash(key.kind()) + "-" + uniqueHash(Objects.requireNonNull(key.idOrName())) + "-<" + keyHash(key.parent()) + ">";
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ------------------------------------------------------------------
    // Hooks
    // ------------------------------------------------------------------

    /**
     * Blob keys referenced by the current value.
     */
    public @NotNull Set<String> getReferencedBlobs(@NotNull SkeletonInstance skel, @NotNull String name) {
        return referencedBlobsOf(skel.get(name));
    }

    /**
     * Blob keys referenced by {@code value}, a value of this bone in memory form.
     */
    public @NotNull Set<String> referencedBlobsOf(@Nullable Object value) {
        return Set.of();
    }

    /**
     * Re-derives cached content from authoritative sources.
     */
    public void refresh(@NotNull SkeletonInstance skel, @NotNull String name) {
    }

    /**
     * Runs inside the delete transaction, before the entity is removed.
     */
    public void delete(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull WriteContext context) {
    }

    public void postSavedHandler(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull Key key) {
    }

    public void postDeletedHandler(@NotNull SkeletonInstance skel, @NotNull String name, @NotNull Key key) {
    }

    // ------------------------------------------------------------------
    // Query support for plain value bones
    // ------------------------------------------------------------------

    protected void buildSimpleFilter(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                                     @NotNull String operator, @Nullable Object value) {
        String field = resolveQueryField(name, property);
        Object filterValue;
        if (value instanceof Collection<?> collection) {
            List<Object> converted = new ArrayList<>(collection.size());
            for (Object element : collection) converted.add(filterValue(element));
            filterValue = converted;
        } else {
            filterValue = filterValue(value);
        }
        query.addFilter(new FilterOption(field, operator, filterValue));
    }

    protected void buildSimpleOrder(@NotNull String name, @NotNull SkeletonQuery query, @NotNull String property,
                                    @NotNull SortOrder order) {
        query.addOrder(new SortOption(resolveQueryField(name, property), order));
    }

    private String resolveQueryField(String name, String property) {
        if (!indexed) {
            throw new IllegalArgumentException("Bone " + name + " is not indexed");
        }
        if (property.equals(name)) {
            return languages.isEmpty() ? name : name + "." + languages.get(0);
        }
        String sub = property.substring(name.length() + 1);
        if (!languages.contains(sub)) {
            throw new IllegalArgumentException("Unknown property " + property);
        }
        return property;
    }

    /**
     * Converts a filter operand to its stored form.
     */
    protected @Nullable Object filterValue(@Nullable Object value) {
        return value == null ? null : singleValueSerialize(value);
    }

    /**
     * Common builder for bones.
     *
     * @param <V> type of a single value
     * @param <B> concrete builder type
     */
    @SuppressWarnings("unchecked")
    public abstract static class Builder<V, B extends Builder<V, B>> {
        private boolean required;
        private boolean readOnly;
        private boolean multiple;
        private boolean indexed = true;
        private final List<String> languages = new ArrayList<>();
        private V defaultValue;
        private UniqueConstraint unique;
        private String descr;

        public B required() {
            this.required = true;
            return (B) this;
        }

        public B readOnly() {
            this.readOnly = true;
            return (B) this;
        }

        public B multiple() {
            this.multiple = true;
            return (B) this;
        }

        public B indexed(boolean indexed) {
            this.indexed = indexed;
            return (B) this;
        }

        public B languages(String... languages) {
            this.languages.clear();
            this.languages.addAll(Arrays.asList(languages));
            return (B) this;
        }

        public B defaultValue(@Nullable V defaultValue) {
            this.defaultValue = defaultValue;
            return (B) this;
        }

        public B unique(@Nullable UniqueConstraint unique) {
            this.unique = unique;
            return (B) this;
        }

        public B descr(@Nullable String descr) {
            this.descr = descr;
            return (B) this;
        }

        public abstract BaseBone<V> build();
    }
}
