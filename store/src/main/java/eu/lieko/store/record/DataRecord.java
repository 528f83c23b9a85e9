package eu.lieko.store.record;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable schema-less record: an ordered map of field names to normalized JSON values.
 * Engine-managed fields are {@link #ID}, {@link #CREATED_AT} and {@link #UPDATED_AT}.
 */
@EqualsAndHashCode
public final class DataRecord {

    public static final String ID = "id";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    private final Map<String, Object> fields;

    private DataRecord(@NonNull Map<String, Object> fields) {
        this.fields = fields;
    }

    /**
     * @throws eu.lieko.store.error.ValidationException if any value is not representable as JSON
     */
    @SuppressWarnings("unchecked")
    public static DataRecord of(@NonNull Map<String, ?> fields) {
        return new DataRecord((Map<String, Object>) RecordValues.normalize(fields));
    }

    public String getId() {
        Object id = this.fields.get(ID);
        return (id instanceof String) ? (String) id : null;
    }

    public String getCreatedAt() {
        Object value = this.fields.get(CREATED_AT);
        return (value instanceof String) ? (String) value : null;
    }

    public String getUpdatedAt() {
        Object value = this.fields.get(UPDATED_AT);
        return (value instanceof String) ? (String) value : null;
    }

    public Object get(@NonNull String field) {
        return this.fields.get(field);
    }

    /**
     * @return value under the path or {@link RecordValues#absent()} when it does not exist
     */
    public Object resolve(@NonNull FieldPath path) {
        return RecordValues.extractValue(this.fields, path.getParts());
    }

    public boolean has(@NonNull String field) {
        return this.fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return this.fields.keySet();
    }

    public int size() {
        return this.fields.size();
    }

    /**
     * @return unmodifiable view of the fields
     */
    public Map<String, Object> asMap() {
        return this.fields;
    }

    /**
     * @return deep mutable copy of the fields
     */
    public Map<String, Object> toMutableMap() {
        return RecordValues.mutableCopy(this.fields);
    }

    public DataRecord with(@NonNull String field, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(this.fields);
        copy.put(field, value);
        return of(copy);
    }

    /**
     * Keeps only the given paths. Dotted paths keep the nested value under the same nesting;
     * paths that do not resolve are omitted.
     */
    public DataRecord project(@NonNull Collection<FieldPath> paths) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (FieldPath path : paths) {
            Object value = this.resolve(path);
            if (!RecordValues.isAbsent(value)) {
                putNested(out, path, value);
            }
        }
        return of(out);
    }

    @SuppressWarnings("unchecked")
    private static void putNested(Map<String, Object> out, FieldPath path, Object value) {
        Map<String, Object> target = out;
        for (String parent : path.getParents()) {
            Object nested = target.get(parent);
            if (nested == null) {
                nested = new LinkedHashMap<String, Object>();
                target.put(parent, nested);
            } else if (!(nested instanceof LinkedHashMap)) {
                // parent already projected as a whole
                return;
            }
            target = (Map<String, Object>) nested;
        }
        target.put(path.getLast(), value);
    }

    @Override
    public String toString() {
        return "DataRecord" + this.fields;
    }
}
