package eu.lieko.store.storage;

import eu.lieko.store.record.DataRecord;
import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.*;

/**
 * Full content of one collection: record id to record, in insertion order.
 * Not thread-safe; engines hand out copies and mutations happen under the collection write lock.
 */
@EqualsAndHashCode
public class RecordMap implements Iterable<DataRecord> {

    private final Map<String, DataRecord> records;
    @EqualsAndHashCode.Exclude
    private boolean modified;

    public RecordMap() {
        this.records = new LinkedHashMap<>();
    }

    public RecordMap(@NonNull Map<String, DataRecord> records) {
        this.records = new LinkedHashMap<>(records);
    }

    public static RecordMap empty() {
        return new RecordMap();
    }

    /**
     * Builds a map from a raw id to fields structure, as stored in a container file.
     */
    @SuppressWarnings("unchecked")
    public static RecordMap fromRaw(@NonNull Map<String, ?> raw) {
        RecordMap map = new RecordMap();
        raw.forEach((id, fields) -> {
            if (!(fields instanceof Map)) {
                throw new IllegalArgumentException("Record " + id + " is not an object");
            }
            map.records.put(id, DataRecord.of((Map<String, ?>) fields));
        });
        return map;
    }

    public Map<String, Object> toRaw() {
        Map<String, Object> raw = new LinkedHashMap<>();
        this.records.forEach((id, record) -> raw.put(id, record.asMap()));
        return raw;
    }

    public Optional<DataRecord> find(@NonNull String id) {
        return Optional.ofNullable(this.records.get(id));
    }

    public DataRecord get(@NonNull String id) {
        return this.records.get(id);
    }

    public boolean contains(@NonNull String id) {
        return this.records.containsKey(id);
    }

    public void put(@NonNull String id, @NonNull DataRecord record) {
        this.records.put(id, record);
        this.modified = true;
    }

    public boolean remove(@NonNull String id) {
        boolean removed = this.records.remove(id) != null;
        this.modified |= removed;
        return removed;
    }

    /**
     * @return whether {@link #put} or a successful {@link #remove} happened since this map was created
     */
    public boolean isModified() {
        return this.modified;
    }

    public int size() {
        return this.records.size();
    }

    public boolean isEmpty() {
        return this.records.isEmpty();
    }

    public List<String> ids() {
        return new ArrayList<>(this.records.keySet());
    }

    public List<DataRecord> values() {
        return new ArrayList<>(this.records.values());
    }

    public Set<Map.Entry<String, DataRecord>> entrySet() {
        return Collections.unmodifiableMap(this.records).entrySet();
    }

    public RecordMap copy() {
        return new RecordMap(this.records);
    }

    @Override
    public Iterator<DataRecord> iterator() {
        return Collections.unmodifiableCollection(this.records.values()).iterator();
    }

    @Override
    public String toString() {
        return "RecordMap" + this.records.keySet();
    }
}
