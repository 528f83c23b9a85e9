package eu.lieko.store.batch;

import lombok.Data;

import java.util.Map;

/**
 * One entry of a batch update: the record id and the fields to merge into it.
 */
@Data
public class RecordUpdate {

    private final Object id;
    private final Map<String, ?> patch;

    public static RecordUpdate of(Object id, Map<String, ?> patch) {
        return new RecordUpdate(id, patch);
    }
}
