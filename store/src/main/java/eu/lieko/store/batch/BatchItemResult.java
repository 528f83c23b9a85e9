package eu.lieko.store.batch;

import eu.lieko.store.record.DataRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Successful outcome of one batch item.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BatchItemResult {

    public static final String SUCCESS = "success";

    private final int index;
    private final String id;
    private final String status;
    private final DataRecord record;
    private final String message;

    public static BatchItemResult success(int index, String id, DataRecord record) {
        return new BatchItemResult(index, id, SUCCESS, record, null);
    }

    public static BatchItemResult success(int index, String id, String message) {
        return new BatchItemResult(index, id, SUCCESS, null, message);
    }
}
