package eu.lieko.store.batch;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.StoreException;
import lombok.Data;
import lombok.NonNull;

/**
 * Failed batch item. Carries the offending id as given by the caller (may be null).
 */
@Data
public class BatchItemError {

    private final int index;
    private final String id;
    private final ErrorCode errorCode;
    private final String message;

    public static BatchItemError of(int index, String id, @NonNull ErrorCode errorCode, @NonNull String message) {
        return new BatchItemError(index, id, errorCode, message);
    }

    public static BatchItemError of(int index, String id, @NonNull StoreException exception) {
        return new BatchItemError(index, id, exception.getErrorCode(), exception.getMessage());
    }

    public String getCode() {
        return this.errorCode.getCode();
    }
}
