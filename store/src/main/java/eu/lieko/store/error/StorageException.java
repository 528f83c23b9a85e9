package eu.lieko.store.error;

import lombok.NonNull;

/**
 * I/O or lock failure. Fatal to the current operation, never retried by the store.
 */
public class StorageException extends StoreException {

    public StorageException(@NonNull ErrorCode errorCode) {
        super(errorCode);
    }

    public StorageException(@NonNull ErrorCode errorCode, @NonNull String message) {
        super(errorCode, message);
    }

    public StorageException(@NonNull ErrorCode errorCode, @NonNull String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
