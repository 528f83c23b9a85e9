package eu.lieko.store.error;

import lombok.NonNull;

public class ConflictException extends StoreException {

    public ConflictException(@NonNull ErrorCode errorCode) {
        super(errorCode);
    }

    public ConflictException(@NonNull ErrorCode errorCode, @NonNull String message) {
        super(errorCode, message);
    }
}
