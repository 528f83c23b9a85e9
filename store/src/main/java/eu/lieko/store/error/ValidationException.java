package eu.lieko.store.error;

import lombok.NonNull;

public class ValidationException extends StoreException {

    public ValidationException(@NonNull ErrorCode errorCode) {
        super(errorCode);
    }

    public ValidationException(@NonNull ErrorCode errorCode, @NonNull String message) {
        super(errorCode, message);
    }
}
