package eu.lieko.store.error;

import lombok.NonNull;

public class NotFoundException extends StoreException {

    public NotFoundException(@NonNull ErrorCode errorCode) {
        super(errorCode);
    }

    public NotFoundException(@NonNull ErrorCode errorCode, @NonNull String message) {
        super(errorCode, message);
    }
}
