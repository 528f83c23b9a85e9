package eu.lieko.store.error;

import lombok.NonNull;

public class PermissionDeniedException extends StoreException {

    public PermissionDeniedException(@NonNull ErrorCode errorCode) {
        super(errorCode);
    }

    public PermissionDeniedException(@NonNull ErrorCode errorCode, @NonNull String message) {
        super(errorCode, message);
    }
}
