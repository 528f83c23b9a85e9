package eu.lieko.store.error;

import lombok.Getter;
import lombok.NonNull;

/**
 * Base of every failure raised by the store. Carries a stable {@link ErrorCode}
 * next to the human-readable message.
 */
@Getter
public class StoreException extends RuntimeException {

    private final ErrorCode errorCode;

    public StoreException(@NonNull ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public StoreException(@NonNull ErrorCode errorCode, @NonNull String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StoreException(@NonNull ErrorCode errorCode, @NonNull String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCategory getCategory() {
        return this.errorCode.getCategory();
    }

    public String getCode() {
        return this.errorCode.getCode();
    }
}
