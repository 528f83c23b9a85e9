package eu.lieko.store.error;

/**
 * Coarse error classes. The transport layer maps these to protocol statuses.
 */
public enum ErrorCategory {
    VALIDATION,
    PERMISSION,
    NOT_FOUND,
    CONFLICT,
    STORAGE
}
