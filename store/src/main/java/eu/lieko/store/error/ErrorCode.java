package eu.lieko.store.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable machine-readable error codes. The enum constant name is the wire code.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ==================== VALIDATION ====================

    INVALID_REQUEST_BODY(ErrorCategory.VALIDATION, "Invalid request body"),
    INVALID_ID_FORMAT(ErrorCategory.VALIDATION, "Invalid ID format. Only letters, numbers, underscores, and hyphens allowed"),
    INVALID_FILTER(ErrorCategory.VALIDATION, "Invalid filter JSON"),
    MISSING_REQUIRED_FIELDS(ErrorCategory.VALIDATION, "Missing required fields"),
    INVALID_FIELD(ErrorCategory.VALIDATION, "Invalid field name or value"),
    INVALID_COLLECTION_NAME(ErrorCategory.VALIDATION, "Invalid collection name. Only letters, numbers, underscores, and hyphens allowed"),
    INVALID_SORT(ErrorCategory.VALIDATION, "Invalid sort expression, expected field:asc or field:desc"),
    INVALID_PAGINATION(ErrorCategory.VALIDATION, "Offset and limit must not be negative"),

    // ==================== PERMISSION ====================

    FORBIDDEN(ErrorCategory.PERMISSION, "Insufficient permissions for operation"),

    // ==================== NOT FOUND ====================

    PROJECT_NOT_FOUND(ErrorCategory.NOT_FOUND, "Project not found"),
    COLLECTION_NOT_FOUND(ErrorCategory.NOT_FOUND, "Collection not found"),
    RECORD_NOT_FOUND(ErrorCategory.NOT_FOUND, "Record not found"),

    // ==================== CONFLICT ====================

    RECORD_EXISTS(ErrorCategory.CONFLICT, "Record already exists"),

    // ==================== STORAGE ====================

    FILE_SYSTEM_ERROR(ErrorCategory.STORAGE, "File system operation failed"),
    JSON_PARSING_ERROR(ErrorCategory.STORAGE, "Failed to parse JSON data"),
    COLLECTION_CREATION_FAILED(ErrorCategory.STORAGE, "Failed to create collection"),
    REGISTRATION_ERROR(ErrorCategory.STORAGE, "Failed to register collection or project"),
    LOCK_TIMEOUT(ErrorCategory.STORAGE, "Timed out waiting for write lock"),
    LOCK_INTERRUPTED(ErrorCategory.STORAGE, "Interrupted while waiting for write lock");

    private final ErrorCategory category;
    private final String defaultMessage;

    public String getCode() {
        return this.name();
    }
}
