package eu.lieko.store;

import lombok.NonNull;

import java.util.Locale;

/**
 * Access granted to a caller by the authentication collaborator. Each tier includes the ones below it.
 */
public enum PermissionTier {

    NONE,
    READ,
    WRITE,
    FULL;

    public boolean covers(@NonNull OperationCategory category) {
        switch (category) {
            case READ:
                return this.ordinal() >= READ.ordinal();
            case WRITE:
                return this.ordinal() >= WRITE.ordinal();
            case FULL:
                return this == FULL;
            default:
                return false;
        }
    }

    /**
     * @param value {@code none}, {@code read}, {@code write} or {@code full}, case-insensitive
     */
    public static PermissionTier parse(@NonNull String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
