package eu.lieko.store;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.PermissionDeniedException;
import lombok.Data;
import lombok.NonNull;

import java.util.Locale;

/**
 * Resolved caller scope: the project a credential belongs to and what it may do there.
 */
@Data
public class AccessScope {

    private final @NonNull String projectId;
    private final @NonNull PermissionTier tier;

    public static AccessScope of(@NonNull String projectId, @NonNull PermissionTier tier) {
        return new AccessScope(projectId, tier);
    }

    /**
     * @throws PermissionDeniedException {@link ErrorCode#FORBIDDEN} if the tier does not cover the category
     */
    public void require(@NonNull OperationCategory category) {
        if (!this.tier.covers(category)) {
            throw new PermissionDeniedException(ErrorCode.FORBIDDEN,
                "Operation requires " + category.name().toLowerCase(Locale.ROOT) + " access, token has " + this.tier.name().toLowerCase(Locale.ROOT));
        }
    }
}
