package eu.lieko.store;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.PermissionDeniedException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionTierTest {

    @Test
    void tiers_include_lower_ones() {
        assertThat(PermissionTier.NONE.covers(OperationCategory.READ)).isFalse();
        assertThat(PermissionTier.READ.covers(OperationCategory.READ)).isTrue();
        assertThat(PermissionTier.READ.covers(OperationCategory.WRITE)).isFalse();
        assertThat(PermissionTier.WRITE.covers(OperationCategory.WRITE)).isTrue();
        assertThat(PermissionTier.WRITE.covers(OperationCategory.FULL)).isFalse();
        assertThat(PermissionTier.FULL.covers(OperationCategory.FULL)).isTrue();
    }

    @Test
    void parse_is_case_insensitive() {
        assertThat(PermissionTier.parse(" Write ")).isEqualTo(PermissionTier.WRITE);
        assertThatThrownBy(() -> PermissionTier.parse("admin")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scope_require_throws_forbidden() {
        AccessScope scope = AccessScope.of("p1", PermissionTier.READ);

        assertThatCode(() -> scope.require(OperationCategory.READ)).doesNotThrowAnyException();
        assertThatThrownBy(() -> scope.require(OperationCategory.FULL))
            .isInstanceOf(PermissionDeniedException.class)
            .hasMessage("Operation requires full access, token has read")
            .extracting("errorCode")
            .isEqualTo(ErrorCode.FORBIDDEN);
    }
}
