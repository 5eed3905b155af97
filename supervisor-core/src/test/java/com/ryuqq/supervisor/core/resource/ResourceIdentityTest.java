package com.ryuqq.supervisor.core.resource;

import com.ryuqq.supervisor.core.spi.ExternalHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * ResourceIdentity 테스트.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceIdentityTest {

    @Mock
    private ExternalHandle handle;

    @Test
    void constructor_NoDisplayName_FallsBackToProductThenClassKey() {
        assertThat(ResourceIdentity.of("talker", "Talker Pro").displayName()).isEqualTo("Talker Pro");
        assertThat(ResourceIdentity.of("talker").displayName()).isEqualTo("talker");
    }

    @Test
    void constructor_BlankClassKey_ThrowsException() {
        assertThatThrownBy(() -> ResourceIdentity.of(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void matches_AliveWithSameProduct_ReturnsTrue() {
        // given
        when(handle.isAlive()).thenReturn(true);
        when(handle.productName()).thenReturn(Optional.of("Talker Pro"));

        // when & then
        assertThat(ResourceIdentity.of("talker", "Talker Pro").matches(handle)).isTrue();
    }

    @Test
    void matches_DifferentProduct_ReturnsFalse() {
        // given
        when(handle.isAlive()).thenReturn(true);
        when(handle.productName()).thenReturn(Optional.of("Other"));

        // when & then
        assertThat(ResourceIdentity.of("talker", "Talker Pro").matches(handle)).isFalse();
    }

    @Test
    void matches_NoProductConstraint_IgnoresProductName() {
        // given
        when(handle.isAlive()).thenReturn(true);

        // when & then
        assertThat(ResourceIdentity.of("talker").matches(handle)).isTrue();
    }

    @Test
    void matches_DeadHandleOrNull_ReturnsFalse() {
        // given
        when(handle.isAlive()).thenReturn(false);

        // when & then
        assertThat(ResourceIdentity.of("talker").matches(handle)).isFalse();
        assertThat(ResourceIdentity.of("talker").matches(null)).isFalse();
    }
}
