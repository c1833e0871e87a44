package skill.swap.platform.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import skill.swap.platform.domain.SwapRequest;
import skill.swap.platform.domain.User;
import skill.swap.platform.exception.ForbiddenException;
import skill.swap.platform.security.Actor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Access Policy Tests")
class AccessPolicyTest {

    private static final Actor OWNER = new Actor(1L);
    private static final Actor STRANGER = new Actor(2L);

    @Test
    @DisplayName("Public profile is visible to everyone")
    void testPublicProfileVisible() {
        User user = User.builder().userId(1L).isPublic(true).build();

        assertThat(AccessPolicy.canViewUser(OWNER, user)).isTrue();
        assertThat(AccessPolicy.canViewUser(STRANGER, user)).isTrue();
    }

    @Test
    @DisplayName("Private profile is visible to its owner only")
    void testPrivateProfileOwnerOnly() {
        User user = User.builder().userId(1L).isPublic(false).build();

        assertThat(AccessPolicy.canViewUser(OWNER, user)).isTrue();
        assertThat(AccessPolicy.canViewUser(STRANGER, user)).isFalse();
        assertThatThrownBy(() -> AccessPolicy.checkCanViewUser(STRANGER, user))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Profile is private");
    }

    @Test
    @DisplayName("Only the owner may mutate a profile, whatever its visibility")
    void testMutateOwnerOnly() {
        User user = User.builder().userId(1L).isPublic(true).build();

        assertThatCode(() -> AccessPolicy.checkCanMutateUser(OWNER, user)).doesNotThrowAnyException();
        assertThatThrownBy(() -> AccessPolicy.checkCanMutateUser(STRANGER, user))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("Swap request is visible to its two parties only")
    void testSwapRequestPartiesOnly() {
        SwapRequest request = SwapRequest.builder().requestId(10L).requesterId(1L).recipientId(2L).build();

        assertThat(AccessPolicy.canViewSwapRequest(new Actor(1L), request)).isTrue();
        assertThat(AccessPolicy.canViewSwapRequest(new Actor(2L), request)).isTrue();
        assertThat(AccessPolicy.canViewSwapRequest(new Actor(3L), request)).isFalse();
        assertThatThrownBy(() -> AccessPolicy.checkCanViewSwapRequest(new Actor(3L), request))
                .isInstanceOf(ForbiddenException.class);
    }
}
