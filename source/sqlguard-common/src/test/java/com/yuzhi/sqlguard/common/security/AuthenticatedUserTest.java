package com.yuzhi.sqlguard.common.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class AuthenticatedUserTest {

    @Test
    void rolesAreMatchedCaseInsensitively() {
        AuthenticatedUser user = AuthenticatedUser.of(" sarah ", List.of("User", " ADMIN "));

        assertThat(user.username()).isEqualTo("sarah");
        assertThat(user.roles()).containsExactlyInAnyOrder("user", "admin");
        assertThat(user.hasAnyRole(List.of("Admin", "superuser"))).isTrue();
        assertThat(user.hasAnyRole(List.of("superuser"))).isFalse();
    }

    @Test
    void blankUsernameIsRejected() {
        assertThatThrownBy(() -> AuthenticatedUser.of(" ", List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
