package com.yuzhi.sqlguard.common.security;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Identity of the caller as handed over by the authentication layer.
 * Role names are kept lower-cased so membership checks are case-insensitive.
 */
public record AuthenticatedUser(String username, Set<String> roles) {

    public AuthenticatedUser {
        if (StringUtils.isBlank(username)) {
            throw new IllegalArgumentException("username must not be blank");
        }
        username = username.trim();
        roles = normalizeRoles(roles);
    }

    public static AuthenticatedUser of(String username, Collection<String> roles) {
        return new AuthenticatedUser(username, roles == null ? Set.of() : new LinkedHashSet<>(roles));
    }

    public boolean hasAnyRole(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return false;
        }
        for (String candidate : candidates) {
            if (candidate != null && roles.contains(candidate.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> normalizeRoles(Set<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String role : raw) {
            if (StringUtils.isNotBlank(role)) {
                normalized.add(role.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(normalized);
    }
}
