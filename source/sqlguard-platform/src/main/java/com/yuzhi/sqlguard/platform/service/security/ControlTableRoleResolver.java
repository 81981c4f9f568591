package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.common.security.AuthenticatedUser;
import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import com.yuzhi.sqlguard.platform.service.catalog.SchemaCatalogAccessor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives role names from the control table's flag columns ({@code IS_ADMIN = 1} grants {@code admin}, ...).
 * A user with no flag set gets the default role; a user without a row is denied.
 */
public class ControlTableRoleResolver {

    private static final Logger log = LoggerFactory.getLogger(ControlTableRoleResolver.class);

    private final SchemaCatalogAccessor catalog;
    private final Map<String, String> roleFlags;
    private final String defaultRole;

    /**
     * @param roleFlags flag column to role name, evaluated in iteration order
     */
    public ControlTableRoleResolver(SchemaCatalogAccessor catalog, Map<String, String> roleFlags, String defaultRole) {
        this.catalog = catalog;
        Map<String, String> flags = new LinkedHashMap<>();
        roleFlags.forEach((column, role) -> flags.put(SqlIdentifiers.normalize(column), role.trim().toLowerCase(Locale.ROOT)));
        this.roleFlags = Collections.unmodifiableMap(flags);
        this.defaultRole = defaultRole.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws UserNotFoundException when the control table has no row for the username
     */
    public Set<String> resolveRoles(String username) {
        Map<String, Object> row = catalog.findControlRow(username).orElseThrow(() -> new UserNotFoundException(username));
        Set<String> roles = new LinkedHashSet<>();
        roleFlags.forEach((column, role) -> {
            if (isSet(row.get(column))) {
                roles.add(role);
            }
        });
        if (roles.isEmpty()) {
            roles.add(defaultRole);
        }
        log.debug("Resolved roles {} for {}", roles, username);
        return Collections.unmodifiableSet(roles);
    }

    public AuthenticatedUser resolveUser(String username) {
        return AuthenticatedUser.of(username, resolveRoles(username));
    }

    static boolean isSet(Object flag) {
        if (flag == null) {
            return false;
        }
        if (flag instanceof Boolean b) {
            return b;
        }
        if (flag instanceof Number n) {
            return n.intValue() == 1;
        }
        String text = flag.toString().trim();
        return "1".equals(text) || "true".equalsIgnoreCase(text) || "Y".equalsIgnoreCase(text);
    }
}
