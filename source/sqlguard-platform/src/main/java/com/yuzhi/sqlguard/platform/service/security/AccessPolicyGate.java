package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.common.security.AuthenticatedUser;
import com.yuzhi.sqlguard.common.sql.SqlIdentifiers;
import com.yuzhi.sqlguard.platform.service.sql.SqlTableReferenceExtractor;
import com.yuzhi.sqlguard.platform.service.sql.TableReference;
import com.yuzhi.sqlguard.platform.service.sql.UnparsableStatementException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless classification of one (user, statement) pair. Checks run in a fixed order: global switch,
 * privileged roles, statement type, then the tables to filter minus the excluded ones.
 */
public class AccessPolicyGate {

    private static final Logger log = LoggerFactory.getLogger(AccessPolicyGate.class);

    private final boolean enabled;
    private final Set<String> privilegedRoles;
    private final Set<String> excludedTables;
    private final SqlTableReferenceExtractor extractor;

    public AccessPolicyGate(
        boolean enabled,
        Collection<String> privilegedRoles,
        Collection<String> excludedTables,
        SqlTableReferenceExtractor extractor
    ) {
        this.enabled = enabled;
        Set<String> roles = new LinkedHashSet<>();
        for (String role : privilegedRoles) {
            if (role != null && !role.isBlank()) {
                roles.add(role.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.privilegedRoles = Set.copyOf(roles);
        Set<String> tables = new LinkedHashSet<>();
        for (String table : excludedTables) {
            String normalized = SqlIdentifiers.normalize(table);
            if (normalized != null) {
                tables.add(normalized);
            }
        }
        this.excludedTables = Set.copyOf(tables);
        this.extractor = extractor;
    }

    public AccessDecision decide(AuthenticatedUser user, String sql, boolean statementIsSelect) {
        if (!enabled) {
            return AccessDecision.bypass(BypassReason.DISABLED);
        }
        if (isPrivileged(user)) {
            return AccessDecision.bypass(BypassReason.PRIVILEGED);
        }
        if (!statementIsSelect) {
            return AccessDecision.bypass(BypassReason.NOT_SELECT);
        }
        List<TableReference> tables;
        try {
            tables = extractor.extractTables(sql);
        } catch (UnparsableStatementException ex) {
            if (ex.getReason() != UnparsableStatementException.Reason.NO_FROM_CLAUSE) {
                throw ex;
            }
            log.debug("Statement reads no table; nothing to filter");
            tables = List.of();
        }
        List<TableReference> targets = new ArrayList<>(tables.size());
        for (TableReference table : tables) {
            if (isExcluded(table)) {
                log.debug("Table {} is excluded from RLS", table.name());
            } else {
                targets.add(table);
            }
        }
        return AccessDecision.filter(targets);
    }

    public boolean isPrivileged(AuthenticatedUser user) {
        return user.hasAnyRole(privilegedRoles);
    }

    public boolean isExcluded(TableReference table) {
        return isExcluded(table.normalizedSchema(), table.normalizedName());
    }

    public boolean isExcluded(String schema, String table) {
        String name = SqlIdentifiers.normalize(table);
        if (excludedTables.contains(name)) {
            return true;
        }
        String owner = SqlIdentifiers.normalize(schema);
        return owner != null && excludedTables.contains(owner + "." + name);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
