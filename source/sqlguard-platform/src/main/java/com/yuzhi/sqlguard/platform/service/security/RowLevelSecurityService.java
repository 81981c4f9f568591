package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.common.security.AuthenticatedUser;
import com.yuzhi.sqlguard.platform.service.catalog.SchemaCatalogAccessor;
import com.yuzhi.sqlguard.platform.service.sql.RewriteResult;
import com.yuzhi.sqlguard.platform.service.sql.SqlStatements;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the row-level security engine.
 * <p>
 * {@link #rewriteForUser} either returns the statement untouched (bypass) or the statement narrowed to the
 * caller's own rows together with the bind values it needs. Every failure is raised as a
 * {@link SecurityGuardException}; there is no path that returns the unfiltered statement for a filtered user.
 */
public class RowLevelSecurityService {

    private static final Logger log = LoggerFactory.getLogger(RowLevelSecurityService.class);

    private static final int LOG_SQL_LIMIT = 200;

    private final AccessPolicyGate gate;
    private final FilterColumnRegistry filterColumns;
    private final UserFilterValueResolver userValues;
    private final TableColumnRegistry tableColumns;
    private final RlsPredicateInjector injector;
    private final SchemaCatalogAccessor catalog;

    public RowLevelSecurityService(
        AccessPolicyGate gate,
        FilterColumnRegistry filterColumns,
        UserFilterValueResolver userValues,
        TableColumnRegistry tableColumns,
        RlsPredicateInjector injector,
        SchemaCatalogAccessor catalog
    ) {
        this.gate = gate;
        this.filterColumns = filterColumns;
        this.userValues = userValues;
        this.tableColumns = tableColumns;
        this.injector = injector;
        this.catalog = catalog;
    }

    public RewriteOutcome rewriteForUser(AuthenticatedUser user, String sql) {
        Objects.requireNonNull(user, "user");
        if (StringUtils.isBlank(sql)) {
            throw new IllegalArgumentException("sql must not be blank");
        }
        String statement = SqlStatements.stripTrailingSemicolons(sql);
        AccessDecision decision = gate.decide(user, statement, SqlStatements.isSelect(statement));
        if (decision.isBypass()) {
            log.debug("RLS bypassed for {} ({})", user.username(), decision.bypassReason());
            return RewriteOutcome.bypassed(sql, decision.bypassReason());
        }

        Map<String, Object> values = userValues.getUserFilterValues(user.username());
        if (values.values().stream().allMatch(Objects::isNull)) {
            log.warn("User {} has no filter values; referenced tables are not narrowed", user.username());
        }
        RewriteResult result = injector.injectFilters(statement, decision.targetTables(), values);
        if (result.isRewritten()) {
            log.info(
                "Applied RLS for {} on {} table(s): {}",
                user.username(),
                decision.targetTables().size(),
                StringUtils.abbreviate(result.sql(), LOG_SQL_LIMIT)
            );
        }
        return RewriteOutcome.filtered(result);
    }

    /** Drops every cached filter column, user value and table column set. */
    public void clearCache() {
        filterColumns.invalidate();
        userValues.invalidateAll();
        tableColumns.invalidateAll();
        log.info("Cleared all RLS caches");
    }

    public void clearUserCache(String username) {
        userValues.invalidateUser(username);
    }

    /**
     * Re-reads the control table in one pass and refreshes every user's cached values.
     *
     * @return number of users loaded
     */
    public int reloadUserCache() {
        filterColumns.invalidate();
        return userValues.reloadAll();
    }

    /**
     * For every visible table, whether it is protected by a filter column, excluded, or read unfiltered by
     * non-privileged users.
     */
    public List<TableCoverage> describeCoverage() {
        Set<String> filters = filterColumns.getFilterColumns();
        List<TableCoverage> coverage = new ArrayList<>();
        for (String table : catalog.listTables()) {
            if (gate.isExcluded(null, table)) {
                coverage.add(new TableCoverage(table, CoverageStatus.EXCLUDED, List.of()));
                continue;
            }
            List<String> matching = new ArrayList<>();
            for (String column : tableColumns.getColumns(table)) {
                if (filters.contains(column)) {
                    matching.add(column);
                }
            }
            CoverageStatus status = matching.isEmpty() ? CoverageStatus.UNMAPPED : CoverageStatus.PROTECTED;
            coverage.add(new TableCoverage(table, status, matching));
        }
        return coverage;
    }

    public boolean isPrivileged(AuthenticatedUser user) {
        return gate.isPrivileged(user);
    }
}
