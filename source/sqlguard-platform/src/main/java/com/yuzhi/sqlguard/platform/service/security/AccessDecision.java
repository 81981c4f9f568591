package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.platform.service.sql.TableReference;
import java.util.List;

/**
 * Outcome of the access policy gate: either the statement bypasses filtering for a reason, or the listed tables
 * must be filtered (the list may be empty, e.g. {@code SELECT 1}).
 */
public record AccessDecision(BypassReason bypassReason, List<TableReference> targetTables) {

    public AccessDecision {
        targetTables = targetTables == null ? List.of() : List.copyOf(targetTables);
    }

    public static AccessDecision bypass(BypassReason reason) {
        return new AccessDecision(reason, List.of());
    }

    public static AccessDecision filter(List<TableReference> tables) {
        return new AccessDecision(null, tables);
    }

    public boolean isBypass() {
        return bypassReason != null;
    }
}
