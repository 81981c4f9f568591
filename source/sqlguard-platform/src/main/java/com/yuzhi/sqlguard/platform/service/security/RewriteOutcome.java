package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.platform.service.sql.RewriteResult;
import java.util.Map;

/**
 * What {@link RowLevelSecurityService#rewriteForUser} hands to the executor. On bypass the result carries the
 * original statement untouched and no bind parameters.
 */
public record RewriteOutcome(RewriteResult result, BypassReason bypassReason) {

    public static RewriteOutcome bypassed(String sql, BypassReason reason) {
        return new RewriteOutcome(RewriteResult.unchanged(sql), reason);
    }

    public static RewriteOutcome filtered(RewriteResult result) {
        return new RewriteOutcome(result, null);
    }

    public boolean isBypass() {
        return bypassReason != null;
    }

    /** True when at least one predicate was added. */
    public boolean isRlsApplied() {
        return !isBypass() && result.isRewritten();
    }

    public String sql() {
        return result.sql();
    }

    public Map<String, Object> bindParams() {
        return result.bindParams();
    }
}
