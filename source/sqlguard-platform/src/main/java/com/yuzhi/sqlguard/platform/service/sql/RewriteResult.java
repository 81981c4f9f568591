package com.yuzhi.sqlguard.platform.service.sql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rewritten statement plus the values for the bind parameters it introduced, in parameter order.
 */
public record RewriteResult(String sql, Map<String, Object> bindParams) {

    public RewriteResult {
        bindParams = bindParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bindParams));
    }

    public static RewriteResult unchanged(String sql) {
        return new RewriteResult(sql, Map.of());
    }

    public boolean isRewritten() {
        return !bindParams.isEmpty();
    }
}
