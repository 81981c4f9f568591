package com.yuzhi.sqlguard.platform.web.rest.dto;

import com.yuzhi.sqlguard.platform.service.security.RewriteOutcome;
import java.util.Map;

public record RewriteResponse(String sql, Map<String, Object> bindParams, boolean rlsApplied, String bypassReason) {
    public static RewriteResponse from(RewriteOutcome outcome) {
        return new RewriteResponse(
            outcome.sql(),
            outcome.bindParams(),
            outcome.isRlsApplied(),
            outcome.isBypass() ? outcome.bypassReason().name() : null
        );
    }
}
