package com.yuzhi.sqlguard.platform.service.query;

import com.yuzhi.sqlguard.common.security.AuthenticatedUser;
import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;
import com.yuzhi.sqlguard.platform.service.security.RewriteOutcome;
import com.yuzhi.sqlguard.platform.service.security.RowLevelSecurityService;
import com.yuzhi.sqlguard.platform.service.security.SecurityGuardException;
import com.yuzhi.sqlguard.platform.service.sql.SqlStatements;
import com.yuzhi.sqlguard.platform.service.sql.UnparsableStatementException;
import com.yuzhi.sqlguard.platform.service.sql.UnparsableStatementException.Reason;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Rewrites a statement for the caller and runs it. Only a single read-only statement is accepted, for every user.
 */
@Service
public class SecureQueryService {

    private final RowLevelSecurityService rowLevelSecurity;
    private final QueryGateway queryGateway;

    public SecureQueryService(RowLevelSecurityService rowLevelSecurity, QueryGateway queryGateway) {
        this.rowLevelSecurity = rowLevelSecurity;
        this.queryGateway = queryGateway;
    }

    public Map<String, Object> execute(AuthenticatedUser user, String sql) {
        if (StringUtils.isBlank(sql)) {
            throw new IllegalArgumentException("sql must not be blank");
        }
        String statement = SqlStatements.stripTrailingSemicolons(sql);
        if (SqlStatements.hasMultipleStatements(statement)) {
            throw new UnparsableStatementException(Reason.MALFORMED, "Malformed SQL: more than one statement");
        }
        if (!SqlStatements.isSelect(statement)) {
            throw new SecurityGuardException(PolicyErrorCodes.WRITE_BLOCKED, "Only read-only SELECT queries are allowed");
        }
        RewriteOutcome outcome = rowLevelSecurity.rewriteForUser(user, statement);
        Map<String, Object> result = new LinkedHashMap<>(queryGateway.execute(outcome.sql(), outcome.bindParams()));
        result.put("rlsApplied", outcome.isRlsApplied());
        result.put("bypassReason", outcome.isBypass() ? outcome.bypassReason().name() : null);
        return result;
    }
}
