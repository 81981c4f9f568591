package com.yuzhi.sqlguard.platform.service.sql;

import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;
import com.yuzhi.sqlguard.platform.service.security.SecurityGuardException;

public class UnparsableStatementException extends SecurityGuardException {

    public enum Reason {
        /** Statement reads no table at all, e.g. {@code SELECT 1}. */
        NO_FROM_CLAUSE,
        /** Unterminated literal or comment, unbalanced parentheses. */
        MALFORMED,
    }

    private final Reason reason;

    public UnparsableStatementException(Reason reason, String message) {
        super(PolicyErrorCodes.UNPARSABLE_STATEMENT, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
