package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;

public class UnmappedTableDeniedException extends SecurityGuardException {

    private final String table;

    public UnmappedTableDeniedException(String table) {
        super(
            PolicyErrorCodes.UNMAPPED_TABLE_DENIED,
            "Table '" + table + "' has no filter column matching the current user and unmapped tables are denied"
        );
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
