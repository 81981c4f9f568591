package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;

public class NestedQueryDeniedException extends SecurityGuardException {

    public NestedQueryDeniedException() {
        super(PolicyErrorCodes.NESTED_QUERY_DENIED, "Nested queries cannot be filtered and are denied for this user");
    }
}
