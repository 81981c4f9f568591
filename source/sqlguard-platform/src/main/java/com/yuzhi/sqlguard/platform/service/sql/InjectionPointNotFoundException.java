package com.yuzhi.sqlguard.platform.service.sql;

import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;
import com.yuzhi.sqlguard.platform.service.security.SecurityGuardException;

public class InjectionPointNotFoundException extends SecurityGuardException {

    public InjectionPointNotFoundException(String message) {
        super(PolicyErrorCodes.INJECTION_POINT_NOT_FOUND, "Unable to locate a safe filter injection point: " + message);
    }
}
