package com.yuzhi.sqlguard.platform.service.security;

import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;

public class UserNotFoundException extends SecurityGuardException {

    private final String username;

    public UserNotFoundException(String username) {
        super(PolicyErrorCodes.USER_NOT_FOUND, "User '" + username + "' not found in control table. Access denied.");
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
