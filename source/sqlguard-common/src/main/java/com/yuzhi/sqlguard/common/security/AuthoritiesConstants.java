package com.yuzhi.sqlguard.common.security;

/**
 * Role names derived from the control table flags.
 */
public final class AuthoritiesConstants {

    public static final String ADMIN = "admin";

    public static final String SUPERUSER = "superuser";

    public static final String USER = "user";

    private AuthoritiesConstants() {}
}
