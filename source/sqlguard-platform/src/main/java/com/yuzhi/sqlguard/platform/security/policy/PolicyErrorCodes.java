package com.yuzhi.sqlguard.platform.security.policy;

public final class PolicyErrorCodes {
    private PolicyErrorCodes() {}

    public static final String CATALOG_UNAVAILABLE = "sqlguard-sec-0001";
    public static final String USER_NOT_FOUND = "sqlguard-sec-0002";
    public static final String INJECTION_POINT_NOT_FOUND = "sqlguard-sec-0003";
    public static final String UNPARSABLE_STATEMENT = "sqlguard-sec-0004";
    public static final String UNMAPPED_TABLE_DENIED = "sqlguard-sec-0005";
    public static final String NESTED_QUERY_DENIED = "sqlguard-sec-0006";
    public static final String WRITE_BLOCKED = "sqlguard-sec-0007";
    public static final String RBAC_DENY = "sqlguard-sec-0008";
    public static final String NOT_AUTHENTICATED = "sqlguard-sec-0009";
}
