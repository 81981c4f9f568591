package com.yuzhi.sqlguard.platform.service.security;

public enum CoverageStatus {
    /** At least one filter column exists on the table. */
    PROTECTED,
    /** No filter column matches; non-privileged users read it unfiltered unless unmapped tables are denied. */
    UNMAPPED,
    /** Listed in the excluded tables. */
    EXCLUDED,
}
