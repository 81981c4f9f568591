package com.yuzhi.sqlguard.platform.service.security;

/**
 * What to do when a statement cannot be fully filtered.
 */
public enum GuardPolicy {
    /** Let the unfiltered part through and log a warning. */
    ALLOW,
    /** Refuse the statement. */
    DENY,
}
