package com.yuzhi.sqlguard.platform.service.catalog;

import com.yuzhi.sqlguard.platform.security.policy.PolicyErrorCodes;
import com.yuzhi.sqlguard.platform.service.security.SecurityGuardException;

/**
 * Metadata or control-table lookup failed. Never retried within a request and never downgraded to
 * unfiltered execution.
 */
public class CatalogUnavailableException extends SecurityGuardException {

    public CatalogUnavailableException(String message) {
        super(PolicyErrorCodes.CATALOG_UNAVAILABLE, message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(PolicyErrorCodes.CATALOG_UNAVAILABLE, message, cause);
    }
}
