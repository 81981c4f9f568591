package com.yuzhi.sqlguard.platform.service.security;

/**
 * Raised when a statement cannot be executed safely for the current user. Callers must refuse the
 * query; falling back to the unfiltered statement is never an option.
 */
public class SecurityGuardException extends RuntimeException {

    private final String code;

    public SecurityGuardException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SecurityGuardException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** Machine-readable error code, see {@code PolicyErrorCodes}. */
    public String getCode() {
        return code;
    }
}
