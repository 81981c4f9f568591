package com.yuzhi.sqlguard.platform.web.rest;

/**
 * Envelope status. DENIED covers both an unknown caller and a missing administrator role; the row-level
 * security codes travel separately in {@link ApiResponse#getCode()}.
 */
public enum ResultStatus {
    SUCCESS(200),
    ERROR(-1),
    DENIED(403);

    private final int code;

    ResultStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
