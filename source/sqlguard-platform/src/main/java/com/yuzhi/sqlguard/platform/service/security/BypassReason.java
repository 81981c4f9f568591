package com.yuzhi.sqlguard.platform.service.security;

public enum BypassReason {
    DISABLED,
    PRIVILEGED,
    NOT_SELECT,
}
