package com.mouse.provisioner.enums;

public enum AccountStatus {

    /**
     * Session was captured and still authenticates
     */
    ACTIVE,

    /**
     * Stored session no longer authenticates
     */
    FAILED
}
