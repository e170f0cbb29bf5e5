package com.mouse.provisioner.enums;

public enum FailureReason {

    /**
     * Browser could not reach the target through the leased proxy
     */
    PROXY_ERROR,

    /**
     * Registration data was refused
     */
    FORM_REJECTED,

    /**
     * Neither OTP channel delivered a code before the deadline
     */
    OTP_TIMEOUT,

    /**
     * A resolved code was refused
     */
    OTP_REJECTED,

    /**
     * Page ended up in a state the flow does not know
     */
    UNEXPECTED_RESPONSE,

    /**
     * Session was established but the account could not be stored
     */
    PERSISTENCE_ERROR;

    public boolean isRetryable() {
        return this != PERSISTENCE_ERROR;
    }
}
