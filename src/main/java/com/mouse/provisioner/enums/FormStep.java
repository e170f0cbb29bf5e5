package com.mouse.provisioner.enums;

public enum FormStep {
    REGISTRATION,

    /**
     * Phone number the verification text is sent to
     */
    PHONE,

    VERIFICATION
}
