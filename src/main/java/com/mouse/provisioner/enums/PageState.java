package com.mouse.provisioner.enums;

/**
 * What the rendered page currently shows, as far as the signup flow cares.
 */
public enum PageState {
    REGISTRATION_FORM,
    VERIFICATION_REQUIRED,
    AUTHENTICATED,
    REJECTED,
    UNKNOWN
}
