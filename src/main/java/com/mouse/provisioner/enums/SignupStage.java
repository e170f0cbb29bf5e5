package com.mouse.provisioner.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of a single signup attempt. Each non-terminal stage has exactly one successor
 * and may also fall through to {@link #FAILED}.
 */
public enum SignupStage {

    STARTED,
    FORM_SUBMITTED,
    AWAITING_CODE,
    CODE_VERIFIED,
    SESSION_ESTABLISHED,
    FAILED;

    public boolean isTerminal() {
        return this == SESSION_ESTABLISHED || this == FAILED;
    }

    public Set<SignupStage> successors() {
        return switch (this) {
            case STARTED -> EnumSet.of(FORM_SUBMITTED, FAILED);
            case FORM_SUBMITTED -> EnumSet.of(AWAITING_CODE, FAILED);
            case AWAITING_CODE -> EnumSet.of(CODE_VERIFIED, FAILED);
            case CODE_VERIFIED -> EnumSet.of(SESSION_ESTABLISHED, FAILED);
            case SESSION_ESTABLISHED, FAILED -> EnumSet.noneOf(SignupStage.class);
        };
    }
}
