package com.mouse.provisioner.model;

import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.enums.SignupStage;

import java.util.Objects;

/**
 * Current position of a signup attempt: a stage, plus the reason when the stage is FAILED.
 */
public record SignupState(SignupStage stage, FailureReason reason, String detail) {

    public SignupState {
        Objects.requireNonNull(stage, "stage is required");
        if (stage == SignupStage.FAILED && reason == null) {
            throw new IllegalArgumentException("FAILED state needs a reason");
        }
        if (stage != SignupStage.FAILED && reason != null) {
            throw new IllegalArgumentException("only FAILED carries a reason");
        }
    }

    public static SignupState started() {
        return new SignupState(SignupStage.STARTED, null, null);
    }

    public SignupState advanceTo(SignupStage next) {
        if (next == SignupStage.FAILED) {
            throw new IllegalArgumentException("use fail(reason, detail) to enter FAILED");
        }
        checkTransition(next);
        return new SignupState(next, null, null);
    }

    public SignupState fail(FailureReason reason, String detail) {
        checkTransition(SignupStage.FAILED);
        return new SignupState(SignupStage.FAILED, reason, detail);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }

    public boolean isSuccess() {
        return stage == SignupStage.SESSION_ESTABLISHED;
    }

    private void checkTransition(SignupStage next) {
        if (!stage.successors().contains(next)) {
            throw new IllegalStateException("Illegal signup transition " + stage + " -> " + next);
        }
    }
}
