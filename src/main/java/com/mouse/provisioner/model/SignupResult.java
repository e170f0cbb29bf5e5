package com.mouse.provisioner.model;

import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.enums.SignupStage;

import java.util.List;

public record SignupResult(SignupState finalState, List<SignupStage> history, SessionArtifact artifact) {

    public SignupResult {
        history = List.copyOf(history);
    }

    public boolean isSuccess() {
        return finalState.isSuccess();
    }

    public FailureReason failureReason() {
        return finalState.reason();
    }
}
