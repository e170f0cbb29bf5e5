package com.mouse.provisioner.model;

public record SubmitOutcome(boolean accepted, String detail) {
    public static SubmitOutcome ok() {
        return new SubmitOutcome(true, "OK");
    }

    public static SubmitOutcome rejected(String detail) {
        return new SubmitOutcome(false, detail);
    }
}
