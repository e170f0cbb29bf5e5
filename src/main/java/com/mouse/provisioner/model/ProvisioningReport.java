package com.mouse.provisioner.model;

import com.mouse.provisioner.enums.FailureReason;

import java.time.Duration;
import java.util.Map;

/**
 * Per-run summary.
 *
 * @param attemptFailures     reason distribution over every failed attempt, retried or not
 * @param permanentFailures   email → reason of the last attempt, for identities that gave up
 */
public record ProvisioningReport(int succeeded,
                                 int permanentlyFailed,
                                 int inProgressAtShutdown,
                                 Map<FailureReason, Integer> attemptFailures,
                                 Map<String, FailureReason> permanentFailures,
                                 Duration elapsed) {

    public ProvisioningReport {
        attemptFailures = Map.copyOf(attemptFailures);
        permanentFailures = Map.copyOf(permanentFailures);
    }

    @Override
    public String toString() {
        return String.format("ProvisioningReport[succeeded=%d, permanentlyFailed=%d, inProgress=%d, reasons=%s, elapsed=%ds]",
                succeeded, permanentlyFailed, inProgressAtShutdown, attemptFailures, elapsed.toSeconds());
    }
}
