package com.mouse.provisioner.interfaces;

import com.mouse.provisioner.entity.Account;
import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.model.Identity;
import com.mouse.provisioner.model.ProvisioningTask;

/**
 * Callbacks fired by the orchestrator from worker threads. Implementations must not block for long.
 */
public interface ProvisioningListener {

    default void onAttemptFailed(ProvisioningTask task, FailureReason reason) {
    }

    default void onAccountCreated(Account account) {
    }

    default void onPermanentFailure(Identity identity, FailureReason reason, int attempts) {
    }
}
