package com.mouse.provisioner.model;

import com.mouse.provisioner.enums.SignupStage;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One attempt to provision one identity. Immutable: leasing a proxy, changing status or
 * retrying all produce a new value, so earlier attempts stay intact.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class ProvisioningTask {

    private final Identity identity;
    private final Proxy proxy;
    private final int attempt;
    @Builder.Default
    private final SignupStage status = SignupStage.STARTED;

    public static ProvisioningTask first(Identity identity) {
        return ProvisioningTask.builder()
                .identity(identity)
                .attempt(1)
                .build();
    }

    public ProvisioningTask withProxy(Proxy proxy) {
        return toBuilder().proxy(proxy).build();
    }

    public ProvisioningTask withStatus(SignupStage status) {
        return toBuilder().status(status).build();
    }

    public ProvisioningTask nextAttempt() {
        return toBuilder()
                .proxy(null)
                .attempt(attempt + 1)
                .status(SignupStage.STARTED)
                .build();
    }
}
