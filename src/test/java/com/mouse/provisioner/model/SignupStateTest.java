package com.mouse.provisioner.model;

import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.enums.SignupStage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignupStateTest {

    @Test
    void advancesAlongTheHappyPath() {
        SignupState state = SignupState.started()
                .advanceTo(SignupStage.FORM_SUBMITTED)
                .advanceTo(SignupStage.AWAITING_CODE)
                .advanceTo(SignupStage.CODE_VERIFIED)
                .advanceTo(SignupStage.SESSION_ESTABLISHED);

        assertThat(state.isTerminal()).isTrue();
        assertThat(state.isSuccess()).isTrue();
        assertThat(state.reason()).isNull();
    }

    @Test
    void skippingAStageIsIllegal() {
        assertThatThrownBy(() -> SignupState.started().advanceTo(SignupStage.CODE_VERIFIED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("STARTED -> CODE_VERIFIED");
    }

    @Test
    void terminalStatesHaveNoSuccessors() {
        SignupState failed = SignupState.started().fail(FailureReason.FORM_REJECTED, "taken");

        assertThat(failed.isTerminal()).isTrue();
        assertThat(failed.isSuccess()).isFalse();
        assertThatThrownBy(() -> failed.fail(FailureReason.PROXY_ERROR, "again"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedNeedsAReasonAndOnlyFailedCarriesOne() {
        assertThatThrownBy(() -> new SignupState(SignupStage.FAILED, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SignupState(SignupStage.STARTED, FailureReason.OTP_TIMEOUT, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SignupState.started().advanceTo(SignupStage.FAILED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void retryTaskStartsOverWithoutProxy() {
        ProvisioningTask first = ProvisioningTask.first(new Identity("a@b.c", "pw"))
                .withProxy(new Proxy("h", 1, null, null))
                .withStatus(SignupStage.FAILED);

        ProvisioningTask retry = first.nextAttempt();

        assertThat(retry.getAttempt()).isEqualTo(2);
        assertThat(retry.getProxy()).isNull();
        assertThat(retry.getStatus()).isEqualTo(SignupStage.STARTED);
        assertThat(first.getAttempt()).isEqualTo(1);
        assertThat(first.getProxy()).isNotNull();
    }
}
