package com.mouse.provisioner.service;

import com.mouse.provisioner.enums.FailureReason;
import com.mouse.provisioner.enums.FormStep;
import com.mouse.provisioner.enums.PageState;
import com.mouse.provisioner.enums.SignupStage;
import com.mouse.provisioner.exception.BrowserSessionException;
import com.mouse.provisioner.interfaces.BrowserEngine;
import com.mouse.provisioner.interfaces.BrowserSession;
import com.mouse.provisioner.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives one identity through registration and verification, once.
 *
 * <p>Each stage handler inspects the browser and returns the next {@link SignupState}; the
 * driver loops until a terminal stage. Failures end the attempt, retrying is the
 * orchestrator's call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignupDriver {

    public static final String FIELD_NAME = "name";
    public static final String FIELD_EMAIL = "email";
    public static final String FIELD_PASSWORD = "password";
    public static final String FIELD_PHONE = "phone";
    public static final String FIELD_CODE = "code";

    private final BrowserEngine browserEngine;
    private final OtpResolver otpResolver;

    public SignupResult run(ProvisioningTask task) {
        Objects.requireNonNull(task.getProxy(), "task needs a leased proxy");
        Identity identity = task.getIdentity();
        List<SignupStage> history = new ArrayList<>();
        SignupState state = SignupState.started();
        history.add(state.stage());

        log.info("Signup started | Email: {} | Proxy: {} | Attempt: {}",
                identity.email(), task.getProxy().label(), task.getAttempt());

        Attempt attempt = null;
        try (BrowserSession session = browserEngine.open(task.getProxy())) {
            attempt = new Attempt(session, identity);
            while (!state.isTerminal()) {
                state = step(state, attempt);
                history.add(state.stage());
                log.debug("Signup transition | Email: {} | Stage: {}", identity.email(), state.stage());
            }
        } catch (BrowserSessionException e) {
            log.warn("Browser failure | Email: {} | Proxy: {} | Stage: {} | Message: {}",
                    identity.email(), task.getProxy().label(), state.stage(), e.getMessage());
            if (!state.isTerminal()) {
                state = state.fail(FailureReason.PROXY_ERROR, e.getMessage());
                history.add(state.stage());
            }
        }

        if (state.isSuccess()) {
            log.info("Signup completed | Email: {} | Proxy: {}", identity.email(), task.getProxy().label());
        } else {
            log.warn("Signup failed | Email: {} | Reason: {} | Detail: {}",
                    identity.email(), state.reason(), state.detail());
        }
        return new SignupResult(state, history, state.isSuccess() ? attempt.artifact : null);
    }

    private SignupState step(SignupState state, Attempt attempt) {
        return switch (state.stage()) {
            case STARTED -> submitRegistration(state, attempt.session, attempt.identity);
            case FORM_SUBMITTED -> awaitVerificationPrompt(state, attempt.session);
            case AWAITING_CODE -> submitCode(state, attempt.session, attempt.identity);
            case CODE_VERIFIED -> establishSession(state, attempt);
            case SESSION_ESTABLISHED, FAILED -> throw new IllegalStateException("terminal stage " + state.stage());
        };
    }

    private SignupState submitRegistration(SignupState state, BrowserSession session, Identity identity) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_NAME, displayName(identity.email()));
        fields.put(FIELD_EMAIL, identity.email());
        fields.put(FIELD_PASSWORD, identity.password());

        SubmitOutcome outcome = browserEngine.submit(session, FormStep.REGISTRATION, fields);
        return outcome.accepted()
                ? state.advanceTo(SignupStage.FORM_SUBMITTED)
                : state.fail(FailureReason.FORM_REJECTED, outcome.detail());
    }

    private SignupState awaitVerificationPrompt(SignupState state, BrowserSession session) {
        PageState page = browserEngine.readState(session);
        return switch (page) {
            case VERIFICATION_REQUIRED -> state.advanceTo(SignupStage.AWAITING_CODE);
            case REJECTED -> state.fail(FailureReason.FORM_REJECTED, "registration refused after submit");
            default -> state.fail(FailureReason.UNEXPECTED_RESPONSE, "expected verification step, page was " + page);
        };
    }

    private SignupState submitCode(SignupState state, BrowserSession session, Identity identity) {
        SmsOrder smsOrder = otpResolver.orderNumber(identity)
                .filter(order -> submitPhone(session, identity, order))
                .orElse(null);
        OtpResult otp = otpResolver.resolve(identity, smsOrder);
        if (otp.isTimeout()) {
            return state.fail(FailureReason.OTP_TIMEOUT, "no code from mailbox or sms");
        }
        SubmitOutcome outcome = browserEngine.submit(session, FormStep.VERIFICATION, Map.of(FIELD_CODE, otp.code()));
        return outcome.accepted()
                ? state.advanceTo(SignupStage.CODE_VERIFIED)
                : state.fail(FailureReason.OTP_REJECTED, outcome.detail());
    }

    /** A refused number only takes SMS out of the race; the mailbox can still deliver. */
    private boolean submitPhone(BrowserSession session, Identity identity, SmsOrder order) {
        SubmitOutcome outcome = browserEngine.submit(session, FormStep.PHONE, Map.of(FIELD_PHONE, order.phoneNumber()));
        if (!outcome.accepted()) {
            log.warn("Phone number refused | Email: {} | OrderId: {} | Detail: {}",
                    identity.email(), order.orderId(), outcome.detail());
        }
        return outcome.accepted();
    }

    private SignupState establishSession(SignupState state, Attempt attempt) {
        PageState page = browserEngine.readState(attempt.session);
        if (page != PageState.AUTHENTICATED) {
            return state.fail(FailureReason.UNEXPECTED_RESPONSE, "expected authenticated page, page was " + page);
        }
        SessionArtifact captured = browserEngine.capture(attempt.session);
        if (captured == null || captured.isEmpty()) {
            return state.fail(FailureReason.UNEXPECTED_RESPONSE, "empty session artifact");
        }
        attempt.artifact = captured;
        return state.advanceTo(SignupStage.SESSION_ESTABLISHED);
    }

    private static final class Attempt {
        private final BrowserSession session;
        private final Identity identity;
        private SessionArtifact artifact;

        private Attempt(BrowserSession session, Identity identity) {
            this.session = session;
            this.identity = identity;
        }
    }

    /** "jane.doe42@example.com" -> "Jane Doe" */
    static String displayName(String email) {
        String local = email.contains("@") ? email.substring(0, email.indexOf('@')) : email;
        StringBuilder name = new StringBuilder();
        for (String part : local.replaceAll("[0-9]", "").split("[._+-]+")) {
            if (part.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1).toLowerCase());
        }
        return name.length() > 0 ? name.toString() : "Customer";
    }
}
