package com.mouse.provisioner.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Page locations of the signup target. Nothing about a concrete site is hardcoded,
 * every selector comes from configuration.
 */
@Component
@Data
public class SignupFlowConfig {

    @Value("${signup.registration-url:}")
    private String registrationUrl;

    @Value("${signup.home-url:}")
    private String homeUrl;

    @Value("${signup.browser.headless:true}")
    private boolean headless;

    @Value("${signup.browser.timeout-ms:30000}")
    private int timeoutMs;

    // ==================== REGISTRATION FORM ====================

    @Value("${signup.selector.name:input[name='customerName']}")
    private String nameSelector;

    @Value("${signup.selector.email:input[type='email']}")
    private String emailSelector;

    @Value("${signup.selector.password:input[type='password']}")
    private String passwordSelector;

    @Value("${signup.selector.submit:button[type='submit']}")
    private String submitSelector;

    // ==================== PHONE FORM ====================

    @Value("${signup.selector.phone:input[name='phoneNumber']}")
    private String phoneSelector;

    @Value("${signup.selector.phone-submit:button[type='submit']}")
    private String phoneSubmitSelector;

    // ==================== VERIFICATION FORM ====================

    @Value("${signup.selector.code:input[name='code']}")
    private String codeSelector;

    @Value("${signup.selector.code-submit:button[type='submit']}")
    private String codeSubmitSelector;

    // ==================== PAGE STATE INDICATORS ====================

    @Value("${signup.indicator.verification:input[name='code']}")
    private String verificationIndicator;

    @Value("${signup.indicator.authenticated:[data-account-menu]}")
    private String authenticatedIndicator;

    @Value("${signup.indicator.rejected:[role=alert]}")
    private String rejectedIndicator;
}
