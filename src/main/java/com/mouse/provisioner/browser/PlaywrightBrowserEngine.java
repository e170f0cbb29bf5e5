package com.mouse.provisioner.browser;

import com.microsoft.playwright.*;
import com.microsoft.playwright.options.LoadState;
import com.mouse.provisioner.config.SignupFlowConfig;
import com.mouse.provisioner.enums.FormStep;
import com.mouse.provisioner.enums.PageState;
import com.mouse.provisioner.exception.BrowserSessionException;
import com.mouse.provisioner.interfaces.BrowserEngine;
import com.mouse.provisioner.interfaces.BrowserSession;
import com.mouse.provisioner.model.Proxy;
import com.mouse.provisioner.model.SessionArtifact;
import com.mouse.provisioner.model.SubmitOutcome;
import com.mouse.provisioner.service.SignupDriver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Chromium through Playwright, one context per session bound to the leased proxy.
 * Page locations come from {@link SignupFlowConfig}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightBrowserEngine implements BrowserEngine {

    private final SignupFlowConfig flow;

    @Override
    public BrowserSession open(Proxy proxy) {
        return launch(proxy, null, flow.getRegistrationUrl());
    }

    @Override
    public BrowserSession restore(SessionArtifact artifact, Proxy proxy) {
        return launch(proxy, artifact.storageState(), flow.getHomeUrl());
    }

    @Override
    public SubmitOutcome submit(BrowserSession session, FormStep step, Map<String, String> fields) {
        Page page = pageOf(session);
        try {
            switch (step) {
                case REGISTRATION -> {
                    fillIfPresent(page, flow.getNameSelector(), fields.get(SignupDriver.FIELD_NAME));
                    page.fill(flow.getEmailSelector(), fields.get(SignupDriver.FIELD_EMAIL));
                    page.fill(flow.getPasswordSelector(), fields.get(SignupDriver.FIELD_PASSWORD));
                    page.click(flow.getSubmitSelector());
                }
                case PHONE -> {
                    if (!isVisible(page, flow.getPhoneSelector())) {
                        return SubmitOutcome.rejected("no phone field on page");
                    }
                    page.fill(flow.getPhoneSelector(), fields.get(SignupDriver.FIELD_PHONE));
                    page.click(flow.getPhoneSubmitSelector());
                }
                case VERIFICATION -> {
                    page.fill(flow.getCodeSelector(), fields.get(SignupDriver.FIELD_CODE));
                    page.click(flow.getCodeSubmitSelector());
                }
            }
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);

            if (isVisible(page, flow.getRejectedIndicator())) {
                String message = page.locator(flow.getRejectedIndicator()).first().innerText().trim();
                log.info("Form rejected | Session: {} | Step: {} | Message: {}", session.id(), step, message);
                return SubmitOutcome.rejected(message);
            }
            return SubmitOutcome.ok();
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Submitting " + step + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public PageState readState(BrowserSession session) {
        Page page = pageOf(session);
        try {
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
            if (isVisible(page, flow.getAuthenticatedIndicator())) {
                return PageState.AUTHENTICATED;
            }
            if (isVisible(page, flow.getRejectedIndicator())) {
                return PageState.REJECTED;
            }
            // a phone prompt is the first screen of verification on targets that text the code
            if (isVisible(page, flow.getVerificationIndicator()) || isVisible(page, flow.getPhoneSelector())) {
                return PageState.VERIFICATION_REQUIRED;
            }
            if (isVisible(page, flow.getEmailSelector())) {
                return PageState.REGISTRATION_FORM;
            }
            log.debug("Unrecognised page | Session: {} | Url: {}", session.id(), page.url());
            return PageState.UNKNOWN;
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Reading page state failed: " + firstLine(e), e);
        }
    }

    @Override
    public SessionArtifact capture(BrowserSession session) {
        try {
            return new SessionArtifact(((PlaywrightBrowserSession) session).getContext().storageState());
        } catch (PlaywrightException e) {
            throw new BrowserSessionException("Capturing storage state failed: " + firstLine(e), e);
        }
    }

    private BrowserSession launch(Proxy proxy, String storageState, String url) {
        if (url == null || url.isBlank()) {
            throw new BrowserSessionException("Target url is not configured");
        }
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(flow.isHeadless()));

            Browser.NewContextOptions options = new Browser.NewContextOptions()
                    .setLocale("en-US");
            if (proxy != null) {
                com.microsoft.playwright.options.Proxy playwrightProxy =
                        new com.microsoft.playwright.options.Proxy(proxy.server());
                if (proxy.hasCredentials()) {
                    playwrightProxy.setUsername(proxy.username()).setPassword(proxy.password());
                }
                options.setProxy(playwrightProxy);
            }
            if (storageState != null) {
                options.setStorageState(storageState);
            }

            BrowserContext context = browser.newContext(options);
            context.setDefaultTimeout(flow.getTimeoutMs());
            Page page = context.newPage();
            page.navigate(url);

            PlaywrightBrowserSession session = new PlaywrightBrowserSession(playwright, browser, context, page);
            log.debug("Browser session opened | Session: {} | Proxy: {}", session.id(), proxy != null ? proxy.label() : "none");
            return session;
        } catch (PlaywrightException e) {
            playwright.close();
            throw new BrowserSessionException("Opening browser via " + (proxy != null ? proxy.label() : "direct")
                    + " failed: " + firstLine(e), e);
        }
    }

    private static Page pageOf(BrowserSession session) {
        if (!(session instanceof PlaywrightBrowserSession)) {
            throw new IllegalArgumentException("Session was not opened by this engine");
        }
        return ((PlaywrightBrowserSession) session).getPage();
    }

    private static void fillIfPresent(Page page, String selector, String value) {
        if (selector != null && !selector.isBlank() && value != null && page.locator(selector).count() > 0) {
            page.fill(selector, value);
        }
    }

    private static boolean isVisible(Page page, String selector) {
        return selector != null && !selector.isBlank() && page.locator(selector).first().isVisible();
    }

    private static String firstLine(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
