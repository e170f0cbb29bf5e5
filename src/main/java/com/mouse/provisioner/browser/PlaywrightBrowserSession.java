package com.mouse.provisioner.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.mouse.provisioner.interfaces.BrowserSession;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Owns a whole Playwright stack. Playwright objects are not thread-safe, so every worker
 * gets its own instance instead of sharing one browser.
 */
@Slf4j
@Getter
class PlaywrightBrowserSession implements BrowserSession {

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            log.debug("Error closing browser session {}: {}", id, e.getMessage());
        } finally {
            playwright.close();
        }
    }
}
