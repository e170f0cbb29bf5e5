package com.mouse.provisioner.interfaces;

/**
 * Handle to one open browser context. Closing releases every native resource behind it.
 */
public interface BrowserSession extends AutoCloseable {

    String id();

    @Override
    void close();
}
