package com.mouse.provisioner.exception;

public class BrowserSessionException extends RuntimeException {
    public BrowserSessionException() {
        super();
    }

    public BrowserSessionException(String message) {
        super(message);
    }

    public BrowserSessionException(String message, Throwable e) {
        super(message, e);
    }
}
