package com.mouse.provisioner.exception;

public class InvalidProxyFormatException extends RuntimeException {
    public InvalidProxyFormatException() {
        super();
    }

    public InvalidProxyFormatException(String message) {
        super(message);
    }

    public InvalidProxyFormatException(String message, Throwable e) {
        super(message, e);
    }
}
