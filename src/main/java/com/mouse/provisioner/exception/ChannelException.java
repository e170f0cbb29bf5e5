package com.mouse.provisioner.exception;

public class ChannelException extends RuntimeException {
    public ChannelException() {
        super();
    }

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable e) {
        super(message, e);
    }
}
