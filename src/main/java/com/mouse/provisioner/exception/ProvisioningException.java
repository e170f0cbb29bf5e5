package com.mouse.provisioner.exception;

public class ProvisioningException extends RuntimeException {
    public ProvisioningException() {
        super();
    }

    public ProvisioningException(String message) {
        super(message);
    }

    public ProvisioningException(String message, Throwable e) {
        super(message, e);
    }
}
