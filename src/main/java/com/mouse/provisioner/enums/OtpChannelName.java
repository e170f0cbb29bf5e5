package com.mouse.provisioner.enums;

public enum OtpChannelName {
    MAILBOX,
    SMS
}
