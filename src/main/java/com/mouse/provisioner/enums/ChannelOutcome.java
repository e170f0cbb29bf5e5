package com.mouse.provisioner.enums;

public enum ChannelOutcome {
    PENDING,
    CODE,
    FAILURE
}
