package com.mouse.provisioner.model;

import com.mouse.provisioner.enums.OtpChannelName;

public record OtpResult(String code, OtpChannelName channel) {

    public static OtpResult of(String code, OtpChannelName channel) {
        return new OtpResult(code, channel);
    }

    public static OtpResult timeout() {
        return new OtpResult(null, null);
    }

    public boolean isTimeout() {
        return code == null;
    }
}
