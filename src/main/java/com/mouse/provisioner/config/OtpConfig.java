package com.mouse.provisioner.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Data
public class OtpConfig {

    @Value("${otp.deadline:PT2M}")
    private Duration deadline;

    @Value("${otp.mailbox.poll-interval:PT3S}")
    private Duration mailboxPollInterval;

    @Value("${otp.sms.poll-interval:PT5S}")
    private Duration smsPollInterval;

    @Value("${otp.sms.enabled:true}")
    private boolean smsEnabled;

    public Duration longestPollInterval() {
        return mailboxPollInterval.compareTo(smsPollInterval) >= 0 ? mailboxPollInterval : smsPollInterval;
    }
}
