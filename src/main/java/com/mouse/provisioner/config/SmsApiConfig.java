package com.mouse.provisioner.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Data
public class SmsApiConfig {

    @Value("${sms.api.base-url:https://api.smspool.net}")
    private String baseUrl;

    @Value("${sms.api.key:}")
    private String apiKey;

    @Value("${sms.api.country:GB}")
    private String country;

    @Value("${sms.api.service:}")
    private String service;

    @Value("${sms.api.max-price:0.20}")
    private String maxPrice;

    @Value("${sms.api.timeout-ms:20000}")
    private int timeoutMs;
}
