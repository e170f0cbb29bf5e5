package com.mouse.provisioner.model;

public record SmsOrder(String orderId, String phoneNumber) {
}
