package com.mouse.provisioner.interfaces;

import com.mouse.provisioner.model.Identity;
import com.mouse.provisioner.model.SmsOrder;

import java.util.Optional;

public interface SmsCodeChannel {

    /**
     * Reserves a number for one verification attempt.
     *
     * @throws com.mouse.provisioner.exception.ChannelException when no order can be placed
     */
    SmsOrder order(Identity identity);

    /**
     * @throws com.mouse.provisioner.exception.ChannelException when the API is unreachable
     */
    Optional<String> poll(String orderId);
}
