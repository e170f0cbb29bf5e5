package com.mouse.provisioner.interfaces;

import com.mouse.provisioner.model.Identity;

import java.time.Instant;
import java.util.Optional;

public interface MailboxChannel {

    /**
     * @param since ignore messages received before this instant
     * @return the code if a matching message arrived, empty if nothing yet
     * @throws com.mouse.provisioner.exception.ChannelException when the mailbox is unreachable
     */
    Optional<String> poll(Identity identity, Instant since);
}
