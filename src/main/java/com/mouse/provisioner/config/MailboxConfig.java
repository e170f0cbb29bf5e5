package com.mouse.provisioner.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Data
public class MailboxConfig {

    @Value("${mailbox.host:}")
    private String host;

    @Value("${mailbox.port:993}")
    private int port;

    @Value("${mailbox.username:}")
    private String username;

    @Value("${mailbox.password:}")
    private String password;

    @Value("${mailbox.folder:INBOX}")
    private String folder;

    @Value("${mailbox.timeout-ms:20000}")
    private int timeoutMs;

    @Value("${mailbox.code-length:6}")
    private int codeLength;
}
