package com.mouse.provisioner.channel;

import com.mouse.provisioner.config.MailboxConfig;
import com.mouse.provisioner.exception.ChannelException;
import com.mouse.provisioner.interfaces.MailboxChannel;
import com.mouse.provisioner.model.Identity;
import com.mouse.provisioner.utils.OtpCodeExtractor;
import jakarta.annotation.PreDestroy;
import jakarta.mail.*;
import jakarta.mail.search.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.Properties;

/**
 * Catch-all IMAP inbox shared by every identity. Looks for unseen messages addressed to the
 * identity, newest first, and marks the message seen once a code was taken from it.
 *
 * <p>One connection serves all workers, so folder access is serialized.
 */
@Slf4j
@Component
public class ImapMailboxChannel implements MailboxChannel {

    /** Mail server and local clock rarely agree to the second. */
    private static final Duration CLOCK_SKEW = Duration.ofSeconds(30);

    private final MailboxConfig config;
    private final OtpCodeExtractor extractor;
    private final Object connectionLock = new Object();

    private Store store;
    private Folder folder;

    public ImapMailboxChannel(MailboxConfig config) {
        this.config = config;
        this.extractor = new OtpCodeExtractor(config.getCodeLength() > 0 ? config.getCodeLength() : 6);
    }

    @Override
    public Optional<String> poll(Identity identity, Instant since) {
        if (config.getHost() == null || config.getHost().isBlank()) {
            throw new ChannelException("Mailbox host is not configured");
        }
        Instant notBefore = since.minus(CLOCK_SKEW);

        synchronized (connectionLock) {
            try {
                Folder inbox = openFolder();
                SearchTerm term = new AndTerm(new SearchTerm[]{
                        new RecipientStringTerm(Message.RecipientType.TO, identity.email()),
                        new FlagTerm(new Flags(Flags.Flag.SEEN), false),
                        new ReceivedDateTerm(ComparisonTerm.GE, Date.from(notBefore))
                });
                Message[] messages = inbox.search(term);
                for (int i = messages.length - 1; i >= 0; i--) {
                    Message message = messages[i];
                    Date received = message.getReceivedDate();
                    if (received != null && received.toInstant().isBefore(notBefore)) {
                        continue;
                    }
                    Optional<String> code = extractor.extract(textOf(message));
                    if (code.isPresent()) {
                        message.setFlag(Flags.Flag.SEEN, true);
                        log.debug("Code found in mailbox | Email: {} | Candidates: {}", identity.email(), messages.length);
                        return code;
                    }
                }
                return Optional.empty();
            } catch (AuthenticationFailedException e) {
                disconnect();
                throw new ChannelException("Mailbox authentication failed", e);
            } catch (MessagingException | IOException e) {
                disconnect();
                throw new ChannelException("Mailbox unreachable: " + e.getMessage(), e);
            }
        }
    }

    private Folder openFolder() throws MessagingException {
        if (store == null || !store.isConnected()) {
            Properties props = new Properties();
            props.put("mail.store.protocol", "imaps");
            props.put("mail.imaps.connectiontimeout", String.valueOf(config.getTimeoutMs()));
            props.put("mail.imaps.timeout", String.valueOf(config.getTimeoutMs()));
            Session session = Session.getInstance(props);
            store = session.getStore("imaps");
            // app passwords are often pasted with the spaces they are displayed with
            store.connect(config.getHost(), config.getPort(), config.getUsername(),
                    config.getPassword().replace(" ", ""));
            log.info("Mailbox connected | Host: {} | User: {}", config.getHost(), config.getUsername());
        }
        if (folder == null || !folder.isOpen()) {
            folder = store.getFolder(config.getFolder());
            folder.open(Folder.READ_WRITE);
        }
        return folder;
    }

    static String textOf(Part part) throws MessagingException, IOException {
        String disposition = part.getDisposition();
        if (Part.ATTACHMENT.equalsIgnoreCase(disposition)) {
            return "";
        }
        if (part.isMimeType("text/plain") || part.isMimeType("text/html")) {
            Object content = part.getContent();
            return content instanceof String ? (String) content : "";
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            StringBuilder body = new StringBuilder();
            for (int i = 0; i < multipart.getCount(); i++) {
                body.append(textOf(multipart.getBodyPart(i)));
            }
            return body.toString();
        }
        return "";
    }

    @PreDestroy
    void disconnect() {
        synchronized (connectionLock) {
            try {
                if (folder != null && folder.isOpen()) {
                    folder.close(false);
                }
                if (store != null && store.isConnected()) {
                    store.close();
                }
            } catch (MessagingException e) {
                log.debug("Error while closing mailbox connection: {}", e.getMessage());
            } finally {
                folder = null;
                store = null;
            }
        }
    }
}
