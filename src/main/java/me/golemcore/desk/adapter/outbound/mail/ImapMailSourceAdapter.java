/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.desk.adapter.outbound.mail;

import me.golemcore.desk.domain.model.InboundMail;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import me.golemcore.desk.port.outbound.MailSourcePort;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.BodyPart;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * IMAP mailbox connector.
 *
 * <p>
 * Modes, selected by {@code desk.mail.source}:
 * <ul>
 * <li>{@code imap} - generic server, only subjects containing a support term
 * are returned, external id is the {@code Message-ID} header</li>
 * <li>{@code gmail} - {@code imap.gmail.com} over SSL, folder is the optional
 * label, external id is {@code gmail:<UID>}</li>
 * <li>{@code none} - connector disabled, no mail</li>
 * </ul>
 * The newest {@code limit} messages are read, newest first. The plain-text part
 * is preferred; HTML is stripped when no plain text exists or when the plain
 * text is itself HTML.
 */
@Component
@Slf4j
@SuppressWarnings("PMD.ReplaceJavaUtilDate") // Jakarta Mail exposes java.util.Date
public class ImapMailSourceAdapter implements MailSourcePort {

    static final String MODE_IMAP = "imap";
    static final String MODE_GMAIL = "gmail";
    static final String MODE_NONE = "none";
    static final String GMAIL_HOST = "imap.gmail.com";
    static final int GMAIL_PORT = 993;
    static final String GMAIL_ID_PREFIX = "gmail:";

    private static final String DEFAULT_FOLDER = "INBOX";
    private static final String HEADER_MESSAGE_ID = "Message-ID";
    private static final int MAX_MULTIPART_DEPTH = 10;

    private final DeskProperties.MailProperties config;
    private final String mode;

    public ImapMailSourceAdapter(DeskProperties properties) {
        this.config = properties.getMail();
        this.mode = resolveMode(config.getSource());
    }

    @Override
    public String getSourceName() {
        return mode;
    }

    @Override
    public boolean isEnabled() {
        if (MODE_NONE.equals(mode)) {
            return false;
        }
        boolean hasCredentials = isNotBlank(config.getUsername()) && isNotBlank(config.getPassword());
        return hasCredentials && (MODE_GMAIL.equals(mode) || isNotBlank(config.getHost()));
    }

    @Override
    public List<InboundMail> fetch(int limit) {
        if (!isEnabled()) {
            log.debug("[IMAP] Source '{}' not configured, nothing to fetch", mode);
            return List.of();
        }
        String folderName = folderName();
        try (Store store = connectStore()) {
            Folder folder = store.getFolder(folderName);
            if (!folder.exists()) {
                throw new MailSourceException("Folder not found: " + folderName);
            }
            folder.open(Folder.READ_ONLY);
            try {
                List<InboundMail> mails = readNewest(folder, limit);
                log.debug("[IMAP] Read {} candidate messages from {}", mails.size(), folderName);
                return mails;
            } finally {
                folder.close(false);
            }
        } catch (AuthenticationFailedException e) {
            log.error("[IMAP] Authentication failed for {}", config.getUsername());
            throw new MailSourceException("IMAP authentication failed. Check username and password.", e);
        } catch (MessagingException e) {
            throw new MailSourceException("IMAP error: " + e.getMessage(), e);
        }
    }

    Store connectStore() throws MessagingException {
        String host = MODE_GMAIL.equals(mode) ? GMAIL_HOST : config.getHost();
        int port = MODE_GMAIL.equals(mode) ? GMAIL_PORT : config.getPort();
        MailSecurity security = MODE_GMAIL.equals(mode) ? MailSecurity.SSL
                : MailSecurity.fromString(config.getSecurity());

        Session session = MailSessionFactory.createImapSession(host, port,
                config.getUsername(), config.getPassword(),
                security, config.getConnectTimeout(), config.getReadTimeout());

        Store store = session.getStore(security.storeProtocol());
        store.connect(host, port, config.getUsername(), config.getPassword());
        return store;
    }

    String folderName() {
        if (MODE_GMAIL.equals(mode) && isNotBlank(config.getLabel())) {
            return config.getLabel();
        }
        return isNotBlank(config.getFolder()) ? config.getFolder() : DEFAULT_FOLDER;
    }

    private List<InboundMail> readNewest(Folder folder, int limit) throws MessagingException {
        int total = folder.getMessageCount();
        if (total <= 0 || limit <= 0) {
            return List.of();
        }
        int start = Math.max(1, total - limit + 1);
        Message[] messages = folder.getMessages(start, total);

        List<InboundMail> mails = new ArrayList<>();
        for (int i = messages.length - 1; i >= 0; i--) {
            Message message = messages[i];
            try {
                toInboundMail(folder, message).ifPresent(mails::add);
            } catch (MessagingException | IOException e) {
                log.warn("[IMAP] Skipping unreadable message #{}: {}", message.getMessageNumber(), e.getMessage());
            }
        }
        return mails;
    }

    private Optional<InboundMail> toInboundMail(Folder folder, Message message)
            throws MessagingException, IOException {
        String subject = message.getSubject() != null ? message.getSubject() : "";
        if (MODE_IMAP.equals(mode) && !matchesSupportTerm(subject)) {
            return Optional.empty();
        }

        String body = extractBody(message, 0);
        if (body.length() > config.getMaxBodyLength()) {
            body = body.substring(0, config.getMaxBodyLength());
        }

        String externalId;
        if (MODE_GMAIL.equals(mode)) {
            externalId = GMAIL_ID_PREFIX + ((UIDFolder) folder).getUID(message);
        } else {
            externalId = header(message, HEADER_MESSAGE_ID);
        }

        return Optional.of(new InboundMail(formatAddress(message.getFrom()), subject, body,
                receivedAt(message), externalId));
    }

    private boolean matchesSupportTerm(String subject) {
        String lowered = subject.toLowerCase(Locale.ROOT);
        for (String term : config.getSubjectKeywords()) {
            if (term != null && !term.isBlank() && lowered.contains(term.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sent date, else received date, else {@code null}. Ingestion stamps undated
     * mail itself and deduplicates it by content.
     */
    private Instant receivedAt(Message message) throws MessagingException {
        Date sent = message.getSentDate();
        if (sent != null) {
            return sent.toInstant();
        }
        Date received = message.getReceivedDate();
        return received != null ? received.toInstant() : null;
    }

    // ==================== Body extraction ====================

    private String extractBody(Part part, int depth) throws MessagingException, IOException {
        if (depth > MAX_MULTIPART_DEPTH) {
            return "";
        }

        if (part.isMimeType("text/plain")) {
            Object content = part.getContent();
            String text = content != null ? content.toString() : "";
            return MailBodyText.looksLikeHtml(text) ? MailBodyText.stripHtml(text) : text.strip();
        }

        if (part.isMimeType("text/html")) {
            Object content = part.getContent();
            return MailBodyText.stripHtml(content != null ? content.toString() : "");
        }

        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            StringBuilder plainText = new StringBuilder();
            String htmlText = null;

            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                if (Part.ATTACHMENT.equalsIgnoreCase(bodyPart.getDisposition())) {
                    continue;
                }
                if (bodyPart.isMimeType("text/html")) {
                    if (htmlText == null) {
                        htmlText = extractBody(bodyPart, depth + 1);
                    }
                    continue;
                }
                String nested = extractBody(bodyPart, depth + 1);
                if (!nested.isEmpty()) {
                    if (!plainText.isEmpty()) {
                        plainText.append('\n');
                    }
                    plainText.append(nested);
                }
            }

            if (!plainText.isEmpty()) {
                return plainText.toString();
            }
            return htmlText != null ? htmlText : "";
        }

        return "";
    }

    // ==================== Helpers ====================

    private String formatAddress(Address[] addresses) {
        if (addresses == null || addresses.length == 0) {
            return "";
        }
        Address first = addresses[0];
        if (first instanceof InternetAddress internetAddress) {
            return internetAddress.toUnicodeString();
        }
        return first.toString();
    }

    private String header(Message message, String name) throws MessagingException {
        String[] values = message.getHeader(name);
        return values != null && values.length > 0 && isNotBlank(values[0]) ? values[0].trim() : null;
    }

    private static String resolveMode(String source) {
        String normalized = source == null || source.isBlank() ? MODE_NONE : source.trim().toLowerCase(Locale.ROOT);
        if (MODE_IMAP.equals(normalized) || MODE_GMAIL.equals(normalized) || MODE_NONE.equals(normalized)) {
            return normalized;
        }
        log.warn("[IMAP] Unknown mail source '{}', mail discovery disabled", source);
        return MODE_NONE;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
