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

package me.golemcore.desk.domain.service;

import me.golemcore.desk.domain.model.AnalyticsSummary;
import me.golemcore.desk.domain.model.Classification;
import me.golemcore.desk.domain.model.InboundMail;
import me.golemcore.desk.domain.model.MessageStatus;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.domain.model.SupportMessage;
import me.golemcore.desk.port.outbound.ClassifierPort;
import me.golemcore.desk.port.outbound.KnowledgePort;
import me.golemcore.desk.port.outbound.MessageStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Creates and mutates support messages on behalf of the poller and the API.
 *
 * <p>
 * New messages are classified, persisted without a response and queued for
 * the dispatch worker. Every mutation is announced on the
 * {@link EventBroadcaster}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageIngestionService {

    public static final String SOURCE_API = "api";

    private static final int MAX_PAGE_SIZE = 500;
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);
    private static final List<String> SENTIMENTS = List.of("Positive", "Neutral", "Negative");

    private final MessageStorePort store;
    private final ClassifierPort classifier;
    private final KnowledgePort knowledge;
    private final ResponseDispatcher dispatcher;
    private final ResponseGenerator generator;
    private final EventBroadcaster broadcaster;
    private final Clock clock;

    /**
     * Ingest one discovered mail unless it is a duplicate.
     *
     * <p>
     * With an external id, any record carrying the same id is a duplicate.
     * Without one, only an exact match on sender, subject and received-at is,
     * compared in their stored form. Undated mail matches on sender, subject
     * and body.
     *
     * @return the created record, or empty when the mail was a duplicate
     */
    public Optional<SupportMessage> ingest(InboundMail mail, String source) {
        String sender = mail.sender() != null ? mail.sender().trim() : "";
        String subject = nullToEmpty(mail.subject());
        String body = nullToEmpty(mail.body());
        if (mail.hasExternalId()) {
            if (store.findByExternalId(mail.externalId()).isPresent()) {
                log.debug("[Ingest] Skipping known external id {}", mail.externalId());
                return Optional.empty();
            }
        } else if (store.findBySignature(sender, subject, body, mail.receivedAt()).isPresent()) {
            log.debug("[Ingest] Skipping duplicate from {} at {}", sender, mail.receivedAt());
            return Optional.empty();
        }
        Instant receivedAt = mail.receivedAt() != null ? mail.receivedAt() : clock.instant();
        return Optional.of(createAndEnqueue(sender, subject, body, receivedAt, source,
                mail.hasExternalId() ? mail.externalId() : null));
    }

    /**
     * Direct submission. Always creates a record.
     */
    public SupportMessage submit(String sender, String subject, String body, Instant receivedAt) {
        if (sender == null || sender.isBlank()) {
            throw new IllegalArgumentException("sender is required");
        }
        Instant effective = receivedAt != null ? receivedAt : clock.instant();
        return createAndEnqueue(sender.trim(), subject, body, effective, SOURCE_API, null);
    }

    /**
     * Generate a new reply synchronously and store it.
     *
     * @throws NoSuchElementException
     *             if the message does not exist
     */
    public SupportMessage regenerate(long id) {
        SupportMessage message = require(id);
        List<String> snippets = knowledge.retrieve(message.getSubject() + "\n" + message.getBody());
        String text = generator.generate(message.getSubject(), message.getBody(), message.getSentiment(),
                message.getPriority(), snippets);

        message.setResponse(text);
        if (!ResponseGenerator.isSentinel(text) && message.getStatus() != MessageStatus.RESOLVED) {
            message.setStatus(MessageStatus.RESPONDED);
        }
        SupportMessage saved = store.save(message);
        dispatcher.clearAttempts(id);
        broadcaster.publishMessageUpdate(saved.getId(), saved.getStatus());
        log.info("[API] Regenerated response for message {}", id);
        return saved;
    }

    /**
     * Replace the reply with operator-edited text and mark the message
     * responded.
     */
    public SupportMessage updateResponse(long id, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("response text is required");
        }
        SupportMessage message = require(id);
        message.setResponse(text);
        message.setStatus(MessageStatus.RESPONDED);
        SupportMessage saved = store.save(message);
        dispatcher.clearAttempts(id);
        broadcaster.publishMessageUpdate(saved.getId(), saved.getStatus());
        return saved;
    }

    public SupportMessage resolve(long id) {
        SupportMessage message = require(id);
        message.setStatus(MessageStatus.RESOLVED);
        SupportMessage saved = store.save(message);
        broadcaster.publishMessageUpdate(saved.getId(), saved.getStatus());
        return saved;
    }

    /**
     * Operator sign-off on the reply. The first approval time is kept. A pending
     * message that already has a reply becomes responded.
     */
    public SupportMessage approve(long id) {
        SupportMessage message = require(id);
        if (message.getApprovedAt() == null) {
            message.setApprovedAt(clock.instant());
        }
        if (message.getStatus() == MessageStatus.PENDING && message.hasResponse()) {
            message.setStatus(MessageStatus.RESPONDED);
        }
        SupportMessage saved = store.save(message);
        broadcaster.publishMessageUpdate(saved.getId(), saved.getStatus());
        log.info("[API] Approved message {}", id);
        return saved;
    }

    /**
     * Record that the reply went out. Resolves the message.
     */
    public SupportMessage markSent(long id) {
        SupportMessage message = require(id);
        message.setSentAt(clock.instant());
        message.setStatus(MessageStatus.RESOLVED);
        SupportMessage saved = store.save(message);
        broadcaster.publishMessageUpdate(saved.getId(), saved.getStatus());
        log.info("[API] Marked message {} sent", id);
        return saved;
    }

    public AnalyticsSummary summarize() {
        List<SupportMessage> messages = store.findAll();
        Instant since = clock.instant().minus(RECENT_WINDOW);

        Map<String, Long> bySentiment = new LinkedHashMap<>();
        for (String sentiment : SENTIMENTS) {
            bySentiment.put(sentiment, messages.stream()
                    .filter(m -> sentiment.equalsIgnoreCase(m.getSentiment()))
                    .count());
        }
        Map<String, Long> byPriority = new LinkedHashMap<>();
        for (Priority priority : Priority.values()) {
            byPriority.put(priority.label(), messages.stream()
                    .filter(m -> priorityOf(m) == priority)
                    .count());
        }

        return AnalyticsSummary.builder()
                .total(messages.size())
                .last24h(messages.stream()
                        .filter(m -> m.getReceivedAt() != null && !m.getReceivedAt().isBefore(since))
                        .count())
                .sentiment(bySentiment)
                .priority(byPriority)
                .resolved(messages.stream().filter(m -> m.getStatus() == MessageStatus.RESOLVED).count())
                .pending(messages.stream().filter(m -> m.getStatus() == MessageStatus.PENDING).count())
                .build();
    }

    public Optional<SupportMessage> find(long id) {
        return store.findById(id);
    }

    public Classification extract(SupportMessage message) {
        return classifier.classify(message.getSubject(), message.getBody());
    }

    /**
     * Filtered listing: urgent first, then newest received.
     */
    public MessagePage list(MessageFilter filter, int limit, int offset) {
        int pageSize = Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
        int skip = Math.max(0, offset);

        List<SupportMessage> matching = store.findAll().stream()
                .filter(filter::matches)
                .sorted(Comparator
                        .comparingInt((SupportMessage m) -> priorityOf(m).rank())
                        .thenComparing(SupportMessage::getReceivedAt,
                                Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());

        List<SupportMessage> items = matching.stream().skip(skip).limit(pageSize).collect(Collectors.toList());
        return new MessagePage(items, matching.size(), pageSize, skip);
    }

    /**
     * Queue every stored message that still lacks a reply.
     *
     * @return number of jobs pushed
     */
    public int requeueUnanswered() {
        int pushed = 0;
        for (SupportMessage message : store.findWithoutResponse()) {
            if (message.getStatus() == MessageStatus.RESOLVED) {
                continue;
            }
            if (dispatcher.enqueue(message.getId(), priorityOf(message))) {
                pushed++;
            }
        }
        return pushed;
    }

    private SupportMessage createAndEnqueue(String sender, String subject, String body, Instant receivedAt,
            String source, String externalId) {
        Classification classification = classifier.classify(subject, body);
        SupportMessage message = SupportMessage.builder()
                .sender(sender)
                .subject(subject != null ? subject : "")
                .body(body != null ? body : "")
                .receivedAt(receivedAt)
                .sentiment(classification.getSentiment())
                .priority(classification.getPriority())
                .status(MessageStatus.PENDING)
                .source(source)
                .externalId(externalId)
                .build();

        SupportMessage created = store.create(message);
        dispatcher.enqueue(created.getId(), priorityOf(created));
        broadcaster.publishMessageCreated(created.getId(), created.getStatus());
        log.info("[Ingest] Created message {} from {} ({}, {})", created.getId(), source,
                priorityOf(created).label(), created.getSentiment());
        return created;
    }

    private SupportMessage require(long id) {
        return store.findById(id).orElseThrow(() -> new NoSuchElementException("Message not found: " + id));
    }

    private static Priority priorityOf(SupportMessage message) {
        return message.getPriority() != null ? message.getPriority() : Priority.NORMAL;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * Listing criteria. Null fields match everything.
     *
     * @param domain
     *            sender domain, with or without a leading {@code @}; matched
     *            case-insensitively against the part after the sender's
     *            {@code @}
     */
    public record MessageFilter(MessageStatus status, Priority priority, String sentiment, String source,
            String domain, String query) {

        public static MessageFilter none() {
            return new MessageFilter(null, null, null, null, null, null);
        }

        boolean matches(SupportMessage message) {
            if (status != null && message.getStatus() != status) {
                return false;
            }
            if (priority != null && priorityOf(message) != priority) {
                return false;
            }
            if (sentiment != null && !sentiment.equalsIgnoreCase(message.getSentiment())) {
                return false;
            }
            if (source != null && !source.equalsIgnoreCase(message.getSource())) {
                return false;
            }
            if (domain != null && !matchesDomain(message.getSender())) {
                return false;
            }
            if (query != null && !query.isBlank()) {
                String needle = query.toLowerCase(Locale.ROOT);
                String haystack = (message.getSubject() + " " + message.getBody() + " " + message.getSender())
                        .toLowerCase(Locale.ROOT);
                return haystack.contains(needle);
            }
            return true;
        }

        private boolean matchesDomain(String sender) {
            String wanted = domain.trim().toLowerCase(Locale.ROOT);
            while (wanted.startsWith("@")) {
                wanted = wanted.substring(1);
            }
            if (wanted.isEmpty()) {
                return true;
            }
            if (sender == null) {
                return false;
            }
            String lowered = sender.toLowerCase(Locale.ROOT);
            int at = lowered.indexOf('@');
            return at >= 0 && lowered.substring(at + 1).contains(wanted);
        }
    }

    public record MessagePage(List<SupportMessage> items, int total, int limit, int offset) {
    }
}
