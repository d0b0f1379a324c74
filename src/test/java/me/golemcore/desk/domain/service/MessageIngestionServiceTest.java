package me.golemcore.desk.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.desk.adapter.outbound.classifier.KeywordClassifierAdapter;
import me.golemcore.desk.adapter.outbound.storage.LocalMessageStoreAdapter;
import me.golemcore.desk.domain.model.AnalyticsSummary;
import me.golemcore.desk.domain.model.BroadcastEvent;
import me.golemcore.desk.domain.model.DispatchJob;
import me.golemcore.desk.domain.model.InboundMail;
import me.golemcore.desk.domain.model.MessageStatus;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.domain.model.SupportMessage;
import me.golemcore.desk.infrastructure.config.AutoConfiguration;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import me.golemcore.desk.port.outbound.KnowledgePort;
import me.golemcore.desk.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.Disposable;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MessageIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private LocalMessageStoreAdapter store;
    private ResponseDispatcher dispatcher;
    private ResponseGenerator generator;
    private KnowledgePort knowledge;
    private EventBroadcaster broadcaster;
    private List<BroadcastEvent> events;
    private Disposable subscription;
    private MessageIngestionService service;

    @BeforeEach
    void setUp() {
        DeskProperties properties = new DeskProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        clock = new MutableClock(NOW);

        store = new LocalMessageStoreAdapter(properties, objectMapper, clock);
        store.init();
        dispatcher = new ResponseDispatcher(properties);
        generator = mock(ResponseGenerator.class);
        knowledge = mock(KnowledgePort.class);
        broadcaster = new EventBroadcaster(properties, objectMapper);
        events = new CopyOnWriteArrayList<>();
        subscription = broadcaster.subscribe().subscribe(events::add);

        service = new MessageIngestionService(store, new KeywordClassifierAdapter(), knowledge, dispatcher,
                generator, broadcaster, clock);
    }

    @AfterEach
    void tearDown() {
        subscription.dispose();
    }

    @Test
    void submitClassifiesStoresQueuesAndAnnounces() {
        SupportMessage created = service.submit(" jane@example.com ", "Urgent: cannot access",
                "I am locked out", null);

        assertEquals("jane@example.com", created.getSender());
        assertEquals(Priority.URGENT, created.getPriority());
        assertEquals(MessageStatus.PENDING, created.getStatus());
        assertEquals(MessageIngestionService.SOURCE_API, created.getSource());
        assertEquals(NOW, created.getReceivedAt());

        DispatchJob job = dispatcher.poll().orElseThrow();
        assertEquals(created.getId(), job.messageId());
        assertEquals(Priority.URGENT, job.priority());

        assertEquals(1, events.size());
        assertEquals(EventBroadcaster.EVENT_EMAIL_CREATED, events.get(0).name());
    }

    @Test
    void submitRequiresSender() {
        assertThrows(IllegalArgumentException.class, () -> service.submit(" ", "s", "b", NOW));
        assertEquals(0, store.count());
    }

    @Test
    void ingestSkipsKnownExternalId() {
        InboundMail mail = new InboundMail("a@example.com", "Help", "Body", NOW, "<id-1@mail>");

        assertTrue(service.ingest(mail, "imap").isPresent());
        assertTrue(service.ingest(mail, "imap").isEmpty());

        assertEquals(1, store.count());
        assertEquals(1, dispatcher.queueDepth());
    }

    @Test
    void ingestWithoutExternalIdDedupesOnSignature() {
        InboundMail mail = new InboundMail("a@example.com", "Help", "Body", NOW, null);
        InboundMail later = new InboundMail("a@example.com", "Help", "Body", NOW.plusSeconds(1), null);

        assertTrue(service.ingest(mail, "imap").isPresent());
        assertTrue(service.ingest(mail, "imap").isEmpty());
        assertTrue(service.ingest(later, "imap").isPresent());
    }

    @Test
    void ingestDedupesMailWithoutSubject() {
        InboundMail mail = new InboundMail("a@example.com ", null, "Body", NOW, null);

        assertTrue(service.ingest(mail, "imap").isPresent());
        assertTrue(service.ingest(mail, "imap").isEmpty());

        assertEquals(1, store.count());
        assertEquals("", store.findById(1).orElseThrow().getSubject());
    }

    @Test
    void ingestDedupesUndatedMailOnContent() {
        InboundMail mail = new InboundMail("a@example.com", "Help", "Body", null, null);
        InboundMail otherBody = new InboundMail("a@example.com", "Help", "Another body", null, null);

        assertTrue(service.ingest(mail, "imap").isPresent());
        clock.advance(Duration.ofMinutes(5));
        assertTrue(service.ingest(mail, "imap").isEmpty());
        assertTrue(service.ingest(otherBody, "imap").isPresent());

        assertEquals(2, store.count());
        assertEquals(NOW, store.findById(1).orElseThrow().getReceivedAt());
    }

    @Test
    void regenerateStoresReplyAndMarksResponded() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);
        when(knowledge.retrieve(anyString())).thenReturn(List.of("snippet"));
        when(generator.generate(anyString(), anyString(), anyString(), any(), anyList())).thenReturn("Fresh reply");
        dispatcher.recordFailure(created.getId());

        SupportMessage regenerated = service.regenerate(created.getId());

        assertEquals("Fresh reply", regenerated.getResponse());
        assertEquals(MessageStatus.RESPONDED, regenerated.getStatus());
        assertEquals(0, dispatcher.attempts(created.getId()));
        verify(generator).generate("Help", "Body", "Neutral", Priority.NORMAL, List.of("snippet"));
        assertEquals(EventBroadcaster.EVENT_EMAIL_UPDATED, events.get(events.size() - 1).name());
    }

    @Test
    void regenerateKeepsSentinelWithoutMarkingResponded() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);
        when(generator.generate(anyString(), anyString(), anyString(), any(), anyList()))
                .thenReturn(ResponseGenerator.SENTINEL_TIMEOUT);

        SupportMessage regenerated = service.regenerate(created.getId());

        assertEquals(ResponseGenerator.SENTINEL_TIMEOUT, regenerated.getResponse());
        assertEquals(MessageStatus.PENDING, regenerated.getStatus());
    }

    @Test
    void regenerateOfMissingMessageFails() {
        assertThrows(NoSuchElementException.class, () -> service.regenerate(404));
    }

    @Test
    void updateResponseMarksResponded() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);

        SupportMessage updated = service.updateResponse(created.getId(), "Edited by operator");

        assertEquals("Edited by operator", updated.getResponse());
        assertEquals(MessageStatus.RESPONDED, updated.getStatus());
    }

    @Test
    void updateResponseRejectsBlankText() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);

        assertThrows(IllegalArgumentException.class, () -> service.updateResponse(created.getId(), "  "));
    }

    @Test
    void resolveSetsStatus() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);

        assertEquals(MessageStatus.RESOLVED, service.resolve(created.getId()).getStatus());
        assertThrows(NoSuchElementException.class, () -> service.resolve(999));
    }

    @Test
    void approveStampsOnceAndMarksAnsweredPendingResponded() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);
        SupportMessage answered = store.findById(created.getId()).orElseThrow();
        answered.setResponse("Draft reply");
        store.save(answered);

        SupportMessage approved = service.approve(created.getId());
        assertEquals(NOW, approved.getApprovedAt());
        assertEquals(MessageStatus.RESPONDED, approved.getStatus());
        assertEquals(EventBroadcaster.EVENT_EMAIL_UPDATED, events.get(events.size() - 1).name());

        clock.advance(Duration.ofMinutes(10));
        assertEquals(NOW, service.approve(created.getId()).getApprovedAt());
    }

    @Test
    void approveWithoutReplyKeepsPending() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);

        SupportMessage approved = service.approve(created.getId());

        assertEquals(NOW, approved.getApprovedAt());
        assertEquals(MessageStatus.PENDING, approved.getStatus());
        assertThrows(NoSuchElementException.class, () -> service.approve(404));
    }

    @Test
    void markSentStampsAndResolves() {
        SupportMessage created = service.submit("a@example.com", "Help", "Body", NOW);
        clock.advance(Duration.ofMinutes(1));

        SupportMessage sent = service.markSent(created.getId());

        assertEquals(NOW.plusSeconds(60), sent.getSentAt());
        assertEquals(MessageStatus.RESOLVED, sent.getStatus());
        assertEquals(EventBroadcaster.EVENT_EMAIL_UPDATED, events.get(events.size() - 1).name());
        assertThrows(NoSuchElementException.class, () -> service.markSent(404));
    }

    @Test
    void summarizeCountsByWindowSentimentPriorityAndStatus() {
        store.create(stored("a@example.com", "Positive", Priority.NORMAL, MessageStatus.RESOLVED,
                NOW.minus(Duration.ofHours(30))));
        store.create(stored("b@example.com", "Negative", Priority.URGENT, MessageStatus.PENDING,
                NOW.minus(Duration.ofHours(2))));
        store.create(stored("c@example.com", "Negative", Priority.URGENT, MessageStatus.RESPONDED,
                NOW.minus(Duration.ofHours(24))));

        AnalyticsSummary summary = service.summarize();

        assertEquals(3, summary.getTotal());
        assertEquals(2, summary.getLast24h());
        assertEquals(Map.of("Positive", 1L, "Neutral", 0L, "Negative", 2L), summary.getSentiment());
        assertEquals(Map.of("Urgent", 2L, "Not urgent", 1L), summary.getPriority());
        assertEquals(1, summary.getResolved());
        assertEquals(1, summary.getPending());
    }

    @Test
    void summarizeOfEmptyInboxHasZeroCounts() {
        AnalyticsSummary summary = service.summarize();

        assertEquals(0, summary.getTotal());
        assertEquals(0L, summary.getSentiment().get("Neutral"));
        assertEquals(0L, summary.getPriority().get("Urgent"));
    }

    @Test
    void listFiltersBySenderDomain() {
        service.submit("jane@Acme.com", "Question", "Body", NOW);
        service.submit("bob@mail.acme.com", "Question", "Body", NOW.plusSeconds(1));
        service.submit("acme@other.org", "Question", "Body", NOW.plusSeconds(2));

        MessageIngestionService.MessagePage page = service.list(
                new MessageIngestionService.MessageFilter(null, null, null, null, "@ACME.com", null), 10, 0);

        assertEquals(List.of("bob@mail.acme.com", "jane@Acme.com"),
                page.items().stream().map(SupportMessage::getSender).toList());
    }

    private static SupportMessage stored(String sender, String sentiment, Priority priority, MessageStatus status,
            Instant receivedAt) {
        return SupportMessage.builder()
                .sender(sender)
                .subject("Subject")
                .body("Body")
                .sentiment(sentiment)
                .priority(priority)
                .status(status)
                .receivedAt(receivedAt)
                .build();
    }

    @Test
    void listPutsUrgentFirstThenNewest() {
        service.submit("old@example.com", "Question", "Body", NOW);
        service.submit("new@example.com", "Question", "Body", NOW.plusSeconds(60));
        service.submit("urgent@example.com", "Critical failure", "Body", NOW.minusSeconds(60));

        MessageIngestionService.MessagePage page = service.list(MessageIngestionService.MessageFilter.none(), 10, 0);

        assertEquals(3, page.total());
        assertEquals(List.of("urgent@example.com", "new@example.com", "old@example.com"),
                page.items().stream().map(SupportMessage::getSender).toList());
    }

    @Test
    void listAppliesFiltersAndPaging() {
        service.submit("a@example.com", "Question", "Refund please", NOW);
        service.submit("b@example.com", "Question", "Invoice", NOW.plusSeconds(1));
        service.submit("c@example.com", "Critical", "Server is down", NOW.plusSeconds(2));

        MessageIngestionService.MessagePage normal = service.list(
                new MessageIngestionService.MessageFilter(MessageStatus.PENDING, Priority.NORMAL, null, null, null,
                        null),
                1, 1);
        assertEquals(2, normal.total());
        assertEquals(1, normal.items().size());
        assertEquals("a@example.com", normal.items().get(0).getSender());

        MessageIngestionService.MessagePage search = service.list(
                new MessageIngestionService.MessageFilter(null, null, null, null, null, "REFUND"), 10, 0);
        assertEquals(1, search.total());
    }

    @Test
    void requeueUnansweredSkipsResolvedAndAnswered() {
        SupportMessage open = service.submit("a@example.com", "Help", "Body", NOW);
        SupportMessage resolved = service.submit("b@example.com", "Help", "Body", NOW);
        SupportMessage answered = service.submit("c@example.com", "Help", "Body", NOW);
        service.resolve(resolved.getId());
        service.updateResponse(answered.getId(), "Done");
        while (dispatcher.poll().isPresent()) {
            // drain jobs queued by submit
        }

        assertEquals(1, service.requeueUnanswered());
        assertEquals(open.getId(), dispatcher.poll().orElseThrow().messageId());
    }

    @Test
    void extractReturnsClassifierDetails() {
        SupportMessage created = service.submit("a@example.com", "Refund", "Call +44 20 7946 0958", NOW);

        assertEquals(List.of("+44 20 7946 0958"), service.extract(created).getPhoneNumbers());
    }
}
