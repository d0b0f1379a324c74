package me.golemcore.desk.adapter.inbound.web.controller;

import me.golemcore.desk.adapter.inbound.web.dto.IngestRequest;
import me.golemcore.desk.adapter.inbound.web.dto.MessagePageResponse;
import me.golemcore.desk.adapter.inbound.web.dto.ResponseUpdateRequest;
import me.golemcore.desk.domain.model.Classification;
import me.golemcore.desk.domain.model.MessageStatus;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.domain.model.SupportMessage;
import me.golemcore.desk.domain.service.MessageIngestionService;
import me.golemcore.desk.domain.service.MessageIngestionService.MessageFilter;
import me.golemcore.desk.domain.service.MessageIngestionService.MessagePage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MessagesControllerTest {

    private static final Instant RECEIVED = Instant.parse("2026-02-01T09:00:00Z");

    private MessageIngestionService ingestionService;
    private MessagesController controller;

    @BeforeEach
    void setUp() {
        ingestionService = mock(MessageIngestionService.class);
        controller = new MessagesController(ingestionService);
    }

    private static SupportMessage message(long id) {
        return SupportMessage.builder()
                .id(id)
                .sender("jane@example.com")
                .subject("Cannot login")
                .body("Locked out")
                .priority(Priority.URGENT)
                .status(MessageStatus.PENDING)
                .receivedAt(RECEIVED)
                .build();
    }

    @Test
    void ingestShouldReturnCreated() {
        SupportMessage created = message(1);
        when(ingestionService.submit("jane@example.com", "Cannot login", "Locked out", RECEIVED))
                .thenReturn(created);

        IngestRequest request = IngestRequest.builder()
                .sender("jane@example.com")
                .subject("Cannot login")
                .body("Locked out")
                .receivedAt(RECEIVED)
                .build();

        StepVerifier.create(controller.ingest(request))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.CREATED, resp.getStatusCode());
                    assertSame(created, resp.getBody());
                })
                .verifyComplete();
    }

    @Test
    void ingestShouldRejectMissingBody() {
        StepVerifier.create(controller.ingest(null))
                .expectErrorMatches(error -> error instanceof ResponseStatusException rse
                        && rse.getStatusCode() == HttpStatus.BAD_REQUEST)
                .verify();
        verifyNoInteractions(ingestionService);
    }

    @Test
    void ingestShouldPropagateValidationErrors() {
        when(ingestionService.submit(any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("sender is required"));

        StepVerifier.create(controller.ingest(new IngestRequest()))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void listShouldBuildFilterFromParameters() {
        when(ingestionService.list(any(), anyInt(), anyInt()))
                .thenReturn(new MessagePage(List.of(message(3)), 7, 5, 5));

        StepVerifier.create(controller.list("responded", "urgent", " Negative ", "gmail", " @acme.com ", "login", 5,
                5))
                .assertNext(resp -> {
                    MessagePageResponse body = resp.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.getItems().size());
                    assertEquals(7, body.getTotal());
                    assertEquals(5, body.getLimit());
                    assertEquals(5, body.getOffset());
                })
                .verifyComplete();

        ArgumentCaptor<MessageFilter> captor = ArgumentCaptor.forClass(MessageFilter.class);
        verify(ingestionService).list(captor.capture(), anyInt(), anyInt());
        MessageFilter filter = captor.getValue();
        assertEquals(MessageStatus.RESPONDED, filter.status());
        assertEquals(Priority.URGENT, filter.priority());
        assertEquals("Negative", filter.sentiment());
        assertEquals("gmail", filter.source());
        assertEquals("@acme.com", filter.domain());
        assertEquals("login", filter.query());
    }

    @Test
    void listShouldTreatBlankParametersAsAbsent() {
        when(ingestionService.list(any(), anyInt(), anyInt())).thenReturn(new MessagePage(List.of(), 0, 50, 0));

        StepVerifier.create(controller.list("", null, " ", null, " ", null, 50, 0))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<MessageFilter> captor = ArgumentCaptor.forClass(MessageFilter.class);
        verify(ingestionService).list(captor.capture(), anyInt(), anyInt());
        assertNull(captor.getValue().status());
        assertNull(captor.getValue().sentiment());
        assertNull(captor.getValue().domain());
    }

    @Test
    void listShouldRejectBadPaging() {
        StepVerifier.create(controller.list(null, null, null, null, null, null, 0, 0))
                .expectError(ResponseStatusException.class)
                .verify();
        StepVerifier.create(controller.list(null, null, null, null, null, null, 10, -1))
                .expectError(ResponseStatusException.class)
                .verify();
    }

    @Test
    void listShouldRejectUnknownStatus() {
        assertThrows(IllegalArgumentException.class,
                () -> controller.list("archived", null, null, null, null, null, 10, 0));
    }

    @Test
    void getShouldReturnMessageWithExtractedFields() {
        SupportMessage stored = message(4);
        Classification extracted = Classification.builder()
                .sentiment("Negative")
                .priority(Priority.URGENT)
                .keywords(List.of("login"))
                .build();
        when(ingestionService.find(4)).thenReturn(Optional.of(stored));
        when(ingestionService.extract(stored)).thenReturn(extracted);

        StepVerifier.create(controller.get(4))
                .assertNext(resp -> {
                    MessagesController.MessageDetailResponse body = resp.getBody();
                    assertNotNull(body);
                    assertSame(stored, body.message());
                    assertEquals(List.of("login"), body.extracted().getKeywords());
                })
                .verifyComplete();
    }

    @Test
    void getShouldReturnNotFound() {
        when(ingestionService.find(anyLong())).thenReturn(Optional.empty());

        ResponseStatusException error = assertThrows(ResponseStatusException.class, () -> controller.get(99));
        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    @Test
    void regenerateShouldReturnUpdatedMessage() {
        SupportMessage updated = message(5).toBuilder().response("New reply").status(MessageStatus.RESPONDED).build();
        when(ingestionService.regenerate(5)).thenReturn(updated);

        StepVerifier.create(controller.regenerate(5))
                .assertNext(resp -> assertEquals("New reply", resp.getBody().getResponse()))
                .verifyComplete();
    }

    @Test
    void regenerateShouldPropagateMissingMessage() {
        when(ingestionService.regenerate(6)).thenThrow(new NoSuchElementException("Message not found: 6"));

        StepVerifier.create(controller.regenerate(6))
                .expectError(NoSuchElementException.class)
                .verify();
    }

    @Test
    void updateResponseShouldStoreOperatorText() {
        SupportMessage updated = message(7).toBuilder().response("Manual").status(MessageStatus.RESPONDED).build();
        when(ingestionService.updateResponse(7, "Manual")).thenReturn(updated);

        StepVerifier.create(controller.updateResponse(7, new ResponseUpdateRequest("Manual")))
                .assertNext(resp -> assertEquals(MessageStatus.RESPONDED, resp.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void updateResponseShouldRejectBlankText() {
        StepVerifier.create(controller.updateResponse(7, new ResponseUpdateRequest("  ")))
                .expectError(ResponseStatusException.class)
                .verify();
        verifyNoInteractions(ingestionService);
    }

    @Test
    void resolveShouldMarkResolved() {
        when(ingestionService.resolve(8)).thenReturn(message(8).toBuilder().status(MessageStatus.RESOLVED).build());

        StepVerifier.create(controller.resolve(8))
                .assertNext(resp -> assertEquals(MessageStatus.RESOLVED, resp.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void approveShouldReturnApprovedMessage() {
        SupportMessage approved = message(9).toBuilder()
                .approvedAt(RECEIVED.plusSeconds(30))
                .status(MessageStatus.RESPONDED)
                .build();
        when(ingestionService.approve(9)).thenReturn(approved);

        StepVerifier.create(controller.approve(9))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals(RECEIVED.plusSeconds(30), resp.getBody().getApprovedAt());
                })
                .verifyComplete();
    }

    @Test
    void sendShouldResolveMessage() {
        when(ingestionService.markSent(10)).thenReturn(message(10).toBuilder()
                .sentAt(RECEIVED.plusSeconds(60))
                .status(MessageStatus.RESOLVED)
                .build());

        StepVerifier.create(controller.markSent(10))
                .assertNext(resp -> {
                    assertEquals(MessageStatus.RESOLVED, resp.getBody().getStatus());
                    assertEquals(RECEIVED.plusSeconds(60), resp.getBody().getSentAt());
                })
                .verifyComplete();
    }

    @Test
    void sendShouldPropagateMissingMessage() {
        when(ingestionService.markSent(11)).thenThrow(new NoSuchElementException("Message not found: 11"));

        StepVerifier.create(controller.markSent(11))
                .expectError(NoSuchElementException.class)
                .verify();
    }
}
