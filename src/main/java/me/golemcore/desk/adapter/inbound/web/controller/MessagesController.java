package me.golemcore.desk.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.desk.adapter.inbound.web.dto.IngestRequest;
import me.golemcore.desk.adapter.inbound.web.dto.MessagePageResponse;
import me.golemcore.desk.adapter.inbound.web.dto.ResponseUpdateRequest;
import me.golemcore.desk.domain.model.Classification;
import me.golemcore.desk.domain.model.MessageStatus;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.domain.model.SupportMessage;
import me.golemcore.desk.domain.service.MessageIngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Support message endpoints: ingestion, listing and operator actions.
 */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessagesController {

    private static final int DEFAULT_LIMIT = 50;

    private final MessageIngestionService ingestionService;

    @PostMapping
    public Mono<ResponseEntity<SupportMessage>> ingest(@RequestBody IngestRequest request) {
        if (request == null) {
            return Mono.error(badRequest("Request body is required"));
        }
        return Mono.fromCallable(() -> ingestionService.submit(
                request.getSender(), request.getSubject(), request.getBody(), request.getReceivedAt()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(created -> ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping
    public Mono<ResponseEntity<MessagePageResponse>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String priority,
            @RequestParam(required = false) String sentiment,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String domain,
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "" + DEFAULT_LIMIT) int limit,
            @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1) {
            return Mono.error(badRequest("limit must be positive"));
        }
        if (offset < 0) {
            return Mono.error(badRequest("offset must not be negative"));
        }

        MessageIngestionService.MessageFilter filter = new MessageIngestionService.MessageFilter(
                isBlank(status) ? null : MessageStatus.fromString(status),
                isBlank(priority) ? null : Priority.fromString(priority),
                isBlank(sentiment) ? null : sentiment.trim(),
                isBlank(source) ? null : source.trim(),
                isBlank(domain) ? null : domain.trim(),
                q);

        MessageIngestionService.MessagePage page = ingestionService.list(filter, limit, offset);
        MessagePageResponse response = MessagePageResponse.builder()
                .items(page.items())
                .total(page.total())
                .limit(page.limit())
                .offset(page.offset())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<MessageDetailResponse>> get(@PathVariable long id) {
        SupportMessage message = ingestionService.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Message not found: " + id));
        Classification extracted = ingestionService.extract(message);
        return Mono.just(ResponseEntity.ok(new MessageDetailResponse(message, extracted)));
    }

    @PostMapping("/{id}/regenerate")
    public Mono<ResponseEntity<SupportMessage>> regenerate(@PathVariable long id) {
        return Mono.fromCallable(() -> ingestionService.regenerate(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PutMapping("/{id}/response")
    public Mono<ResponseEntity<SupportMessage>> updateResponse(@PathVariable long id,
            @RequestBody ResponseUpdateRequest request) {
        if (request == null || isBlank(request.getResponse())) {
            return Mono.error(badRequest("response is required"));
        }
        return Mono.fromCallable(() -> ingestionService.updateResponse(id, request.getResponse()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/resolve")
    public Mono<ResponseEntity<SupportMessage>> resolve(@PathVariable long id) {
        return Mono.fromCallable(() -> ingestionService.resolve(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/approve")
    public Mono<ResponseEntity<SupportMessage>> approve(@PathVariable long id) {
        return Mono.fromCallable(() -> ingestionService.approve(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/send")
    public Mono<ResponseEntity<SupportMessage>> markSent(@PathVariable long id) {
        return Mono.fromCallable(() -> ingestionService.markSent(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record MessageDetailResponse(SupportMessage message, Classification extracted) {
    }
}
