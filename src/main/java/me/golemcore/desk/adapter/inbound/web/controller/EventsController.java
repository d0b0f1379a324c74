package me.golemcore.desk.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.desk.domain.service.EventBroadcaster;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Live event stream for dashboards. Each subscriber gets its own bounded
 * channel; slow readers lose events instead of blocking publishers.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class EventsController {

    private final EventBroadcaster broadcaster;

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream() {
        return broadcaster.subscribe()
                .doOnSubscribe(subscription -> log.debug("[API] Event stream opened"))
                .map(event -> ServerSentEvent.<String>builder()
                        .event(event.name())
                        .data(event.data())
                        .build());
    }
}
