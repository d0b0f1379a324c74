package me.golemcore.desk.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.desk.domain.model.AnalyticsSummary;
import me.golemcore.desk.domain.service.MessageIngestionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Inbox counters for dashboards.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final MessageIngestionService ingestionService;

    @GetMapping("/summary")
    public Mono<ResponseEntity<AnalyticsSummary>> summary() {
        return Mono.fromCallable(ingestionService::summarize)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
