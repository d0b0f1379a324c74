package me.golemcore.desk.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.desk.auto.DiscoveryPoller;
import me.golemcore.desk.domain.loop.DispatchWorker;
import me.golemcore.desk.domain.model.FetchSummary;
import me.golemcore.desk.domain.model.GeneratorDiagnostics;
import me.golemcore.desk.domain.model.PollerStatus;
import me.golemcore.desk.domain.model.PingResult;
import me.golemcore.desk.domain.model.WorkerStatus;
import me.golemcore.desk.domain.service.ResponseGenerator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Pipeline control: discovery poller, dispatch worker and generator
 * diagnostics.
 */
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final DiscoveryPoller discoveryPoller;
    private final DispatchWorker dispatchWorker;
    private final ResponseGenerator responseGenerator;

    // ==================== Discovery ====================

    @PostMapping("/fetch/start")
    public Mono<ResponseEntity<PipelineActionResponse>> startFetch() {
        boolean changed = discoveryPoller.start();
        return Mono.just(ResponseEntity.ok(new PipelineActionResponse("fetch.start", changed,
                discoveryPoller.isRunning())));
    }

    @PostMapping("/fetch/stop")
    public Mono<ResponseEntity<PipelineActionResponse>> stopFetch() {
        boolean changed = discoveryPoller.stop();
        return Mono.just(ResponseEntity.ok(new PipelineActionResponse("fetch.stop", changed,
                discoveryPoller.isRunning())));
    }

    @PostMapping("/fetch/run-once")
    public Mono<ResponseEntity<FetchSummary>> runFetchOnce() {
        return Mono.fromCallable(discoveryPoller::pollOnce)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/fetch/status")
    public Mono<ResponseEntity<PollerStatus>> fetchStatus() {
        return Mono.just(ResponseEntity.ok(discoveryPoller.status()));
    }

    // ==================== Dispatch worker ====================

    @PostMapping("/worker/start")
    public Mono<ResponseEntity<PipelineActionResponse>> startWorker() {
        boolean changed = dispatchWorker.start();
        return Mono.just(ResponseEntity.ok(new PipelineActionResponse("worker.start", changed,
                dispatchWorker.isRunning())));
    }

    @PostMapping("/worker/stop")
    public Mono<ResponseEntity<PipelineActionResponse>> stopWorker() {
        boolean changed = dispatchWorker.stop();
        return Mono.just(ResponseEntity.ok(new PipelineActionResponse("worker.stop", changed,
                dispatchWorker.isRunning())));
    }

    @GetMapping("/worker/status")
    public Mono<ResponseEntity<WorkerStatus>> workerStatus() {
        return Mono.just(ResponseEntity.ok(dispatchWorker.status()));
    }

    // ==================== Generator ====================

    @GetMapping("/generator/diagnostics")
    public Mono<ResponseEntity<GeneratorDiagnostics>> generatorDiagnostics() {
        return Mono.just(ResponseEntity.ok(responseGenerator.diagnostics()));
    }

    @PostMapping("/generator/ping")
    public Mono<ResponseEntity<PingResult>> pingGenerator() {
        return Mono.fromCallable(responseGenerator::ping)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    public record PipelineActionResponse(String action, boolean changed, boolean running) {
    }
}
