package me.golemcore.desk.adapter.inbound.web.controller;

import me.golemcore.desk.auto.DiscoveryPoller;
import me.golemcore.desk.domain.loop.DispatchWorker;
import me.golemcore.desk.domain.model.FetchSummary;
import me.golemcore.desk.domain.model.GeneratorDiagnostics;
import me.golemcore.desk.domain.model.PollerStatus;
import me.golemcore.desk.domain.model.PingResult;
import me.golemcore.desk.domain.model.WorkerStatus;
import me.golemcore.desk.domain.service.ResponseGenerator;
import me.golemcore.desk.port.outbound.MailSourcePort.MailSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineControllerTest {

    private DiscoveryPoller discoveryPoller;
    private DispatchWorker dispatchWorker;
    private ResponseGenerator responseGenerator;
    private PipelineController controller;

    @BeforeEach
    void setUp() {
        discoveryPoller = mock(DiscoveryPoller.class);
        dispatchWorker = mock(DispatchWorker.class);
        responseGenerator = mock(ResponseGenerator.class);
        controller = new PipelineController(discoveryPoller, dispatchWorker, responseGenerator);
    }

    @Test
    void startFetchShouldReportChange() {
        when(discoveryPoller.start()).thenReturn(true);
        when(discoveryPoller.isRunning()).thenReturn(true);

        StepVerifier.create(controller.startFetch())
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    PipelineController.PipelineActionResponse body = resp.getBody();
                    assertNotNull(body);
                    assertEquals("fetch.start", body.action());
                    assertTrue(body.changed());
                    assertTrue(body.running());
                })
                .verifyComplete();
    }

    @Test
    void stopFetchWhenIdleShouldReportNoChange() {
        when(discoveryPoller.stop()).thenReturn(false);

        StepVerifier.create(controller.stopFetch())
                .assertNext(resp -> {
                    assertEquals("fetch.stop", resp.getBody().action());
                    assertFalse(resp.getBody().changed());
                    assertFalse(resp.getBody().running());
                })
                .verifyComplete();
    }

    @Test
    void runOnceShouldReturnSummary() {
        FetchSummary summary = new FetchSummary(Instant.parse("2026-02-01T10:00:00Z"), 4, 2, "gmail");
        when(discoveryPoller.pollOnce()).thenReturn(summary);

        StepVerifier.create(controller.runFetchOnce())
                .assertNext(resp -> assertSame(summary, resp.getBody()))
                .verifyComplete();
    }

    @Test
    void runOnceShouldPropagateMailFailure() {
        when(discoveryPoller.pollOnce()).thenThrow(new MailSourceException("IMAP error: timeout"));

        StepVerifier.create(controller.runFetchOnce())
                .expectError(MailSourceException.class)
                .verify();
    }

    @Test
    void fetchStatusShouldExposePollerState() {
        PollerStatus status = PollerStatus.builder().running(true).source("imap").intervalSeconds(120).build();
        when(discoveryPoller.status()).thenReturn(status);

        StepVerifier.create(controller.fetchStatus())
                .assertNext(resp -> assertEquals("imap", resp.getBody().getSource()))
                .verifyComplete();
    }

    @Test
    void workerStartAndStopShouldToggle() {
        when(dispatchWorker.start()).thenReturn(true);
        when(dispatchWorker.isRunning()).thenReturn(true);

        StepVerifier.create(controller.startWorker())
                .assertNext(resp -> {
                    assertEquals("worker.start", resp.getBody().action());
                    assertTrue(resp.getBody().running());
                })
                .verifyComplete();

        when(dispatchWorker.stop()).thenReturn(true);
        when(dispatchWorker.isRunning()).thenReturn(false);

        StepVerifier.create(controller.stopWorker())
                .assertNext(resp -> {
                    assertEquals("worker.stop", resp.getBody().action());
                    assertTrue(resp.getBody().changed());
                    assertFalse(resp.getBody().running());
                })
                .verifyComplete();
        verify(dispatchWorker).stop();
    }

    @Test
    void workerStatusShouldExposeQueue() {
        WorkerStatus status = WorkerStatus.builder().running(true).queueDepth(3).pendingJobs(List.of()).build();
        when(dispatchWorker.status()).thenReturn(status);

        StepVerifier.create(controller.workerStatus())
                .assertNext(resp -> assertEquals(3, resp.getBody().getQueueDepth()))
                .verifyComplete();
    }

    @Test
    void diagnosticsShouldComeFromGenerator() {
        GeneratorDiagnostics diagnostics = GeneratorDiagnostics.builder()
                .provider("openai")
                .model("gpt-4o-mini")
                .hasCredential(true)
                .build();
        when(responseGenerator.diagnostics()).thenReturn(diagnostics);

        StepVerifier.create(controller.generatorDiagnostics())
                .assertNext(resp -> assertEquals("gpt-4o-mini", resp.getBody().getModel()))
                .verifyComplete();
    }

    @Test
    void pingShouldReturnResult() {
        when(responseGenerator.ping()).thenReturn(PingResult.failure("openai", "gpt-4o-mini", "timeout"));

        StepVerifier.create(controller.pingGenerator())
                .assertNext(resp -> {
                    assertFalse(resp.getBody().ok());
                    assertEquals("timeout", resp.getBody().error());
                })
                .verifyComplete();
    }
}
