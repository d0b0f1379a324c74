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

package me.golemcore.desk.domain.loop;

import me.golemcore.desk.domain.model.DispatchJob;
import me.golemcore.desk.domain.model.JobState;
import me.golemcore.desk.domain.model.MessageStatus;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.domain.model.SupportMessage;
import me.golemcore.desk.domain.model.WorkerStatus;
import me.golemcore.desk.domain.service.EventBroadcaster;
import me.golemcore.desk.domain.service.LocalReplyTemplate;
import me.golemcore.desk.domain.service.MessageIngestionService;
import me.golemcore.desk.domain.service.ResponseDispatcher;
import me.golemcore.desk.domain.service.ResponseGenerator;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import me.golemcore.desk.port.outbound.KnowledgePort;
import me.golemcore.desk.port.outbound.MessageStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single consumer of the response job queue.
 *
 * <p>
 * Per job:
 * <pre>
 * PENDING → GENERATING → {COMPLETED, RETRY_SCHEDULED, FALLBACK_COMPLETED}
 * </pre>
 * Jobs for missing messages or messages that already carry a reply are
 * {@link JobState#DISCARDED}. A failure (exception or sentinel output) waits
 * the error delay, an empty reply waits the empty delay, and the job is pushed
 * back at the message's own priority. When the attempt ceiling is reached the
 * worker stores the local template reply and never re-enqueues the message.
 *
 * <p>
 * The loop thread runs until its stop signal is released. Idle waits and retry
 * delays await that signal, so {@link #stop()} is observed promptly; an
 * in-flight provider call is not interrupted.
 */
@Component
@Slf4j
public class DispatchWorker {

    private static final long JOIN_TIMEOUT_MS = 5000;

    private final ResponseDispatcher dispatcher;
    private final MessageStorePort store;
    private final KnowledgePort knowledge;
    private final ResponseGenerator generator;
    private final EventBroadcaster broadcaster;
    private final MessageIngestionService ingestionService;
    private final DeskProperties.DispatchProperties config;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile Thread loopThread;

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private volatile Instant lastProcessedAt;

    public DispatchWorker(ResponseDispatcher dispatcher, MessageStorePort store, KnowledgePort knowledge,
            ResponseGenerator generator, EventBroadcaster broadcaster, MessageIngestionService ingestionService,
            DeskProperties properties, Clock clock) {
        this.dispatcher = dispatcher;
        this.store = store;
        this.knowledge = knowledge;
        this.generator = generator;
        this.broadcaster = broadcaster;
        this.ingestionService = ingestionService;
        this.config = properties.getDispatch();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!config.isEnabled()) {
            log.info("[Dispatch] Worker disabled");
            return;
        }
        if (config.isRequeueOnStartup()) {
            int pushed = ingestionService.requeueUnanswered();
            log.info("[Dispatch] Re-derived {} jobs from stored messages", pushed);
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        Thread thread = loopThread;
        stop();
        if (thread != null) {
            try {
                thread.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Dispatch] Shut down");
    }

    /**
     * @return {@code false} if the worker was already running, or if a stopped
     *         loop is still finishing its current job
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (isRunning()) {
                return false;
            }
            Thread previous = loopThread;
            if (previous != null && previous.isAlive()) {
                log.warn("[Dispatch] Previous loop is still finishing a job, start refused");
                return false;
            }
            CountDownLatch signal = new CountDownLatch(1);
            stopSignal = signal;
            Thread thread = new Thread(() -> runLoop(signal), "dispatch-worker");
            thread.setDaemon(true);
            loopThread = thread;
            thread.start();
            log.info("[Dispatch] Worker started (max attempts: {}, idle wait: {}ms)",
                    dispatcher.getMaxAttempts(), config.getIdleWaitMs());
            return true;
        }
    }

    /**
     * Release the stop signal. The loop exits after its current iteration.
     *
     * @return {@code false} if the worker was not running
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            if (!isRunning()) {
                return false;
            }
            stopSignal.countDown();
            log.info("[Dispatch] Worker stop requested");
            return true;
        }
    }

    public boolean isRunning() {
        Thread thread = loopThread;
        return thread != null && thread.isAlive() && stopSignal.getCount() > 0;
    }

    public WorkerStatus status() {
        List<DispatchJob> pending = dispatcher.pendingJobs();
        return WorkerStatus.builder()
                .running(isRunning())
                .queueDepth(pending.size())
                .pendingJobs(pending)
                .completed(completed.get())
                .fallbacks(fallbacks.get())
                .retries(retries.get())
                .discarded(discarded.get())
                .lastProcessedAt(lastProcessedAt)
                .build();
    }

    /**
     * One loop iteration without the idle wait.
     *
     * @return {@code false} if the queue was empty
     */
    public boolean processNext() {
        return processNext(stopSignal);
    }

    /**
     * Run one job through the state machine. Never throws.
     */
    public JobState process(DispatchJob job) {
        return process(job, stopSignal);
    }

    private boolean processNext(CountDownLatch signal) {
        Optional<DispatchJob> job = dispatcher.poll();
        if (job.isEmpty()) {
            return false;
        }
        process(job.get(), signal);
        return true;
    }

    private JobState process(DispatchJob job, CountDownLatch signal) {
        JobState state;
        try {
            state = doProcess(job, signal);
        } catch (RuntimeException e) {
            log.error("[Dispatch] Unexpected failure for message {}", job.messageId(), e);
            state = JobState.DISCARDED;
        }
        lastProcessedAt = clock.instant();
        switch (state) {
        case COMPLETED -> completed.incrementAndGet();
        case FALLBACK_COMPLETED -> fallbacks.incrementAndGet();
        case RETRY_SCHEDULED -> retries.incrementAndGet();
        case DISCARDED -> discarded.incrementAndGet();
        default -> {
            // non-terminal states are not returned
        }
        }
        return state;
    }

    private JobState doProcess(DispatchJob job, CountDownLatch signal) {
        long messageId = job.messageId();
        Optional<SupportMessage> found = store.findById(messageId);
        if (found.isEmpty()) {
            log.warn("[Dispatch] Message {} not found, discarding job", messageId);
            dispatcher.clearAttempts(messageId);
            return JobState.DISCARDED;
        }
        SupportMessage message = found.get();
        if (message.hasResponse()) {
            log.debug("[Dispatch] Message {} already has a response, discarding job", messageId);
            dispatcher.clearAttempts(messageId);
            return JobState.DISCARDED;
        }

        log.debug("[Dispatch] Generating response for message {} ({})", messageId, priorityOf(message));
        String text;
        try {
            List<String> snippets = retrieveSnippets(message);
            text = generator.generate(message.getSubject(), message.getBody(), message.getSentiment(),
                    priorityOf(message), snippets);
        } catch (RuntimeException e) {
            log.error("[Dispatch] Generation failed for message {}: {}", messageId, e.getMessage());
            return handleFailure(message, config.getErrorRetryDelayMs(), signal);
        }

        if (text == null || text.isBlank()) {
            log.warn("[Dispatch] Empty response for message {}", messageId);
            return handleFailure(message, config.getEmptyRetryDelayMs(), signal);
        }
        if (ResponseGenerator.isSentinel(text)) {
            log.warn("[Dispatch] Provider unavailable for message {}: {}", messageId, text.trim());
            return handleFailure(message, config.getErrorRetryDelayMs(), signal);
        }

        boolean stored;
        try {
            stored = persistResponse(messageId, text);
        } catch (RuntimeException e) {
            log.error("[Dispatch] Failed to store response for message {}: {}", messageId, e.getMessage());
            return handleFailure(message, config.getErrorRetryDelayMs(), signal);
        }
        dispatcher.clearAttempts(messageId);
        if (!stored) {
            return JobState.DISCARDED;
        }
        log.info("[Dispatch] Message {} responded", messageId);
        return JobState.COMPLETED;
    }

    private JobState handleFailure(SupportMessage message, long retryDelayMs, CountDownLatch signal) {
        long messageId = message.getId();
        int attempt = dispatcher.recordFailure(messageId);

        if (dispatcher.isCeilingReached(attempt)) {
            log.warn("[Dispatch] Message {} reached {} attempts, storing local reply", messageId, attempt);
            boolean stored;
            try {
                stored = persistResponse(messageId,
                        LocalReplyTemplate.render(message.getSubject(), message.getBody(), priorityOf(message)));
            } catch (RuntimeException e) {
                log.error("[Dispatch] Failed to store local reply for message {}, retrying in {}ms: {}",
                        messageId, retryDelayMs, e.getMessage());
                awaitStop(signal, retryDelayMs);
                dispatcher.enqueue(messageId, priorityOf(message));
                return JobState.RETRY_SCHEDULED;
            }
            dispatcher.clearAttempts(messageId);
            return stored ? JobState.FALLBACK_COMPLETED : JobState.DISCARDED;
        }

        log.info("[Dispatch] Attempt {}/{} failed for message {}, retrying in {}ms", attempt,
                dispatcher.getMaxAttempts(), messageId, retryDelayMs);
        awaitStop(signal, retryDelayMs);
        dispatcher.enqueue(messageId, priorityOf(message));
        return JobState.RETRY_SCHEDULED;
    }

    /**
     * Store a reply on the current version of the record. An operator may have
     * answered, edited or resolved the message while the provider call was in
     * flight: a record that already carries a response is left untouched and a
     * resolved one stays resolved.
     *
     * @return {@code false} if the record is gone or already answered
     */
    private boolean persistResponse(long messageId, String text) {
        Optional<SupportMessage> current = store.findById(messageId);
        if (current.isEmpty()) {
            log.warn("[Dispatch] Message {} disappeared before its reply was stored", messageId);
            return false;
        }
        SupportMessage message = current.get();
        if (message.hasResponse()) {
            log.info("[Dispatch] Message {} was answered meanwhile, dropping generated reply", messageId);
            return false;
        }
        message.setResponse(text);
        if (message.getStatus() != MessageStatus.RESOLVED) {
            message.setStatus(MessageStatus.RESPONDED);
        }
        SupportMessage saved = store.save(message);
        broadcaster.publishMessageUpdate(saved.getId(), saved.getStatus());
        return true;
    }

    private List<String> retrieveSnippets(SupportMessage message) {
        try {
            return knowledge.retrieve(message.getSubject() + "\n" + message.getBody());
        } catch (RuntimeException e) {
            log.debug("[Dispatch] Knowledge retrieval failed: {}", e.getMessage());
            return List.of();
        }
    }

    private void runLoop(CountDownLatch signal) {
        log.debug("[Dispatch] Loop entered");
        while (signal.getCount() > 0 && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = processNext(signal);
            } catch (RuntimeException e) {
                log.error("[Dispatch] Loop iteration failed", e);
                worked = false;
            }
            if (!worked) {
                awaitStop(signal, config.getIdleWaitMs());
            }
        }
        log.info("[Dispatch] Worker stopped");
    }

    /**
     * Wait up to {@code millis}, returning early when the loop's own stop signal
     * is released.
     */
    private static void awaitStop(CountDownLatch signal, long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            signal.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Priority priorityOf(SupportMessage message) {
        return message.getPriority() != null ? message.getPriority() : Priority.NORMAL;
    }
}
