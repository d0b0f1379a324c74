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

package me.golemcore.desk.auto;

import me.golemcore.desk.domain.model.FetchSummary;
import me.golemcore.desk.domain.model.InboundMail;
import me.golemcore.desk.domain.model.PollerStatus;
import me.golemcore.desk.domain.service.MessageIngestionService;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import me.golemcore.desk.port.outbound.MailSourcePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed-interval discovery of new support mail.
 *
 * <p>
 * Each cycle fetches a bounded batch from the {@link MailSourcePort} and hands
 * every mail to {@link MessageIngestionService#ingest}, which dedupes,
 * persists and queues it. The poller never generates replies itself.
 *
 * <p>
 * A failed cycle is logged and the next cycle runs on schedule. Stopping
 * cancels future cycles; a fetch already in progress is allowed to finish.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class DiscoveryPoller {

    private final MailSourcePort mailSource;
    private final MessageIngestionService ingestionService;
    private final DeskProperties.PollerProperties config;
    private final Clock clock;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pollTask;
    private volatile FetchSummary lastSummary;
    private volatile String lastError;

    public DiscoveryPoller(MailSourcePort mailSource, MessageIngestionService ingestionService,
            DeskProperties properties, Clock clock) {
        this.mailSource = mailSource;
        this.ingestionService = ingestionService;
        this.config = properties.getPoller();
        this.clock = clock;
        this.lastSummary = FetchSummary.never(mailSource.getSourceName());
    }

    @PostConstruct
    public void init() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "discovery-poller");
            t.setDaemon(true);
            return t;
        });

        if (!config.isEnabled()) {
            log.info("[Poller] Auto-start disabled");
            return;
        }
        if (!mailSource.isEnabled()) {
            log.info("[Poller] Mail source '{}' disabled, not starting", mailSource.getSourceName());
            return;
        }
        start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Poller] Shut down");
    }

    /**
     * @return {@code false} if polling was already active
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (isRunning()) {
                return false;
            }
            int interval = Math.max(1, config.getIntervalSeconds());
            pollTask = scheduler.scheduleWithFixedDelay(this::tick, 0, interval, TimeUnit.SECONDS);
            log.info("[Poller] Started with interval: {}s, batch: {}, source: {}", interval,
                    config.getBatchSize(), mailSource.getSourceName());
            return true;
        }
    }

    /**
     * @return {@code false} if polling was not active
     */
    public boolean stop() {
        synchronized (lifecycleLock) {
            if (!isRunning()) {
                return false;
            }
            pollTask.cancel(false);
            pollTask = null;
            log.info("[Poller] Stopped");
            return true;
        }
    }

    public boolean isRunning() {
        ScheduledFuture<?> task = pollTask;
        return task != null && !task.isDone();
    }

    /**
     * Run one discovery cycle immediately.
     *
     * @throws MailSourcePort.MailSourceException
     *             if the mailbox cannot be read
     * @throws IllegalStateException
     *             if another cycle is in progress
     */
    public FetchSummary pollOnce() {
        if (!executing.compareAndSet(false, true)) {
            throw new IllegalStateException("A discovery cycle is already running");
        }
        try {
            List<InboundMail> mails = mailSource.fetch(Math.max(1, config.getBatchSize()));
            int inserted = 0;
            for (InboundMail mail : mails) {
                try {
                    if (ingestionService.ingest(mail, mailSource.getSourceName()).isPresent()) {
                        inserted++;
                    }
                } catch (RuntimeException e) {
                    log.error("[Poller] Failed to ingest mail from {}: {}", mail.sender(), e.getMessage());
                }
            }
            FetchSummary summary = new FetchSummary(clock.instant(), mails.size(), inserted,
                    mailSource.getSourceName());
            lastSummary = summary;
            lastError = null;
            if (mails.isEmpty()) {
                log.debug("[Poller] Cycle: no new mail from {}", mailSource.getSourceName());
            } else {
                log.info("[Poller] Cycle: fetched {}, inserted {} from {}", mails.size(), inserted,
                        mailSource.getSourceName());
            }
            return summary;
        } finally {
            executing.set(false);
        }
    }

    public FetchSummary getLastSummary() {
        return lastSummary;
    }

    public PollerStatus status() {
        FetchSummary summary = lastSummary;
        return PollerStatus.builder()
                .running(isRunning())
                .source(mailSource.getSourceName())
                .intervalSeconds(config.getIntervalSeconds())
                .batchSize(config.getBatchSize())
                .lastPollAt(summary.timestamp())
                .lastFetched(summary.fetched())
                .lastInserted(summary.inserted())
                .lastError(lastError)
                .build();
    }

    void tick() {
        try {
            pollOnce();
        } catch (IllegalStateException e) {
            log.debug("[Poller] Tick skipped: {}", e.getMessage());
        } catch (Exception e) {
            lastError = e.getMessage();
            log.error("[Poller] Cycle failed: {}", e.getMessage(), e);
        }
    }
}
