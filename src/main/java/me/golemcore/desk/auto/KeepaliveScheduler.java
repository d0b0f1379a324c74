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

import me.golemcore.desk.domain.service.EventBroadcaster;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Publishes a {@code keepalive} event at a fixed rate so idle event streams
 * are not closed by intermediaries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeepaliveScheduler {

    private final EventBroadcaster broadcaster;
    private final DeskProperties properties;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    public void init() {
        int interval = properties.getBroadcast().getKeepaliveSeconds();
        if (interval <= 0) {
            log.info("[Broadcast] Keepalive disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "broadcast-keepalive");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.SECONDS);
        log.info("[Broadcast] Keepalive every {}s", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    void tick() {
        try {
            int delivered = broadcaster.publishKeepalive();
            log.trace("[Broadcast] Keepalive delivered to {} subscribers", delivered);
        } catch (RuntimeException e) {
            log.warn("[Broadcast] Keepalive failed: {}", e.getMessage());
        }
    }
}
