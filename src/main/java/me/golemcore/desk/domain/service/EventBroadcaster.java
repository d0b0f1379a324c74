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

package me.golemcore.desk.domain.service;

import me.golemcore.desk.domain.model.BroadcastEvent;
import me.golemcore.desk.domain.model.MessageStatus;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of state-change events to live observers.
 *
 * <p>
 * Every subscription owns a bounded channel: a unicast sink backed by an
 * {@link ArrayBlockingQueue}. {@link #publish} never blocks. When a
 * subscriber's channel is full the event is dropped for that subscriber only;
 * other subscribers and later publishes are unaffected. A channel is
 * registered when the returned {@link Flux} is subscribed and removed when it
 * is cancelled or terminates.
 */
@Service
@Slf4j
public class EventBroadcaster {

    public static final String EVENT_EMAIL_CREATED = "email_created";
    public static final String EVENT_EMAIL_UPDATED = "email_updated";
    public static final String EVENT_KEEPALIVE = "keepalive";

    private final Object publishLock = new Object();
    private final Map<Long, Sinks.Many<BroadcastEvent>> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong subscriberIds = new AtomicLong(0);
    private final ObjectMapper objectMapper;
    private final int channelCapacity;

    public EventBroadcaster(DeskProperties properties, ObjectMapper objectMapper) {
        int capacity = properties.getBroadcast().getChannelCapacity();
        this.channelCapacity = capacity > 0 ? capacity : 100;
        this.objectMapper = objectMapper;
    }

    /**
     * Open a live event stream. The stream never completes on its own.
     */
    public Flux<BroadcastEvent> subscribe() {
        return Flux.defer(() -> {
            long id = subscriberIds.incrementAndGet();
            Sinks.Many<BroadcastEvent> channel = Sinks.many().unicast()
                    .onBackpressureBuffer(new ArrayBlockingQueue<>(channelCapacity));
            subscribers.put(id, channel);
            log.debug("[Broadcast] Subscriber {} connected ({} total)", id, subscribers.size());
            return channel.asFlux()
                    .doFinally(signal -> {
                        subscribers.remove(id);
                        log.debug("[Broadcast] Subscriber {} disconnected ({})", id, signal);
                    });
        });
    }

    /**
     * Offer an event to every registered subscriber.
     *
     * @return number of subscribers that accepted the event
     */
    public int publish(String name, String data) {
        BroadcastEvent event = new BroadcastEvent(name, data);
        int delivered = 0;
        synchronized (publishLock) {
            for (Map.Entry<Long, Sinks.Many<BroadcastEvent>> entry : subscribers.entrySet()) {
                Sinks.EmitResult result = entry.getValue().tryEmitNext(event);
                if (result.isSuccess()) {
                    delivered++;
                } else if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
                    log.debug("[Broadcast] Channel full for subscriber {}, dropped {}", entry.getKey(), name);
                } else if (result == Sinks.EmitResult.FAIL_CANCELLED || result == Sinks.EmitResult.FAIL_TERMINATED) {
                    subscribers.remove(entry.getKey());
                }
            }
        }
        return delivered;
    }

    public int publishMessageUpdate(long messageId, MessageStatus status) {
        return publish(EVENT_EMAIL_UPDATED, statusPayload(messageId, status));
    }

    public int publishMessageCreated(long messageId, MessageStatus status) {
        return publish(EVENT_EMAIL_CREATED, statusPayload(messageId, status));
    }

    public int publishKeepalive() {
        return publish(EVENT_KEEPALIVE, "{}");
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public int getChannelCapacity() {
        return channelCapacity;
    }

    private String statusPayload(long messageId, MessageStatus status) {
        return objectMapper.createObjectNode()
                .put("id", messageId)
                .put("status", status.value())
                .toString();
    }
}
