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

import me.golemcore.desk.domain.model.DispatchJob;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.infrastructure.config.DeskProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide owner of the job queue and the attempt table.
 *
 * <p>
 * Producers (poller, API ingestion) call {@link #enqueue}; the dispatch worker
 * is the only consumer. Both structures are guarded by one lock so that
 * attempt bookkeeping and re-enqueue decisions see a consistent view.
 *
 * <p>
 * A message is enqueued at most once at a time: pushing a message that already
 * has a queued job is a no-op.
 */
@Service
@Slf4j
public class ResponseDispatcher {

    private final PriorityJobQueue queue = new PriorityJobQueue();
    private final Map<Long, Integer> attempts = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int maxAttempts;

    public ResponseDispatcher(DeskProperties properties) {
        this.maxAttempts = Math.max(1, properties.getDispatch().getMaxAttempts());
    }

    /**
     * Queue a response job.
     *
     * @return {@code true} if a job was pushed, {@code false} if the message was
     *         already queued
     */
    public boolean enqueue(long messageId, Priority priority) {
        lock.lock();
        try {
            if (queue.contains(messageId)) {
                log.debug("[Dispatch] Message {} already queued, skipping", messageId);
                return false;
            }
            DispatchJob job = queue.push(messageId, priority);
            log.debug("[Dispatch] Enqueued message {} ({}), depth {}", messageId, job.priority(), queue.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queue a response job using a priority class name such as {@code urgent},
     * {@code normal} or a stored label.
     */
    public boolean enqueue(long messageId, String priorityClass) {
        return enqueue(messageId, Priority.fromString(priorityClass));
    }

    public Optional<DispatchJob> poll() {
        lock.lock();
        try {
            return queue.pop();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record one failed attempt.
     *
     * @return the attempt count after this failure, never above the ceiling
     */
    public int recordFailure(long messageId) {
        lock.lock();
        try {
            int next = Math.min(attempts.getOrDefault(messageId, 0) + 1, maxAttempts);
            attempts.put(messageId, next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    public void clearAttempts(long messageId) {
        lock.lock();
        try {
            attempts.remove(messageId);
        } finally {
            lock.unlock();
        }
    }

    public int attempts(long messageId) {
        lock.lock();
        try {
            return attempts.getOrDefault(messageId, 0);
        } finally {
            lock.unlock();
        }
    }

    public boolean isCeilingReached(int attemptCount) {
        return attemptCount >= maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public int queueDepth() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public List<DispatchJob> pendingJobs() {
        lock.lock();
        try {
            return queue.snapshot();
        } finally {
            lock.unlock();
        }
    }
}
