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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * In-memory queue of pending response jobs.
 *
 * <p>
 * Urgent jobs are always served before normal ones. Within a class jobs are
 * served in push order, using a monotonic sequence stamped at push time.
 *
 * <p>
 * Not thread-safe. Access is serialized by {@link ResponseDispatcher}.
 */
public class PriorityJobQueue {

    private final PriorityQueue<DispatchJob> heap = new PriorityQueue<>(DispatchJob.ORDER);
    private long nextSequence = 0;

    public DispatchJob push(long messageId, Priority priority) {
        DispatchJob job = new DispatchJob(messageId, priority != null ? priority : Priority.NORMAL, nextSequence++);
        heap.add(job);
        return job;
    }

    /**
     * Remove the highest-priority job. Never blocks.
     *
     * @return the job, or empty when the queue has no jobs
     */
    public Optional<DispatchJob> pop() {
        return Optional.ofNullable(heap.poll());
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    public boolean contains(long messageId) {
        for (DispatchJob job : heap) {
            if (job.messageId() == messageId) {
                return true;
            }
        }
        return false;
    }

    /**
     * Jobs in service order.
     */
    public List<DispatchJob> snapshot() {
        List<DispatchJob> jobs = new ArrayList<>(heap);
        jobs.sort(DispatchJob.ORDER);
        return jobs;
    }
}
