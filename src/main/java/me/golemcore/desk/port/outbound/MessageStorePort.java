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

package me.golemcore.desk.port.outbound;

import me.golemcore.desk.domain.model.SupportMessage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for durable support message records.
 *
 * <p>
 * The poller and the dispatch worker each persist their own unit of work
 * through this port; no operation spans both.
 */
public interface MessageStorePort {

    /**
     * Persist a new record and assign its id.
     *
     * @param message
     *            record without an id
     * @return the stored record with id and timestamps filled in
     */
    SupportMessage create(SupportMessage message);

    /**
     * Replace an existing record.
     *
     * @throws IllegalArgumentException
     *             if no record with that id exists
     */
    SupportMessage save(SupportMessage message);

    Optional<SupportMessage> findById(long id);

    Optional<SupportMessage> findByExternalId(String externalId);

    /**
     * Exact match on sender, subject and received-at, used when the source has
     * no native identifier. A {@code null} received-at matches any date but
     * requires the same body instead.
     */
    Optional<SupportMessage> findBySignature(String sender, String subject, String body, Instant receivedAt);

    /**
     * All records, newest received first.
     */
    List<SupportMessage> findAll();

    /**
     * Records that still need a generated reply, oldest first.
     */
    List<SupportMessage> findWithoutResponse();

    int count();
}
