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

package me.golemcore.desk.domain.model;

import java.time.Instant;

/**
 * Raw message returned by a mailbox connector, before classification.
 *
 * @param receivedAt
 *            sent or received date, {@code null} when the mail carries none
 * @param externalId
 *            provider-native identifier, {@code null} when the mailbox offers
 *            none
 */
public record InboundMail(String sender, String subject, String body, Instant receivedAt, String externalId) {

    public boolean hasExternalId() {
        return externalId != null && !externalId.isBlank();
    }
}
