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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable record of one support message and its generated reply.
 *
 * <p>
 * Created by ingestion (poller or API) with no response and status
 * {@link MessageStatus#PENDING}. The dispatch worker fills {@code response} and
 * moves the status to {@link MessageStatus#RESPONDED}. An operator may then
 * approve the reply ({@code approvedAt}) and mark it sent ({@code sentAt}),
 * which resolves the message.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SupportMessage {

    private long id;
    private String sender;
    private String subject;
    private String body;
    private Instant receivedAt;
    private String sentiment;
    private Priority priority;
    private String response;

    @Builder.Default
    private MessageStatus status = MessageStatus.PENDING;

    @Builder.Default
    private String source = "unknown";

    private String externalId;
    private Instant approvedAt;
    private Instant sentAt;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasResponse() {
        return response != null && !response.isBlank();
    }
}
