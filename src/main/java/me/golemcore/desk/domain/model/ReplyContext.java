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

import java.util.List;

/**
 * Inputs of one reply generation.
 *
 * @param subject
 *            message subject, may be empty
 * @param body
 *            message body, may be empty
 * @param sentiment
 *            classifier sentiment label
 * @param priority
 *            priority class
 * @param snippets
 *            knowledge snippets, possibly empty
 */
public record ReplyContext(String subject, String body, String sentiment, Priority priority, List<String> snippets) {

    public ReplyContext {
        subject = subject != null ? subject : "";
        body = body != null ? body : "";
        sentiment = sentiment != null && !sentiment.isBlank() ? sentiment : "Neutral";
        priority = priority != null ? priority : Priority.NORMAL;
        snippets = snippets != null ? List.copyOf(snippets) : List.of();
    }

    public ReplyContext withoutSnippets() {
        return new ReplyContext(subject, body, sentiment, priority, List.of());
    }
}
