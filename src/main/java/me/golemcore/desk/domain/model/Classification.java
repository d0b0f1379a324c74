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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Classifier output for a message body.
 */
@Data
@Builder
public class Classification {

    private String sentiment;
    private Priority priority;

    @Builder.Default
    private List<String> phoneNumbers = List.of();

    @Builder.Default
    private List<String> alternateEmails = List.of();

    @Builder.Default
    private List<String> keywords = List.of();

    @Builder.Default
    private List<String> requestedActions = List.of();

    @Builder.Default
    private List<String> sentimentTerms = List.of();
}
