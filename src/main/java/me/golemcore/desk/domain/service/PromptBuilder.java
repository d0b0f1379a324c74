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

import me.golemcore.desk.domain.model.GenerationRequest;
import me.golemcore.desk.domain.model.ReplyContext;

/**
 * Builds provider requests for support replies.
 *
 * <p>
 * Three shapes exist: the regular request, a stricter zero-temperature request
 * used after empty output, and a salvage request with a truncated body and a
 * small output cap used after a quota error.
 */
public class PromptBuilder {

    static final String SYSTEM_PROMPT = "You are a professional, empathetic customer support assistant. "
            + "Always respond with concise, actionable guidance.";
    static final String STRICT_INSTRUCTION = "Reply with the support email text only. "
            + "Do not leave the reply empty.";
    static final String PING_PROMPT = "Ping";

    private static final int SNIPPET_MAX_CHARS = 300;

    private final int maxOutputTokens;
    private final double temperature;
    private final int salvageBodyChars;
    private final int salvageMaxOutputTokens;

    public PromptBuilder(int maxOutputTokens, double temperature, int salvageBodyChars,
            int salvageMaxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
        this.temperature = temperature;
        this.salvageBodyChars = salvageBodyChars;
        this.salvageMaxOutputTokens = salvageMaxOutputTokens;
    }

    public GenerationRequest regular(ReplyContext context) {
        return GenerationRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .prompt(renderPrompt(context, context.body()))
                .maxOutputTokens(maxOutputTokens)
                .temperature(temperature)
                .build();
    }

    public GenerationRequest strict(ReplyContext context) {
        return GenerationRequest.builder()
                .systemPrompt(SYSTEM_PROMPT + " " + STRICT_INSTRUCTION)
                .prompt(renderPrompt(context, context.body()))
                .maxOutputTokens(maxOutputTokens)
                .temperature(0.0)
                .build();
    }

    public GenerationRequest salvage(ReplyContext context) {
        ReplyContext reduced = context.withoutSnippets();
        String body = reduced.body().length() > salvageBodyChars
                ? reduced.body().substring(0, salvageBodyChars)
                : reduced.body();
        return GenerationRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .prompt(renderPrompt(reduced, body))
                .maxOutputTokens(salvageMaxOutputTokens)
                .temperature(temperature)
                .build();
    }

    public GenerationRequest ping() {
        return GenerationRequest.builder()
                .prompt(PING_PROMPT)
                .maxOutputTokens(16)
                .temperature(0.0)
                .build();
    }

    private String renderPrompt(ReplyContext context, String body) {
        StringBuilder sb = new StringBuilder();
        if (!context.snippets().isEmpty()) {
            sb.append("Context:\n");
            for (String snippet : context.snippets()) {
                String text = snippet.length() > SNIPPET_MAX_CHARS ? snippet.substring(0, SNIPPET_MAX_CHARS) : snippet;
                sb.append("Doc snippet: ").append(text).append('\n');
            }
            sb.append('\n');
        }
        sb.append("Subject: ").append(context.subject()).append('\n');
        sb.append("Sentiment: ").append(context.sentiment()).append('\n');
        sb.append("Priority: ").append(context.priority().label()).append('\n');
        sb.append("Customer email:\n").append(body).append("\n\n");
        sb.append("Draft a helpful support reply:");
        return sb.toString();
    }
}
