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

import me.golemcore.desk.domain.model.Priority;

import java.util.Locale;

/**
 * Deterministic network-free reply used when no remote generation succeeds.
 *
 * <p>
 * Output depends only on subject, body and priority. Never fails.
 */
public final class LocalReplyTemplate {

    static final int SUMMARY_MAX_CHARS = 240;

    private static final String INTRO_DEFAULT = "Thank you for contacting support.";
    private static final String INTRO_PASSWORD = "Thanks for reaching out about your password issue.";
    private static final String ACTION_DEFAULT = "We'll investigate and get back to you shortly.";
    private static final String ACTION_URGENT = "We're treating this as high priority and will update you ASAP.";
    private static final String CLOSING = "Kind regards,\nSupport Team";

    private LocalReplyTemplate() {
    }

    public static String render(String subject, String body, Priority priority) {
        String safeSubject = subject != null ? subject : "";
        String safeBody = body != null ? body : "";

        String summary = safeBody.length() > SUMMARY_MAX_CHARS
                ? safeBody.substring(0, SUMMARY_MAX_CHARS) + "..."
                : safeBody;
        String intro = safeBody.toLowerCase(Locale.ROOT).contains("password") ? INTRO_PASSWORD : INTRO_DEFAULT;
        String action = priority == Priority.URGENT ? ACTION_URGENT : ACTION_DEFAULT;

        return "Subject: Re: " + safeSubject + "\n\n"
                + intro + "\n\n"
                + "I reviewed your message: \n" + summary + "\n\n"
                + action + "\n\n"
                + CLOSING;
    }
}
