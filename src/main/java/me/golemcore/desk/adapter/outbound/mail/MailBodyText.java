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

package me.golemcore.desk.adapter.outbound.mail;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns mail HTML into plain text and detects HTML that senders put into
 * {@code text/plain} parts.
 */
final class MailBodyText {

    private static final Pattern BREAK_TAGS = Pattern.compile("<\\s*br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern BLOCK_END_TAGS = Pattern.compile("</(p|div|tr|table|li|h[1-6])\\s*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL_TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern SHORT_TAGS = Pattern.compile("<[^>]{1,200}>");
    private static final Pattern MULTI_SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]+");
    private static final Pattern MULTI_NEWLINES = Pattern.compile("\\s*\\n\\s*");
    private static final String[] HTML_MARKERS = { "<html", "<body", "<table", "</tr", "</td", "<div",
            "<!doctype", "<span", "<p", "style=", "class=" };

    private MailBodyText() {
    }

    static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String result = BREAK_TAGS.matcher(html).replaceAll("\n");
        result = BLOCK_END_TAGS.matcher(result).replaceAll("\n");
        result = ALL_TAGS.matcher(result).replaceAll(" ");
        result = decodeEntities(result);
        result = MULTI_SPACES.matcher(result).replaceAll(" ");
        result = MULTI_NEWLINES.matcher(result).replaceAll("\n");
        return result.strip();
    }

    /**
     * Plain-text body that is really HTML: at least two structural markers,
     * more than eight tags, or tags making up over 4% of the text.
     */
    static boolean looksLikeHtml(String text) {
        if (text == null || text.indexOf('<') < 0 || text.indexOf('>') < 0) {
            return false;
        }
        Matcher matcher = SHORT_TAGS.matcher(text);
        int tagCount = 0;
        int tagChars = 0;
        while (matcher.find()) {
            tagCount++;
            tagChars += matcher.group().length();
        }
        if (tagCount == 0) {
            return false;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        int markers = 0;
        for (String marker : HTML_MARKERS) {
            if (lowered.contains(marker)) {
                markers++;
            }
        }
        double ratio = (double) tagChars / Math.max(1, text.length());
        return markers >= 2 || tagCount > 8 || ratio > 0.04;
    }

    private static String decodeEntities(String text) {
        return text
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
