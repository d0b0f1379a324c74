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

package me.golemcore.desk.adapter.outbound.classifier;

import me.golemcore.desk.domain.model.Classification;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.port.outbound.ClassifierPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical classifier for support mail.
 *
 * <p>
 * Urgency is decided by hint phrases in subject or body. Sentiment compares
 * counts of positive and negative hint words. Hints match on word boundaries,
 * so {@code down} does not match {@code download}.
 */
@Component
public class KeywordClassifierAdapter implements ClassifierPort {

    static final String SENTIMENT_POSITIVE = "Positive";
    static final String SENTIMENT_NEGATIVE = "Negative";
    static final String SENTIMENT_NEUTRAL = "Neutral";

    private static final List<String> PRIORITY_HINTS = List.of(
            "immediately", "critical", "cannot access", "urgent", "down", "failure");
    private static final List<String> NEGATIVE_HINTS = List.of(
            "angry", "frustrated", "upset", "bad", "worst", "unhappy", "disappointed");
    private static final List<String> POSITIVE_HINTS = List.of(
            "great", "excellent", "happy", "appreciate", "love", "awesome", "pleased", "wonderful", "good");
    private static final List<String> ACTION_TERMS = List.of(
            "reset", "refund", "cancel", "update", "upgrade", "unlock", "activate", "deactivate", "remove", "add");
    private static final Set<String> STOP_WORDS = Set.of(
            "this", "that", "have", "with", "from", "subject", "please", "thanks", "thank", "regarding", "about",
            "their", "there", "would", "could", "should", "hello", "team", "your", "issue", "request", "problem");

    private static final int MAX_KEYWORDS = 8;

    private static final Pattern PHONE_PATTERN = Pattern.compile("\\+?\\d[\\d\\-\\s]{7,}\\d");
    private static final Pattern EMAIL_PATTERN = Pattern
            .compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[a-z]{4,18}");

    @Override
    public Classification classify(String subject, String body) {
        String text = (subject != null ? subject : "") + "\n" + (body != null ? body : "");
        String lowered = text.toLowerCase(Locale.ROOT);

        List<String> negativeTerms = matchingTerms(NEGATIVE_HINTS, lowered);
        List<String> positiveTerms = matchingTerms(POSITIVE_HINTS, lowered);

        return Classification.builder()
                .sentiment(sentiment(positiveTerms.size(), negativeTerms.size()))
                .priority(matchingTerms(PRIORITY_HINTS, lowered).isEmpty() ? Priority.NORMAL : Priority.URGENT)
                .phoneNumbers(findAll(PHONE_PATTERN, text))
                .alternateEmails(findAll(EMAIL_PATTERN, text))
                .keywords(keywords(lowered))
                .requestedActions(new ArrayList<>(new TreeSet<>(matchingTerms(ACTION_TERMS, lowered))))
                .sentimentTerms(negativeTerms)
                .build();
    }

    private String sentiment(int positive, int negative) {
        if (negative > positive) {
            return SENTIMENT_NEGATIVE;
        }
        if (positive > negative) {
            return SENTIMENT_POSITIVE;
        }
        return SENTIMENT_NEUTRAL;
    }

    private List<String> keywords(String lowered) {
        Set<String> keywords = new LinkedHashSet<>();
        Matcher matcher = TOKEN_PATTERN.matcher(lowered);
        while (matcher.find() && keywords.size() < MAX_KEYWORDS) {
            String token = matcher.group();
            if (!STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return List.copyOf(keywords);
    }

    private static List<String> matchingTerms(List<String> terms, String lowered) {
        List<String> found = new ArrayList<>();
        for (String term : terms) {
            if (Pattern.compile("\\b" + Pattern.quote(term) + "\\b").matcher(lowered).find()) {
                found.add(term);
            }
        }
        return found;
    }

    private static List<String> findAll(Pattern pattern, String text) {
        List<String> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            matches.add(matcher.group().trim());
        }
        return matches;
    }
}
