package me.golemcore.desk.adapter.outbound.classifier;

import me.golemcore.desk.domain.model.Classification;
import me.golemcore.desk.domain.model.Priority;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordClassifierAdapterTest {

    private final KeywordClassifierAdapter classifier = new KeywordClassifierAdapter();

    @Test
    void outageWithAngerIsUrgentAndNegative() {
        Classification result = classifier.classify("Site down",
                "Our dashboard has been down for an hour and I am frustrated.");

        assertEquals(Priority.URGENT, result.getPriority());
        assertEquals(KeywordClassifierAdapter.SENTIMENT_NEGATIVE, result.getSentiment());
        assertEquals(List.of("frustrated"), result.getSentimentTerms());
    }

    @Test
    void subjectAloneCanMakeMessageUrgent() {
        Classification result = classifier.classify("URGENT: billing", "Please look at my invoice.");

        assertEquals(Priority.URGENT, result.getPriority());
    }

    @Test
    void urgencyHintsMatchWholeWordsOnly() {
        Classification result = classifier.classify("Download link", "The download page shows a badge.");

        assertEquals(Priority.NORMAL, result.getPriority());
        assertEquals(KeywordClassifierAdapter.SENTIMENT_NEUTRAL, result.getSentiment());
    }

    @Test
    void multiWordHintIsRecognized() {
        Classification result = classifier.classify("Login", "I cannot access my account");

        assertEquals(Priority.URGENT, result.getPriority());
    }

    @Test
    void positiveHintsOutweighingNegativeGivePositive() {
        Classification result = classifier.classify("Thanks",
                "Great support, I really appreciate the quick answer.");

        assertEquals(KeywordClassifierAdapter.SENTIMENT_POSITIVE, result.getSentiment());
        assertTrue(result.getSentimentTerms().isEmpty());
    }

    @Test
    void balancedHintsAreNeutral() {
        Classification result = classifier.classify("Mixed", "The app is good but the export is bad.");

        assertEquals(KeywordClassifierAdapter.SENTIMENT_NEUTRAL, result.getSentiment());
    }

    @Test
    void extractsContactDetailsAndActions() {
        Classification result = classifier.classify("Account",
                "Call me at +1 555-123-4567 or write to jane.doe@example.org. Please reset and refund.");

        assertEquals(List.of("+1 555-123-4567"), result.getPhoneNumbers());
        assertEquals(List.of("jane.doe@example.org"), result.getAlternateEmails());
        assertEquals(List.of("refund", "reset"), result.getRequestedActions());
    }

    @Test
    void keywordsSkipStopWordsAndDuplicates() {
        Classification result = classifier.classify("Billing",
                "Hello team, please update billing address for invoice");

        assertEquals(List.of("billing", "update", "address", "invoice"), result.getKeywords());
    }

    @Test
    void keywordsAreCappedAtEight() {
        Classification result = classifier.classify("",
                "alpha bravo charlie delta echo foxtrot golf hotel india juliet");

        assertEquals(8, result.getKeywords().size());
        assertEquals("alpha", result.getKeywords().get(0));
    }

    @Test
    void nullInputIsTolerated() {
        Classification result = classifier.classify(null, null);

        assertEquals(Priority.NORMAL, result.getPriority());
        assertTrue(result.getKeywords().isEmpty());
    }
}
