package me.golemcore.desk.adapter.outbound.mail;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MailBodyTextTest {

    @Test
    void stripHtmlKeepsLineStructure() {
        String html = "<p>Hi</p><div>Line one<br/>Line two</div>";

        assertEquals("Hi\nLine one\nLine two", MailBodyText.stripHtml(html));
    }

    @Test
    void stripHtmlDecodesEntities() {
        assertEquals("a < b & \"c\"", MailBodyText.stripHtml("<span>a &lt; b &amp; &quot;c&quot;</span>"));
    }

    @Test
    void stripHtmlOfBlankIsEmpty() {
        assertEquals("", MailBodyText.stripHtml(null));
        assertEquals("", MailBodyText.stripHtml("  "));
    }

    @Test
    void plainTextWithoutTagsIsNotHtml() {
        assertFalse(MailBodyText.looksLikeHtml("Order total is 3 < 5, please advise."));
        assertFalse(MailBodyText.looksLikeHtml("No markup at all"));
    }

    @Test
    void structuralMarkersMakeHtml() {
        assertTrue(MailBodyText.looksLikeHtml("Long text long text long text long text <div class=\"x\">hi</div>"
                + " and more text to keep the ratio low, really quite a lot of text here <table></table>"));
    }

    @Test
    void denseTagsMakeHtml() {
        assertTrue(MailBodyText.looksLikeHtml("<b>hi</b>"));
    }
}
