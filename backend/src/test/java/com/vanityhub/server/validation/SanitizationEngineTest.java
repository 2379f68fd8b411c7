package com.vanityhub.server.validation;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SanitizationEngineTest {

    private final SanitizationEngine engine = new SanitizationEngine();

    // ===== sanitizeString =====

    @Test
    void shouldStripControlCharactersAndTrim() {
        assertEquals("hello world", engine.sanitizeString("  hel\u0000lo\u0007 wor\u007Fld\n "));
    }

    @Test
    void shouldReturnEmptyStringForNull() {
        assertEquals("", engine.sanitizeString(null));
    }

    @Test
    void shouldCapLongStrings() {
        String longInput = "a".repeat(SanitizationEngine.MAX_STRING_LENGTH + 500);
        assertEquals(SanitizationEngine.MAX_STRING_LENGTH, engine.sanitizeString(longInput).length());
    }

    @Test
    void shouldBeIdempotent() {
        List<String> inputs = List.of(
                "  plain  ",
                "\t\u0001tabs\u0002 and\r\ncontrols\u001F ",
                "x".repeat(9_999) + "   " + "y".repeat(50),
                "emoji 😀 ok",
                "a".repeat(9_999) + "😀" + "tail");
        for (String input : inputs) {
            String once = engine.sanitizeString(input);
            assertEquals(once, engine.sanitizeString(once), "not idempotent for: " + input.substring(0, 10));
        }
    }

    @Test
    void shouldNotSplitSurrogatePairAtCap() {
        String input = "a".repeat(SanitizationEngine.MAX_STRING_LENGTH - 1) + "😀";
        String result = engine.sanitizeString(input);
        assertFalse(Character.isHighSurrogate(result.charAt(result.length() - 1)));
    }

    // ===== sanitizeObject =====

    @Test
    void shouldSanitizeNestedStringLeavesOnly() {
        Map<String, Object> input = Map.of(
                "name", "  Jane\u0000 ",
                "tags", List.of(" a ", 3, Map.of("deep", "\u0007x ")),
                "count", 5,
                "active", true);

        @SuppressWarnings("unchecked")
        Map<String, Object> out = (Map<String, Object>) engine.sanitizeObject(input);

        assertEquals("Jane", out.get("name"));
        assertEquals(List.of("a", 3, Map.of("deep", "x")), out.get("tags"));
        assertEquals(5, out.get("count"));
        assertEquals(true, out.get("active"));
    }

    // ===== File names / email / phone =====

    @Test
    void shouldReplaceUnsafeFileNameCharacters() {
        assertEquals("my_file_name_.pdf", engine.sanitizeFileName("my file   name!.pdf"));
        assertEquals(".._etc_passwd", engine.sanitizeFileName("../etc/passwd"));
    }

    @Test
    void shouldCapFileNameLength() {
        assertEquals(SanitizationEngine.MAX_FILE_NAME_LENGTH, engine.sanitizeFileName("f".repeat(400)).length());
    }

    @Test
    void shouldLowercaseEmail() {
        assertEquals("jane@example.com", engine.sanitizeEmail("  Jane@Example.COM "));
    }

    @Test
    void shouldKeepDigitsAndLeadingPlusInPhone() {
        assertEquals("+15551234567", engine.sanitizePhone(" +1 (555) 123-4567 "));
        assertEquals("5551234567", engine.sanitizePhone("555.123.4567"));
    }

    // ===== Escaping =====

    @Test
    void shouldEscapeHtmlSpecialCharacters() {
        assertEquals("&lt;a href=&quot;x&quot;&gt;Tom &amp; Jerry&#x27;s&lt;&#x2F;a&gt;",
                engine.escapeHtml("<a href=\"x\">Tom & Jerry's</a>"));
    }

    @Test
    void shouldEscapeSqlStringLiterals() {
        assertEquals("O''Brien \\\\ \\0 \\n \\r \\Z",
                engine.escapeSqlString("O'Brien \\ \0 \n \r \u001a"));
    }

    // ===== HTML fallback =====

    @Test
    void shouldPassHtmlThroughWithoutBackendByDefault() {
        SanitizationEngine noBackend = new SanitizationEngine((HtmlSanitizerBackend) null, HtmlFallbackMode.PASS_THROUGH);
        assertFalse(noBackend.hasHtmlBackend());
        assertEquals("<script>x</script>", noBackend.sanitizeHtml("<script>x</script>"));
    }

    @Test
    void shouldEscapeHtmlWithoutBackendWhenConfigured() {
        SanitizationEngine noBackend = new SanitizationEngine((HtmlSanitizerBackend) null, HtmlFallbackMode.ESCAPE);
        assertEquals("&lt;b&gt;hi&lt;&#x2F;b&gt;", noBackend.sanitizeHtml("<b>hi</b>"));
    }

    @Test
    void shouldDelegateHtmlToBackend() {
        SanitizationEngine withBackend = new SanitizationEngine(html -> "clean", HtmlFallbackMode.PASS_THROUGH);
        assertTrue(withBackend.hasHtmlBackend());
        assertEquals("clean", withBackend.sanitizeHtml("<b>dirty</b>"));
    }
}
