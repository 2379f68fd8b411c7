package com.vanityhub.server.validation;

import java.util.Set;

/**
 * Pluggable HTML cleaner used by {@link SanitizationEngine#sanitizeHtml(String)}.
 */
public interface HtmlSanitizerBackend {

    /** Inline formatting tags that survive sanitization. */
    Set<String> DEFAULT_ALLOWED_TAGS = Set.of("b", "i", "em", "strong", "p", "br");

    /**
     * Keep only allowed tags, drop all attributes, remove everything else.
     */
    String sanitize(String html);
}
