package com.vanityhub.server.validation;

/**
 * What {@link SanitizationEngine#sanitizeHtml(String)} does when no
 * {@link HtmlSanitizerBackend} is available.
 */
public enum HtmlFallbackMode {

    /** Return the input unmodified. The caller must not render it as trusted HTML. */
    PASS_THROUGH,

    /** HTML-escape the whole input so no markup survives. */
    ESCAPE
}
