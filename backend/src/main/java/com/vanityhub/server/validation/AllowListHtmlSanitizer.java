package com.vanityhub.server.validation;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Regex-driven allow-list HTML cleaner.
 *
 * <ul>
 *   <li>{@code script}/{@code style} elements are removed with their content</li>
 *   <li>comments are removed</li>
 *   <li>allowed tags are re-emitted bare (attributes never survive)</li>
 *   <li>any other tag is dropped, its text content kept</li>
 *   <li>stray angle brackets in text are escaped</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(name = "vanityhub.sanitize.html-backend.enabled", havingValue = "true", matchIfMissing = true)
public class AllowListHtmlSanitizer implements HtmlSanitizerBackend {

    private static final Pattern DANGEROUS_BLOCKS = Pattern.compile(
            "<\\s*(script|style|iframe|object|embed|template)\\b[^>]*>.*?<\\s*/\\s*\\1\\s*>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern UNCLOSED_DANGEROUS = Pattern.compile(
            "<\\s*(script|style|iframe|object|embed|template)\\b[^>]*>.*",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMMENTS = Pattern.compile("<!--.*?(-->|$)", Pattern.DOTALL);
    private static final Pattern TAG = Pattern.compile("<\\s*(/)?\\s*([a-zA-Z][a-zA-Z0-9]*)[^<>]*>");

    private final Set<String> allowedTags;

    public AllowListHtmlSanitizer() {
        this(DEFAULT_ALLOWED_TAGS);
    }

    public AllowListHtmlSanitizer(Set<String> allowedTags) {
        this.allowedTags = Set.copyOf(allowedTags);
    }

    @Override
    public String sanitize(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }

        String result = DANGEROUS_BLOCKS.matcher(html).replaceAll("");
        result = UNCLOSED_DANGEROUS.matcher(result).replaceAll("");
        result = COMMENTS.matcher(result).replaceAll("");

        StringBuilder out = new StringBuilder(result.length());
        Matcher m = TAG.matcher(result);
        int last = 0;
        while (m.find()) {
            appendText(out, result, last, m.start());
            String name = m.group(2).toLowerCase(Locale.ROOT);
            if (allowedTags.contains(name)) {
                boolean closing = m.group(1) != null;
                if (!(closing && "br".equals(name))) {
                    out.append(closing ? "</" : "<").append(name).append('>');
                }
            }
            last = m.end();
        }
        appendText(out, result, last, result.length());
        return out.toString();
    }

    private static void appendText(StringBuilder out, String s, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = s.charAt(i);
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                default -> out.append(c);
            }
        }
    }
}
