package com.vanityhub.server.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Side-effect-free input cleaning and output escaping.
 *
 * <p>Input transforms ({@code sanitize*}) run on request data before schema
 * validation. Escaping helpers ({@code escape*}) are for output contexts and
 * sit behind the typed, validated data path.</p>
 *
 * <p>Thread-safe: no mutable state besides a one-shot warning flag.</p>
 */
@Component
public class SanitizationEngine {

    private static final Logger log = LoggerFactory.getLogger(SanitizationEngine.class);

    public static final int MAX_STRING_LENGTH = 10_000;
    public static final int MAX_FILE_NAME_LENGTH = 255;

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1F\\x7F]");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");
    private static final Pattern NON_PHONE_CHARS = Pattern.compile("[^0-9+]");

    private final HtmlSanitizerBackend htmlBackend;
    private final HtmlFallbackMode htmlFallback;
    private final AtomicBoolean fallbackWarned = new AtomicBoolean(false);

    @Autowired
    public SanitizationEngine(ObjectProvider<HtmlSanitizerBackend> htmlBackend,
                              @Value("${vanityhub.sanitize.html-fallback:PASS_THROUGH}") HtmlFallbackMode htmlFallback) {
        this(htmlBackend.getIfAvailable(), htmlFallback);
    }

    public SanitizationEngine(HtmlSanitizerBackend htmlBackend, HtmlFallbackMode htmlFallback) {
        this.htmlBackend = htmlBackend;
        this.htmlFallback = htmlFallback == null ? HtmlFallbackMode.PASS_THROUGH : htmlFallback;
        if (htmlBackend == null) {
            log.warn("[Sanitize] No HTML sanitizer backend configured, sanitizeHtml will {}",
                    this.htmlFallback == HtmlFallbackMode.PASS_THROUGH ? "return input unmodified" : "escape input");
        }
    }

    /** Engine with the built-in allow-list backend. */
    public SanitizationEngine() {
        this(new AllowListHtmlSanitizer(), HtmlFallbackMode.PASS_THROUGH);
    }

    // ==================== INPUT ====================

    /**
     * Strip control and NUL characters, trim, and cap at {@value #MAX_STRING_LENGTH}
     * characters. Idempotent.
     */
    public String sanitizeString(String input) {
        if (input == null) {
            return "";
        }
        String sanitized = CONTROL_CHARS.matcher(input).replaceAll("").strip();
        if (sanitized.length() > MAX_STRING_LENGTH) {
            int end = MAX_STRING_LENGTH;
            if (Character.isHighSurrogate(sanitized.charAt(end - 1))) {
                end--;
            }
            sanitized = sanitized.substring(0, end).stripTrailing();
        }
        return sanitized;
    }

    /**
     * Allow-list HTML cleaning. Without a backend the configured
     * {@link HtmlFallbackMode} applies.
     */
    public String sanitizeHtml(String input) {
        if (input == null) {
            return "";
        }
        if (htmlBackend != null) {
            return htmlBackend.sanitize(input);
        }
        if (fallbackWarned.compareAndSet(false, true)) {
            log.warn("[Sanitize] sanitizeHtml called without a backend (fallback={})", htmlFallback);
        }
        return htmlFallback == HtmlFallbackMode.ESCAPE ? escapeHtml(input) : input;
    }

    public boolean hasHtmlBackend() {
        return htmlBackend != null;
    }

    public String sanitizeFileName(String input) {
        if (input == null) {
            return "";
        }
        String name = UNSAFE_FILE_CHARS.matcher(input).replaceAll("_");
        name = REPEATED_UNDERSCORES.matcher(name).replaceAll("_");
        return name.length() > MAX_FILE_NAME_LENGTH ? name.substring(0, MAX_FILE_NAME_LENGTH) : name;
    }

    public String sanitizeEmail(String input) {
        return sanitizeString(input).toLowerCase(Locale.ROOT);
    }

    /** Keep digits and a single leading plus sign. */
    public String sanitizePhone(String input) {
        String cleaned = sanitizeString(input);
        boolean international = cleaned.startsWith("+");
        String digits = NON_PHONE_CHARS.matcher(cleaned).replaceAll("").replace("+", "");
        return international ? "+" + digits : digits;
    }

    /**
     * Apply {@link #sanitizeString(String)} to every string leaf, recursing
     * into lists and maps. Other values pass through unchanged.
     */
    public Object sanitizeObject(Object value) {
        if (value instanceof String s) {
            return sanitizeString(s);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(sanitizeObject(item));
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(k, sanitizeObject(v)));
            return out;
        }
        return value;
    }

    // ==================== OUTPUT ====================

    public String escapeHtml(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(input.length() + 16);
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                case '/' -> sb.append("&#x2F;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Escaping for string literals; parameterized queries remain the primary defense. */
    public String escapeSqlString(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(input.length() + 8);
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '\'' -> sb.append("''");
                case '\\' -> sb.append("\\\\");
                case '\0' -> sb.append("\\0");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\u001a' -> sb.append("\\Z");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
