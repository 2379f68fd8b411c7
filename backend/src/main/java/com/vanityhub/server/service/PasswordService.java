package com.vanityhub.server.service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import com.vanityhub.server.dto.PasswordValidationResult;
import com.vanityhub.server.exception.WeakPasswordException;
import com.vanityhub.server.model.PasswordStrength;

/**
 * Password policy: strength scoring, hashing and generation.
 *
 * <h3>Scoring</h3>
 * +1 for length ≥ 8, +1 for length ≥ 12, +1 per character class present,
 * +1 when three or more classes are present, +1 for length ≥ 16.
 * Common passwords cost 2 points; a run of three identical characters,
 * a keyboard or alphabet sequence and a common word cost 1 point each.
 * A password is valid when it has no rule violations and scores at least FAIR.
 */
@Service
public class PasswordService {

    private static final Logger log = LoggerFactory.getLogger(PasswordService.class);

    public static final int DEFAULT_MAX_AGE_DAYS = 90;
    public static final int DEFAULT_GENERATED_LENGTH = 16;

    private static final Set<String> COMMON_PASSWORDS = Set.of(
            "password", "password123", "123456", "123456789", "qwerty",
            "abc123", "password1", "admin", "letmein", "welcome",
            "monkey", "1234567890", "dragon", "master", "hello",
            "freedom", "whatever", "qazwsx", "trustno1", "jordan23");

    private static final List<String> SEQUENCES = List.of(
            "abcdefghijklmnopqrstuvwxyz",
            "0123456789",
            "qwertyuiopasdfghjklzxcvbnm");

    private static final List<String> COMMON_WORDS = List.of(
            "admin", "user", "login", "system", "computer", "internet");

    private static final Pattern UPPER = Pattern.compile("[A-Z]");
    private static final Pattern LOWER = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern SPECIAL = Pattern.compile("[^A-Za-z0-9]");
    private static final Pattern REPEATED = Pattern.compile("(.)\\1{2,}");

    private static final String UPPERCASE = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
    private static final String NUMBERS = "0123456789";
    private static final String SYMBOLS = "!@#$%^&*()_+-=[]{}|;:,.<>?";

    private final PasswordEncoder encoder;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public PasswordService(PasswordEncoder encoder, Clock clock) {
        this.encoder = encoder;
        this.clock = clock;
    }

    // ==================== VALIDATION ====================

    public PasswordValidationResult validate(String password) {
        String pw = password == null ? "" : password;
        List<String> errors = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        int score = 0;

        if (pw.length() < 8) {
            errors.add("Password must be at least 8 characters long");
        } else {
            score++;
        }
        if (pw.length() >= 12) {
            score++;
        }

        boolean upper = UPPER.matcher(pw).find();
        boolean lower = LOWER.matcher(pw).find();
        boolean digit = DIGIT.matcher(pw).find();
        boolean special = SPECIAL.matcher(pw).find();

        score += classCheck(upper, "Password must contain at least one uppercase letter",
                "Add uppercase letters (A-Z)", errors, suggestions);
        score += classCheck(lower, "Password must contain at least one lowercase letter",
                "Add lowercase letters (a-z)", errors, suggestions);
        score += classCheck(digit, "Password must contain at least one number",
                "Add numbers (0-9)", errors, suggestions);
        score += classCheck(special, "Password must contain at least one special character",
                "Add special characters (!@#$%^&*)", errors, suggestions);

        if (pw.length() > 128) {
            errors.add("Password must not exceed 128 characters");
        }

        String folded = pw.toLowerCase(Locale.ROOT);
        if (COMMON_PASSWORDS.contains(folded)) {
            errors.add("This password is too common and easily guessed");
            suggestions.add("Use a unique password that is not commonly used");
            score = Math.max(0, score - 2);
        }
        if (REPEATED.matcher(pw).find()) {
            suggestions.add("Avoid repeating the same character multiple times");
            score = Math.max(0, score - 1);
        }
        if (hasSequentialChars(folded)) {
            suggestions.add("Avoid sequential characters (abc, 123, qwerty)");
            score = Math.max(0, score - 1);
        }
        if (COMMON_WORDS.stream().anyMatch(folded::contains)) {
            suggestions.add("Avoid using common words");
            score = Math.max(0, score - 1);
        }

        int typeCount = (upper ? 1 : 0) + (lower ? 1 : 0) + (digit ? 1 : 0) + (special ? 1 : 0);
        if (typeCount >= 3) {
            score++;
        }
        if (pw.length() >= 16) {
            score++;
        }

        PasswordStrength strength = PasswordStrength.fromScore(score);
        if (!strength.atLeast(PasswordStrength.GOOD)) {
            if (pw.length() < 12) {
                suggestions.add("Make your password longer (12+ characters)");
            }
            if (typeCount < 4) {
                suggestions.add("Use a mix of uppercase, lowercase, numbers, and symbols");
            }
            suggestions.add("Consider using a passphrase with multiple words");
        }

        boolean valid = errors.isEmpty() && strength.atLeast(PasswordStrength.FAIR);
        return new PasswordValidationResult(valid, strength, score, errors, suggestions);
    }

    private static int classCheck(boolean present, String error, String suggestion,
                                  List<String> errors, List<String> suggestions) {
        if (present) {
            return 1;
        }
        errors.add(error);
        suggestions.add(suggestion);
        return 0;
    }

    static boolean hasSequentialChars(String folded) {
        for (String seq : SEQUENCES) {
            for (int i = 0; i <= seq.length() - 3; i++) {
                if (folded.contains(seq.substring(i, i + 3))) {
                    return true;
                }
            }
        }
        return false;
    }

    // ==================== HASHING ====================

    /**
     * BCrypt hash of a password that passes {@link #validate}.
     *
     * @throws WeakPasswordException if the password fails the policy
     */
    public String hash(String password) {
        PasswordValidationResult result = validate(password);
        if (!result.valid()) {
            List<String> reasons = result.errors().isEmpty()
                    ? List.of("Password strength is " + result.strength().getLabel())
                    : result.errors();
            log.debug("[Password] Refusing to hash password: {}", reasons);
            throw new WeakPasswordException(reasons);
        }
        return encoder.encode(password);
    }

    /** False for malformed hashes instead of throwing. */
    public boolean matches(String plainPassword, String hashedPassword) {
        if (plainPassword == null || hashedPassword == null) {
            return false;
        }
        try {
            return encoder.matches(plainPassword, hashedPassword);
        } catch (IllegalArgumentException e) {
            log.warn("[Password] Hash comparison failed: {}", e.getMessage());
            return false;
        }
    }

    // ==================== GENERATION / AGE ====================

    public String generateSecurePassword() {
        return generateSecurePassword(DEFAULT_GENERATED_LENGTH);
    }

    /**
     * Random password with at least one character of each class.
     */
    public String generateSecurePassword(int length) {
        if (length < 4) {
            throw new IllegalArgumentException("Generated passwords need at least 4 characters");
        }
        String all = UPPERCASE + LOWERCASE + NUMBERS + SYMBOLS;
        List<Character> chars = new ArrayList<>(length);
        chars.add(pick(UPPERCASE));
        chars.add(pick(LOWERCASE));
        chars.add(pick(NUMBERS));
        chars.add(pick(SYMBOLS));
        for (int i = 4; i < length; i++) {
            chars.add(pick(all));
        }
        Collections.shuffle(chars, random);

        StringBuilder sb = new StringBuilder(length);
        chars.forEach(sb::append);
        return sb.toString();
    }

    private char pick(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }

    public boolean shouldChangePassword(Instant lastChanged) {
        return shouldChangePassword(lastChanged, DEFAULT_MAX_AGE_DAYS);
    }

    public boolean shouldChangePassword(Instant lastChanged, int maxAgeDays) {
        if (lastChanged == null) {
            return true;
        }
        long days = Duration.between(lastChanged, clock.instant()).toDays();
        return days >= maxAgeDays;
    }
}
