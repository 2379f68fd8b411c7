package com.vanityhub.server.model;

/**
 * Password strength tiers, weakest first, with the label and meter
 * percentage shown in password forms.
 */
public enum PasswordStrength {
    VERY_WEAK("Very Weak", 10),
    WEAK("Weak", 25),
    FAIR("Fair", 50),
    GOOD("Good", 75),
    STRONG("Strong", 90),
    VERY_STRONG("Very Strong", 100);

    private final String label;
    private final int percentage;

    PasswordStrength(String label, int percentage) {
        this.label = label;
        this.percentage = percentage;
    }

    public String getLabel()     { return label; }
    public int getPercentage()   { return percentage; }

    public boolean atLeast(PasswordStrength other) {
        return compareTo(other) >= 0;
    }

    public static PasswordStrength fromScore(int score) {
        if (score <= 1) return VERY_WEAK;
        if (score <= 2) return WEAK;
        if (score <= 3) return FAIR;
        if (score <= 4) return GOOD;
        if (score <= 5) return STRONG;
        return VERY_STRONG;
    }
}
