package com.marketengine.common.tier1;

import java.util.Locale;
import java.util.regex.Pattern;

/** ASIN format check: ten upper-case alphanumerics after trimming. */
public final class AsinValidator {

    private static final Pattern ASIN = Pattern.compile("^[A-Z0-9]{10}$");

    private AsinValidator() {}

    /** @return the canonical ASIN, or {@code null} when the value is not a valid ASIN */
    public static String canonical(String raw) {
        if (raw == null) {
            return null;
        }
        String asin = raw.trim().toUpperCase(Locale.ROOT);
        return ASIN.matcher(asin).matches() ? asin : null;
    }

    public static boolean isValid(String raw) {
        return canonical(raw) != null;
    }
}
