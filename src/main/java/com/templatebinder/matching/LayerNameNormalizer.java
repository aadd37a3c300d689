package com.templatebinder.matching;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Layer name clean-up and the character-order similarity score used by fuzzy matching.
 */
public final class LayerNameNormalizer {

    private static final Pattern LEADING_TOKEN = Pattern.compile("^(layer[_\\s]|txt[_\\s]|text[_\\s]|img[_\\s])");
    private static final Pattern TRAILING_TOKEN = Pattern.compile("[_\\s]?(copy|layer|txt|text)$");
    private static final Pattern SEPARATORS = Pattern.compile("[_\\-\\s]");

    private LayerNameNormalizer() {
    }

    /**
     * Lower-cases the name and strips one common designer prefix ("txt_", "layer ", ...)
     * and one trailing suffix ("_copy", "text", ...).
     */
    public static String normalize(String layerName) {
        if (layerName == null) {
            return "";
        }
        String normalized = layerName.toLowerCase(Locale.ROOT);
        normalized = LEADING_TOKEN.matcher(normalized).replaceFirst("");
        normalized = TRAILING_TOKEN.matcher(normalized).replaceFirst("");
        return normalized.strip();
    }

    /**
     * {@link #normalize(String)} with underscores, dashes and whitespace removed.
     */
    public static String compact(String layerName) {
        return stripSeparators(normalize(layerName));
    }

    /**
     * Lower-cases the name and removes underscores, dashes and whitespace, keeping every token.
     */
    public static String stripSeparators(String layerName) {
        if (layerName == null) {
            return "";
        }
        return SEPARATORS.matcher(layerName.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Share of characters that line up in order between the two strings, over the longer length.
     * On a mismatch the cursor of the longer string advances (the second one on a tie).
     */
    public static double similarity(String a, String b) {
        String first = a != null ? a : "";
        String second = b != null ? b : "";
        if (first.equals(second)) {
            return 1.0;
        }
        int maxLen = Math.max(first.length(), second.length());
        int matches = 0;
        int i = 0;
        int j = 0;
        while (i < first.length() && j < second.length()) {
            if (first.charAt(i) == second.charAt(j)) {
                matches++;
                i++;
                j++;
            } else if (first.length() > second.length()) {
                i++;
            } else {
                j++;
            }
        }
        return (double) matches / maxLen;
    }
}
