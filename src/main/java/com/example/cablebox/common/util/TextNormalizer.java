package com.example.cablebox.common.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern INTERNAL_SPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /** Trim and collapse internal whitespace; null and blank become null. */
    public static String displayValue(String input) {
        if (input == null) {
            return null;
        }
        String collapsed = INTERNAL_SPACE.matcher(input.trim()).replaceAll(" ");
        return collapsed.isEmpty() ? null : collapsed;
    }

    /** Comparison key: display value lower-cased, never null. */
    public static String matchKey(String input) {
        String display = displayValue(input);
        return display == null ? "" : display.toLowerCase(Locale.ROOT);
    }

    /**
     * Normalize a list of names, dropping blanks and case-insensitive
     * duplicates. The first spelling of each name wins; input order is kept.
     */
    public static List<String> distinctDisplayValues(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String value : values) {
            String display = displayValue(value);
            if (display != null) {
                byKey.putIfAbsent(display.toLowerCase(Locale.ROOT), display);
            }
        }
        return new ArrayList<>(byKey.values());
    }
}
