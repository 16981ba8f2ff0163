package com.fundfeed.provider.normalize;

import java.util.Set;

/** Shared cleanup for numeric cells: vendor placeholders for "no value" become null. */
final class NumericText {

    private static final Set<String> MISSING = Set.of("", "--", "-", "—", "nan", "none", "null");

    private NumericText() {}

    /** Trimmed text with thousands separators removed, or null when the cell means "missing". */
    static String clean(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Double && ((Double) raw).isNaN()) {
            return null;
        }
        if (raw instanceof Float && ((Float) raw).isNaN()) {
            return null;
        }
        String text = raw.toString().trim().replace(",", "");
        if (MISSING.contains(text.toLowerCase())) {
            return null;
        }
        return text;
    }

    static boolean isMissing(Object raw) {
        return clean(raw) == null;
    }
}
