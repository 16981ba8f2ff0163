package com.fundfeed.provider.normalize;

import java.math.BigDecimal;

/**
 * Parses vendor percentage cells such as {@code "1.25%"}, {@code "-0.3"} or {@code 2.5}.
 *
 * <p>Missing or unparsable values yield null, never zero: a missing change percentage must
 * stay distinguishable from a flat day.
 */
public final class PercentParser {

    private PercentParser() {}

    public static BigDecimal parse(Object raw) {
        String text = NumericText.clean(raw);
        if (text == null) {
            return null;
        }
        if (text.endsWith("%")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
