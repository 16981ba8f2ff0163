package com.fundfeed.provider.normalize;

import java.math.BigDecimal;

/** Parses plain numeric cells (NAVs, prices); placeholders and junk yield null. */
public final class DecimalParser {

    private DecimalParser() {}

    public static BigDecimal parse(Object raw) {
        String text = NumericText.clean(raw);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Like {@link #parse} but only strictly positive values survive. */
    public static BigDecimal parsePositive(Object raw) {
        BigDecimal value = parse(raw);
        return value != null && value.signum() > 0 ? value : null;
    }
}
