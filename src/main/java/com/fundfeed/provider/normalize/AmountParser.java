package com.fundfeed.provider.normalize;

import java.math.BigDecimal;

/**
 * Parses Chinese-market money amounts into yuan.
 *
 * <ul>
 *   <li>{@code "12.98亿"} is 1,298,000,000</li>
 *   <li>{@code "3500万"} is 35,000,000</li>
 *   <li>{@code "880元"} is 880</li>
 *   <li>{@code "12.98亿元"} and {@code "3500万元"} read the same as without the trailing 元</li>
 *   <li>an unsuffixed value with magnitude of at least one million is already in yuan</li>
 *   <li>a smaller unsuffixed value is scaled by the column's assumed unit</li>
 * </ul>
 *
 * Placeholders such as {@code "--"} or {@code "nan"} and unparsable text yield null.
 */
public final class AmountParser {

    static final BigDecimal RAW_YUAN_THRESHOLD = new BigDecimal("1000000");

    private AmountParser() {}

    public static BigDecimal parse(Object raw, AmountUnit assumedUnit) {
        String text = NumericText.clean(raw);
        if (text == null) {
            return null;
        }
        if (text.endsWith("亿元") || text.endsWith("万元")) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            if (text.endsWith("亿")) {
                return number(text).multiply(AmountUnit.YI.getMultiplier());
            }
            if (text.endsWith("万")) {
                return number(text).multiply(AmountUnit.WAN.getMultiplier());
            }
            if (text.endsWith("元")) {
                return number(text);
            }
            BigDecimal value = new BigDecimal(text);
            if (value.abs().compareTo(RAW_YUAN_THRESHOLD) >= 0) {
                return value;
            }
            return value.multiply(assumedUnit.getMultiplier());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static BigDecimal number(String suffixed) {
        return new BigDecimal(suffixed.substring(0, suffixed.length() - 1).trim());
    }
}
