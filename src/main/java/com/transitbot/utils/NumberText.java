package com.transitbot.utils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Number rendering for the summary tables: ten significant digits, trailing zeros dropped,
 * scientific notation only for very small or very large magnitudes.
 */
public final class NumberText {
    private static final MathContext TEN_DIGITS = new MathContext(10, RoundingMode.HALF_EVEN);

    private NumberText() {
    }

    public static String format(Double value) {
        if (value == null) {
            return "";
        }
        return format(value.doubleValue());
    }

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(TEN_DIGITS).stripTrailingZeros();
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= 10) {
            BigDecimal mantissa = rounded.movePointLeft(exponent).stripTrailingZeros();
            String sign = exponent < 0 ? "-" : "+";
            int abs = Math.abs(exponent);
            return mantissa.toPlainString() + "e" + sign + (abs < 10 ? "0" + abs : String.valueOf(abs));
        }
        return rounded.toPlainString();
    }

    public static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
