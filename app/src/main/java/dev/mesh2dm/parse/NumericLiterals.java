package dev.mesh2dm.parse;

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Locale-independent conversion of 2DM fields into numbers.
 * <p>
 * Integers are an optional sign followed by ASCII digits and must fit a signed 64-bit value. Floats accept plain
 * and scientific decimal notation plus the words {@code inf}, {@code infinity} and {@code nan} in any case.
 * Java-only forms such as hex floats, {@code d}/{@code f} suffixes or surrounding whitespace are rejected.
 */
public final class NumericLiterals {

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private NumericLiterals() {
    }

    public static long toInteger(String field) {
        if (field == null || !INTEGER.matcher(field).matches()) {
            throw new NumericLiteralException(field, NumericType.INTEGER, false);
        }
        try {
            return Long.parseLong(field);
        } catch (NumberFormatException ex) {
            // digits only, so the literal can only fail on range
            throw new NumericLiteralException(field, NumericType.INTEGER, true);
        }
    }

    public static double toFloat(String field) {
        if (field == null) {
            throw new NumericLiteralException(null, NumericType.FLOAT, false);
        }
        if (DECIMAL.matcher(field).matches()) {
            return Double.parseDouble(field);
        }
        String unsigned = field;
        boolean negative = false;
        if (!field.isEmpty() && (field.charAt(0) == '+' || field.charAt(0) == '-')) {
            negative = field.charAt(0) == '-';
            unsigned = field.substring(1);
        }
        switch (unsigned.toLowerCase(Locale.ROOT)) {
            case "inf", "infinity" -> {
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            case "nan" -> {
                return Double.NaN;
            }
            default -> throw new NumericLiteralException(field, NumericType.FLOAT, false);
        }
    }

    public static OptionalLong tryInteger(String field) {
        try {
            return OptionalLong.of(toInteger(field));
        } catch (NumericLiteralException ex) {
            return OptionalLong.empty();
        }
    }

    public static OptionalDouble tryFloat(String field) {
        try {
            return OptionalDouble.of(toFloat(field));
        } catch (NumericLiteralException ex) {
            return OptionalDouble.empty();
        }
    }
}
