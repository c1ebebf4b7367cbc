package com.finplan.plananalysis.sheet;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parser for the numbers people type into budget sheets.
 *
 * <p>Strips spaces and currency symbols, accepts a comma as decimal separator and
 * collapses European thousands groups ({@code 1.234,56} reads as 1234.56). Only the
 * leading number is read, so {@code "12 EUR"} parses as 12.
 */
public final class NumericValues {

    private static final Pattern THOUSANDS_GROUP = Pattern.compile("(\\d+)\\.(\\d{3})");
    private static final Pattern LEADING_NUMBER =
        Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private NumericValues() {
    }

    public static OptionalDouble parse(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String s = text.trim()
            .replace(" ", "")
            .replace("\u00A0", "")
            .replace("€", "")
            .replace("$", "")
            .replace(",", ".");

        Matcher group = THOUSANDS_GROUP.matcher(s);
        while (group.find()) {
            s = group.replaceAll("$1$2");
            group = THOUSANDS_GROUP.matcher(s);
        }

        Matcher number = LEADING_NUMBER.matcher(s);
        if (!number.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(number.group()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public static boolean isNumeric(String text) {
        return parse(text).isPresent();
    }

    /**
     * Parsed value, or 0 when the text is not numeric.
     */
    public static double valueOrZero(String text) {
        return parse(text).orElse(0.0);
    }
}
