package com.sysmuse.equation;

/**
 * Reads numeric literals off the front of a sanitized equation.
 */
public final class NumberExtractor {

    private NumberExtractor() {
    }

    /**
     * Returns the run of digits and '.' at the start of {@code s}, possibly empty.
     * The text is not validated, so "1.2.3" comes back unchanged.
     */
    public static String extractLeadingNumber(String s) {
        return s.substring(0, leadingNumberLength(s, 0));
    }

    /**
     * Length of the run of digits and '.' in {@code s} starting at {@code from}.
     */
    static int leadingNumberLength(String s, int from) {
        int end = from;
        while (end < s.length() && isNumberChar(s.charAt(end))) {
            end++;
        }
        return end - from;
    }

    /**
     * Converts literal text to a value, falling back to 0 when it is not a number
     * ("", "-", ".", "1.2.3").
     */
    public static double toValue(String literal) {
        if (!isPlainDecimal(literal)) {
            return 0;
        }
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    // Double.parseDouble also takes "Infinity", "0x1p3", "2d" and surrounding whitespace
    private static boolean isPlainDecimal(String literal) {
        if (literal == null || literal.isEmpty()) {
            return false;
        }
        int start = literal.charAt(0) == '-' ? 1 : 0;
        boolean sawDigit = false;
        for (int i = start; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (!isNumberChar(c)) {
                return false;
            }
            sawDigit |= c != '.';
        }
        return sawDigit;
    }
}
