package com.sysmuse.equation;

/**
 * Strips everything from an equation except digits, '.', and the four operator characters.
 * Sanitizing never fails; each dropped character is reported as a warning.
 */
public final class EquationSanitizer {

    private EquationSanitizer() {
    }

    public static String sanitize(String raw) {
        return sanitize(raw, new ParseDiagnostics());
    }

    public static String sanitize(String raw, ParseDiagnostics diagnostics) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        StringBuilder kept = new StringBuilder(raw.length());
        raw.codePoints().forEach(cp -> {
            if (isValid(cp)) {
                kept.append((char) cp);
            } else {
                diagnostics.warn("A non-valid character (\"" + new String(Character.toChars(cp))
                        + "\") was found in the equation \"" + raw + "\"");
            }
        });
        return kept.toString();
    }

    // every valid character is ASCII, so a supplementary code point is never valid
    static boolean isValid(int cp) {
        return cp < 128 && (NumberExtractor.isNumberChar((char) cp) || OperatorKind.isOperatorSymbol((char) cp));
    }
}
