package com.sysmuse.equation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EquationSanitizerTest {

    @Test
    public void testKeepsValidCharacters() {
        assertEquals("12.5+3-4*2/1", EquationSanitizer.sanitize("12.5+3-4*2/1"));
    }

    @Test
    public void testDropsInvalidCharacters() {
        assertEquals("3+4*2", EquationSanitizer.sanitize(" (3 + 4) x 2 "));
        assertEquals("", EquationSanitizer.sanitize("abc"));
        assertEquals("", EquationSanitizer.sanitize(""));
        assertEquals("", EquationSanitizer.sanitize(null));
    }

    @Test
    public void testNonAsciiDigitsAreDropped() {
        assertEquals("1", EquationSanitizer.sanitize("1٣"));
    }

    @Test
    public void testIdempotent() {
        for (String raw : new String[]{"", "abc", "3 + 4", "-1.5e3*2", "1,000/3%"}) {
            String once = EquationSanitizer.sanitize(raw);
            assertEquals(once, EquationSanitizer.sanitize(once), raw);
        }
    }

    @Test
    public void testWarningPerDroppedCharacter() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        EquationSanitizer.sanitize("1 + x", diagnostics);

        assertEquals(3, diagnostics.getWarnings().size());
        assertTrue(diagnostics.getWarnings().get(2).contains("\"x\""));
        assertTrue(diagnostics.getWarnings().get(2).contains("\"1 + x\""));
    }

    @Test
    public void testSupplementaryCharacterIsOneWarning() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        assertEquals("12", EquationSanitizer.sanitize("1\uD83D\uDE002", diagnostics));

        assertEquals(1, diagnostics.getWarnings().size());
        assertTrue(diagnostics.getWarnings().get(0).contains("(\"\uD83D\uDE00\")"));
    }
}
