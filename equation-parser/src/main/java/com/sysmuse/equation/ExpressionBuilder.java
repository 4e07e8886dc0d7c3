package com.sysmuse.equation;

import com.sysmuse.util.LoggingUtil;

import java.util.Optional;

import static com.sysmuse.equation.Expression.literal;
import static com.sysmuse.equation.Expression.operation;

/**
 * Builds the comb-shaped tree for a sanitized equation.
 * <p>
 * Each level reads one number and the operator after it; the rest of the equation
 * becomes the right-hand side:
 * <pre>
 *  "3+4*2"  ->  3 + (4 * (2))
 * </pre>
 * A '-' at the start of a level is always a sign, never subtraction, since subtraction
 * can only follow a number that has already been read.
 */
public class ExpressionBuilder {

    // no limit; callers parsing untrusted input should set one
    public static final int DEFAULT_MAX_TERMS = 0;

    private final DivisionMode divisionMode;
    private final int maxTerms;

    public ExpressionBuilder() {
        this(DivisionMode.LEGACY_SUBTRACT, DEFAULT_MAX_TERMS);
    }

    /**
     * @param divisionMode how '/' is classified
     * @param maxTerms     numbers read before the rest of the equation is discarded, 0 for no limit
     */
    public ExpressionBuilder(DivisionMode divisionMode, int maxTerms) {
        if (divisionMode == null) {
            throw new IllegalArgumentException("divisionMode must not be null");
        }
        if (maxTerms < 0) {
            throw new IllegalArgumentException("maxTerms must be >= 0 but was " + maxTerms);
        }
        this.divisionMode = divisionMode;
        this.maxTerms = maxTerms;
    }

    public DivisionMode getDivisionMode() {
        return divisionMode;
    }

    public int getMaxTerms() {
        return maxTerms;
    }

    public Expression build(String equation) {
        return build(equation, new ParseDiagnostics());
    }

    /**
     * Build the tree for {@code equation}, reporting discarded input to {@code diagnostics}.
     * An empty equation is the literal 0.
     */
    public Expression build(String equation, ParseDiagnostics diagnostics) {
        if (equation == null) {
            return literal(0);
        }
        return build(equation, 0, 1, diagnostics);
    }

    private Expression build(String equation, int pos, int term, ParseDiagnostics diagnostics) {
        if (pos >= equation.length()) {
            return literal(0);
        }

        int numberEnd = pos;
        if (equation.charAt(pos) == '-') {
            numberEnd++;
        }
        numberEnd += NumberExtractor.leadingNumberLength(equation, numberEnd);

        String numberText = equation.substring(pos, numberEnd);
        double value = NumberExtractor.toValue(numberText);
        Optional<Character> symbol = symbolAt(equation, numberEnd);

        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Equation: " + equation.substring(pos)
                    + ", number: " + value
                    + ", symbol: " + symbol.map(Object::toString).orElse("<end>"));
        }

        if (symbol.isEmpty()) {
            return literal(value);
        }

        Optional<OperatorKind> kind = kindFor(symbol.get());
        if (kind.isEmpty()) {
            diagnostics.warn("Unknown symbol '" + symbol.get() + "' at position " + numberEnd
                    + " in \"" + equation + "\"; ignoring the rest of the equation");
            return literal(value);
        }

        if (maxTerms > 0 && term >= maxTerms) {
            diagnostics.warn("Equation has more than " + maxTerms
                    + " terms; ignoring everything after position " + numberEnd);
            return literal(value);
        }

        Expression rhs = build(equation, numberEnd + 1, term + 1, diagnostics);
        return operation(kind.get(), literal(value), rhs);
    }

    private static Optional<Character> symbolAt(String equation, int pos) {
        return pos < equation.length() ? Optional.of(equation.charAt(pos)) : Optional.empty();
    }

    /**
     * The operator kind for a symbol character, or empty if it is not an operator.
     */
    public Optional<OperatorKind> kindFor(char symbol) {
        return switch (symbol) {
            case '+' -> Optional.of(OperatorKind.ADD);
            case '-' -> Optional.of(OperatorKind.SUBTRACT);
            case '*' -> Optional.of(OperatorKind.MULTIPLY);
            case '/' -> Optional.of(divisionMode == DivisionMode.DIVIDE
                    ? OperatorKind.DIVIDE
                    : OperatorKind.SUBTRACT);
            default -> Optional.empty();
        };
    }
}
