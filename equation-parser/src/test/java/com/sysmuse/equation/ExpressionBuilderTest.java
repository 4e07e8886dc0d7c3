package com.sysmuse.equation;

import com.sysmuse.equation.Expression.Literal;
import com.sysmuse.equation.Expression.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.sysmuse.equation.Expression.literal;
import static com.sysmuse.equation.Expression.operation;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionBuilderTest {

    private ExpressionBuilder builder;

    @BeforeEach
    public void setup() {
        builder = new ExpressionBuilder();
    }

    @Test
    public void testEmptyEquationIsZero() {
        assertEquals(literal(0), builder.build(""));
        assertEquals(literal(0), builder.build(null));
    }

    @Test
    public void testSingleNumber() {
        assertEquals(literal(12.5), builder.build("12.5"));
        assertEquals(literal(-7), builder.build("-7"));
    }

    @Test
    public void testCombShape() {
        Expression expected = operation(OperatorKind.ADD, literal(1),
                operation(OperatorKind.SUBTRACT, literal(2),
                        operation(OperatorKind.MULTIPLY, literal(3), literal(4))));

        assertEquals(expected, builder.build("1+2-3*4"));
    }

    @Test
    public void testEveryOperationHasLiteralOnTheLeft() {
        Expression node = builder.build("-1.5*2--3+4/5*6");
        int depth = 0;
        while (node instanceof Operation op) {
            assertInstanceOf(Literal.class, op.lhs());
            node = op.rhs();
            depth++;
        }
        assertInstanceOf(Literal.class, node);
        assertEquals(5, depth);
    }

    @Test
    public void testLeadingMinusIsSign() {
        assertEquals(operation(OperatorKind.SUBTRACT, literal(5), literal(-3)), builder.build("5--3"));
        assertEquals(operation(OperatorKind.ADD, literal(-5), literal(2)), builder.build("-5+2"));
    }

    @Test
    public void testSlashMapping() {
        assertEquals(operation(OperatorKind.SUBTRACT, literal(8), literal(2)), builder.build("8/2"));

        ExpressionBuilder dividing = new ExpressionBuilder(DivisionMode.DIVIDE, 0);
        assertEquals(operation(OperatorKind.DIVIDE, literal(8), literal(2)), dividing.build("8/2"));
    }

    @Test
    public void testKindFor() {
        assertEquals(OperatorKind.ADD, builder.kindFor('+').orElseThrow());
        assertEquals(OperatorKind.SUBTRACT, builder.kindFor('-').orElseThrow());
        assertEquals(OperatorKind.MULTIPLY, builder.kindFor('*').orElseThrow());
        assertEquals(OperatorKind.SUBTRACT, builder.kindFor('/').orElseThrow());
        assertTrue(builder.kindFor('%').isEmpty());
    }

    @Test
    public void testTrailingOperatorGivesZeroOperand() {
        assertEquals(operation(OperatorKind.ADD, literal(3), literal(0)), builder.build("3+"));
    }

    @Test
    public void testUnknownSymbolStopsParsing() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        assertEquals(literal(3), builder.build("3a+4", diagnostics));
        assertEquals(1, diagnostics.getWarnings().size());
        assertTrue(diagnostics.getWarnings().get(0).contains("'a'"));
    }

    @Test
    public void testTermLimit() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        ExpressionBuilder limited = new ExpressionBuilder(DivisionMode.LEGACY_SUBTRACT, 3);

        Expression expected = operation(OperatorKind.ADD, literal(1),
                operation(OperatorKind.ADD, literal(2), literal(3)));

        assertEquals(expected, limited.build("1+2+3+4", diagnostics));
        assertTrue(diagnostics.hasWarnings());

        ParseDiagnostics exact = new ParseDiagnostics();
        limited.build("1+2+3", exact);
        assertFalse(exact.hasWarnings());
    }

    @Test
    public void testUnlimitedTermsHandlesLongEquations() {
        ExpressionBuilder unlimited = new ExpressionBuilder(DivisionMode.LEGACY_SUBTRACT, 0);
        String equation = "1" + "+1".repeat(4999);

        assertEquals(5000.0, new ExpressionEvaluator().evaluate(unlimited.build(equation)));
    }

    @Test
    public void testRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new ExpressionBuilder(DivisionMode.DIVIDE, -1));
        assertThrows(IllegalArgumentException.class, () -> new ExpressionBuilder(null, 10));
    }

    @Test
    public void testToString() {
        assertEquals("3.0 + 4.0 * 2.0", builder.build("3+4*2").toString());
    }
}
