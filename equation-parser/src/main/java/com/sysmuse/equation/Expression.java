package com.sysmuse.equation;

import java.util.Objects;

/**
 * A node of an equation tree: either a number or an operator applied to two sub-expressions.
 * <p>
 * Trees produced by {@link ExpressionBuilder} are comb-shaped: every {@link Operation}
 * has a {@link Literal} on its left and the rest of the equation on its right.
 */
public sealed interface Expression {

    record Literal(double value) implements Expression {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Operation(OperatorKind kind, Expression lhs, Expression rhs) implements Expression {
        public Operation {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public String toString() {
            return lhs + " " + kind.getSymbol() + " " + rhs;
        }
    }

    static Literal literal(double value) {
        return new Literal(value);
    }

    static Operation operation(OperatorKind kind, Expression lhs, Expression rhs) {
        return new Operation(kind, lhs, rhs);
    }
}
