package com.sysmuse.equation;

/**
 * The four binary operators an equation may contain.
 */
public enum OperatorKind {
    ADD('+') {
        @Override
        public double apply(double lhs, double rhs) {
            return lhs + rhs;
        }
    },
    SUBTRACT('-') {
        @Override
        public double apply(double lhs, double rhs) {
            return lhs - rhs;
        }
    },
    MULTIPLY('*') {
        @Override
        public double apply(double lhs, double rhs) {
            return lhs * rhs;
        }
    },
    DIVIDE('/') {
        // IEEE-754: x/0 is +-Infinity, 0/0 is NaN
        @Override
        public double apply(double lhs, double rhs) {
            return lhs / rhs;
        }
    };

    private final char symbol;

    OperatorKind(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public abstract double apply(double lhs, double rhs);

    /**
     * True if the character is one of {@code + - * /}.
     */
    public static boolean isOperatorSymbol(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/';
    }
}
