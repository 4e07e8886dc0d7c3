package com.sysmuse.equation;

import com.sysmuse.equation.Expression.Literal;
import com.sysmuse.equation.Expression.Operation;

/**
 * Reduces an expression tree to a number.
 * <p>
 * Builder trees lean right ({@code 3 + (4 * 2)}) but equations are read left to right,
 * so in {@link EvaluationOrder#LEFT_TO_RIGHT} an operation is reduced by carrying a running
 * value down its right spine: {@code ((3 + 4) * 2)}.
 */
public class ExpressionEvaluator {

    private final EvaluationOrder order;

    public ExpressionEvaluator() {
        this(EvaluationOrder.LEFT_TO_RIGHT);
    }

    public ExpressionEvaluator(EvaluationOrder order) {
        if (order == null) {
            throw new IllegalArgumentException("order must not be null");
        }
        this.order = order;
    }

    public EvaluationOrder getOrder() {
        return order;
    }

    public double evaluate(Expression expression) {
        return switch (order) {
            case LEFT_TO_RIGHT -> foldLeft(expression);
            case NESTED -> nested(expression);
        };
    }

    private double foldLeft(Expression expression) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }

        Operation op = (Operation) expression;
        double acc = foldLeft(op.lhs());
        OperatorKind pending = op.kind();
        Expression next = op.rhs();

        while (next instanceof Operation spine) {
            acc = pending.apply(acc, foldLeft(spine.lhs()));
            pending = spine.kind();
            next = spine.rhs();
        }
        return pending.apply(acc, ((Literal) next).value());
    }

    private double nested(Expression expression) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        Operation op = (Operation) expression;
        return op.kind().apply(nested(op.lhs()), nested(op.rhs()));
    }
}
