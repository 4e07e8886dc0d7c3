package com.sysmuse.equation;

import com.sysmuse.util.LoggingUtil;

/**
 * Solves equations such as {@code "3+4*2"} strictly left to right.
 * <p>
 * Characters other than digits, '.', '+', '-', '*' and '/' are dropped with a warning.
 * A leading '-' makes the first number of the equation (or of what follows an operator)
 * negative. Order of operations and parentheses are not supported: {@code "3+4*2"} is 14.
 * <p>
 * Solving never throws; input with no usable number evaluates to 0.
 * Instances are immutable and may be shared between threads.
 */
public class EquationParser {

    private final ExpressionBuilder builder;
    private final ExpressionEvaluator evaluator;

    public EquationParser() {
        this(new ExpressionBuilder(), new ExpressionEvaluator());
    }

    /**
     * Create a parser from configuration, reconfiguring logging from its "logging" section.
     */
    public EquationParser(EquationConfig config) {
        this(new ExpressionBuilder(config.getDivisionMode(), config.getMaxTerms()),
                new ExpressionEvaluator(config.getEvaluationOrder()));
        LoggingUtil.configure(config);
    }

    public EquationParser(ExpressionBuilder builder, ExpressionEvaluator evaluator) {
        this.builder = builder;
        this.evaluator = evaluator;
    }

    public double solve(String equation) {
        return evaluator.evaluate(parse(equation));
    }

    /**
     * The tree for {@code equation} after sanitizing.
     */
    public Expression parse(String equation) {
        return parse(equation, new ParseDiagnostics());
    }

    /**
     * Solve {@code equation} and report every character dropped or input discarded on the way.
     */
    public EquationResult solveWithDiagnostics(String equation) {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        double value = evaluator.evaluate(parse(equation, diagnostics));
        return new EquationResult(value, diagnostics.getWarnings());
    }

    private Expression parse(String equation, ParseDiagnostics diagnostics) {
        String sanitized = EquationSanitizer.sanitize(equation, diagnostics);
        Expression expression = builder.build(sanitized, diagnostics);
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Parsed \"" + equation + "\" as " + expression);
        }
        return expression;
    }

    public ExpressionBuilder getBuilder() {
        return builder;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }
}
