package com.sysmuse.equation;

import java.util.List;

/**
 * The value of an equation together with the warnings raised while parsing it.
 */
public class EquationResult {

    private final double value;
    private final List<String> warnings;

    public EquationResult(double value, List<String> warnings) {
        this.value = value;
        this.warnings = List.copyOf(warnings);
    }

    public double getValue() {
        return value;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * True when the equation parsed without any characters dropped or input discarded.
     */
    public boolean isClean() {
        return warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "EquationResult{value=" + value + ", warnings=" + warnings.size() + "}";
    }
}
