package com.sysmuse.equation;

import com.sysmuse.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the warnings raised while sanitizing and building one equation.
 * Every warning is also written to the log. Not thread-safe; use one per parse.
 */
public class ParseDiagnostics {

    private final List<String> warnings = new ArrayList<>();

    public void warn(String message) {
        LoggingUtil.warn(message);
        warnings.add(message);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
