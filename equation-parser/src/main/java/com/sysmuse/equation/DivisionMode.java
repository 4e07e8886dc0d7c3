package com.sysmuse.equation;

/**
 * Defines how the builder classifies the '/' character.
 */
public enum DivisionMode {
    /**
     * '/' builds a SUBTRACT node. Matches the results of earlier releases.
     */
    LEGACY_SUBTRACT,

    /**
     * '/' builds a DIVIDE node.
     */
    DIVIDE
}
