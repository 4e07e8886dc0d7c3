package com.sysmuse.equation;

/**
 * Describes how an expression tree is reduced to a number:
 * LEFT_TO_RIGHT: operators applied in the order they appear, 3+4*2 = 14
 * NESTED: each node reduced as op(lhs, rhs), right-associative on builder trees, 3+4*2 = 11
 */
public enum EvaluationOrder {
    LEFT_TO_RIGHT,
    NESTED
}
