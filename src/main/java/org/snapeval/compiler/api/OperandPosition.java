package org.snapeval.compiler.api;

/**
 * Which operand of a binary expression a failure originated from.
 */
public enum OperandPosition {
    FIRST,
    SECOND
}
