package org.snapeval.compiler.expr;

import org.snapeval.compiler.types.ScalarKind;

/**
 * The operation a binary expression selected during compilation. It stays fixed until
 * the node is compiled again.
 *
 * @param kind   Which computer runs at evaluation time.
 * @param scalar The scalar kind numeric computers work in; {@code null} for the others.
 */
record BinaryComputation(Kind kind, ScalarKind scalar) {

    enum Kind {
        ARITHMETIC,
        BITWISE,
        SHIFT,
        NUMERIC_COMPARISON,
        BOOLEAN_CONDITIONAL,
        STRING_COMPARISON,
        REFERENCE_COMPARISON
    }

    static BinaryComputation of(Kind kind) {
        return new BinaryComputation(kind, null);
    }

    static BinaryComputation of(Kind kind, ScalarKind scalar) {
        return new BinaryComputation(kind, scalar);
    }
}
