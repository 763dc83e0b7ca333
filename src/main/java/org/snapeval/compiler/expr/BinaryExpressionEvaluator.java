package org.snapeval.compiler.expr;

import org.snapeval.compiler.api.EvaluationErrorCode;
import org.snapeval.compiler.api.ExpressionCompilationException;
import org.snapeval.compiler.api.ExpressionEvaluationException;
import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.api.OperandPosition;
import org.snapeval.compiler.diagnostics.DiagnosticsEngine;
import org.snapeval.compiler.diagnostics.ErrorMessages;
import org.snapeval.compiler.types.NumericCompilerHelper;
import org.snapeval.compiler.types.ScalarKind;
import org.snapeval.compiler.types.TypeCompilerHelper;
import org.snapeval.compiler.types.TypeSignature;
import org.snapeval.coordinator.IEvalCoordinator;
import org.snapeval.runtime.value.DebugObject;
import org.snapeval.runtime.value.DebugReference;
import org.snapeval.runtime.value.ElementKind;
import org.snapeval.runtime.value.IDebugObjectFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates every binary operator: arithmetic, relational, boolean-conditional (with
 * short-circuiting), bitwise and shift.
 * <p>
 * {@link #compile} picks a {@link BinaryComputation} from the static operand types, mirroring
 * the numeric promotion of the inspected language. {@link #evaluate} evaluates the operands
 * left to right and runs that computation over the extracted payloads. Both operands are
 * already-retrieved values, so the computation itself never calls into the target.
 */
public class BinaryExpressionEvaluator implements IExpressionEvaluator {

    private final BinaryOperator operator;
    private final IExpressionEvaluator left;
    private final IExpressionEvaluator right;

    private BinaryComputation computation;
    private TypeSignature resultType = TypeSignature.OBJECT;

    /**
     * @param operator The operator.
     * @param left     The first operand; owned by this node.
     * @param right    The second operand; owned by this node.
     */
    public BinaryExpressionEvaluator(BinaryOperator operator, IExpressionEvaluator left, IExpressionEvaluator right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    @Override
    public TypeSignature getStaticType() {
        return resultType;
    }

    // region Compile

    @Override
    public void compile(IExpressionContext context, DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        computation = null;
        resultType = TypeSignature.OBJECT;

        left.compile(context, diagnostics);
        right.compile(context, diagnostics);

        switch (operator.getCategory()) {
            case ARITHMETIC -> compileArithmetic(diagnostics);
            case RELATIONAL -> compileRelational(diagnostics);
            case BOOLEAN_CONDITIONAL -> compileBooleanConditional(diagnostics);
            case LOGICAL -> compileLogical(diagnostics);
            case SHIFT -> compileShift(diagnostics);
        }
    }

    private void compileArithmetic(DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        ElementKind promoted = promote(diagnostics);
        resultType = TypeSignature.of(promoted);
        computation = BinaryComputation.of(BinaryComputation.Kind.ARITHMETIC, ScalarKind.fromElementKind(promoted));
    }

    private void compileRelational(DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        ElementKind first = left.getStaticType().elementKind();
        ElementKind second = right.getStaticType().elementKind();

        if (TypeCompilerHelper.isNumericalType(first) && TypeCompilerHelper.isNumericalType(second)) {
            ElementKind promoted = promote(diagnostics);
            resultType = TypeSignature.BOOLEAN;
            computation = BinaryComputation.of(BinaryComputation.Kind.NUMERIC_COMPARISON,
                    ScalarKind.fromElementKind(promoted));
            return;
        }

        // Ordering is only defined for numbers.
        if (operator.isOrdering()) {
            throw fail(diagnostics, EvaluationErrorCode.EXPRESSION_NOT_SUPPORTED, ErrorMessages.OPERATOR_NOT_SUPPORTED);
        }

        if (first == ElementKind.BOOLEAN && second == ElementKind.BOOLEAN) {
            compileBooleanConditional(diagnostics);
            return;
        }

        if (first == ElementKind.STRING && second == ElementKind.STRING) {
            resultType = TypeSignature.BOOLEAN;
            computation = BinaryComputation.of(BinaryComputation.Kind.STRING_COMPARISON);
        } else if (!TypeCompilerHelper.isNumericalType(first) && !TypeCompilerHelper.isNumericalType(second)) {
            resultType = TypeSignature.BOOLEAN;
            computation = BinaryComputation.of(BinaryComputation.Kind.REFERENCE_COMPARISON);
        } else {
            throw fail(diagnostics, EvaluationErrorCode.TYPE_MISMATCH, ErrorMessages.OPERATOR_TYPE_MISMATCH);
        }
    }

    private void compileBooleanConditional(DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        if (left.getStaticType().elementKind() != ElementKind.BOOLEAN
                || right.getStaticType().elementKind() != ElementKind.BOOLEAN) {
            throw fail(diagnostics, EvaluationErrorCode.TYPE_MISMATCH, ErrorMessages.OPERATOR_TYPE_MISMATCH);
        }
        resultType = TypeSignature.BOOLEAN;
        computation = BinaryComputation.of(BinaryComputation.Kind.BOOLEAN_CONDITIONAL);
    }

    private void compileLogical(DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        if (TypeCompilerHelper.isIntegralType(left.getStaticType().elementKind())
                && TypeCompilerHelper.isIntegralType(right.getStaticType().elementKind())) {
            ElementKind promoted = promote(diagnostics);
            resultType = TypeSignature.of(promoted);
            computation = BinaryComputation.of(BinaryComputation.Kind.BITWISE, ScalarKind.fromElementKind(promoted));
            return;
        }

        // Non-short-circuiting &, | and ^ on booleans.
        compileBooleanConditional(diagnostics);
    }

    private void compileShift(DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        ElementKind first = left.getStaticType().elementKind();
        ElementKind second = right.getStaticType().elementKind();

        if (!TypeCompilerHelper.isIntegralType(first) || !TypeCompilerHelper.isIntegralType(second)) {
            throw fail(diagnostics, EvaluationErrorCode.TYPE_MISMATCH, ErrorMessages.OPERATOR_TYPE_MISMATCH);
        }

        // The shift count has to be an int or implicitly convertible to one.
        if (!NumericCompilerHelper.isNumericallyPromotedToInt(second) && second != ElementKind.I4) {
            throw fail(diagnostics, EvaluationErrorCode.TYPE_MISMATCH, ErrorMessages.OPERATOR_TYPE_MISMATCH);
        }

        ElementKind working = NumericCompilerHelper.isNumericallyPromotedToInt(first) ? ElementKind.I4 : first;
        resultType = TypeSignature.of(working);
        computation = BinaryComputation.of(BinaryComputation.Kind.SHIFT, ScalarKind.fromElementKind(working));
    }

    private ElementKind promote(DiagnosticsEngine diagnostics) throws ExpressionCompilationException {
        Optional<ElementKind> promoted = NumericCompilerHelper.binaryNumericalPromotion(
                left.getStaticType().elementKind(), right.getStaticType().elementKind());
        if (promoted.isEmpty()) {
            throw fail(diagnostics, EvaluationErrorCode.TYPE_MISMATCH, ErrorMessages.OPERATOR_TYPE_MISMATCH);
        }
        return promoted.get();
    }

    private ExpressionCompilationException fail(DiagnosticsEngine diagnostics, EvaluationErrorCode code, String template) {
        String message = String.format(template, operator.getSymbol(),
                left.getStaticType().typeName(), right.getStaticType().typeName());
        diagnostics.reportError(code, message);
        return new ExpressionCompilationException(code, message);
    }

    // endregion

    // region Evaluate

    @Override
    public DebugObject evaluate(IEvalCoordinator coordinator, IDebugObjectFactory factory, DiagnosticsEngine diagnostics)
            throws ExpressionEvaluationException, InterruptedException {
        if (computation == null) {
            throw new IllegalStateException("Binary expression '" + operator.getSymbol() + "' was not compiled");
        }

        DebugObject first = evaluateOperand(left, OperandPosition.FIRST, coordinator, factory, diagnostics);

        try {
            if (operator == BinaryOperator.CONDITIONAL_AND && !NumericCompilerHelper.extractBoolean(first)) {
                return factory.createBoolean(false);
            }
            if (operator == BinaryOperator.CONDITIONAL_OR && NumericCompilerHelper.extractBoolean(first)) {
                return factory.createBoolean(true);
            }
        } catch (ExpressionEvaluationException e) {
            diagnostics.reportError(e.getErrorCode(), e.getMessage());
            throw e;
        }

        DebugObject second = evaluateOperand(right, OperandPosition.SECOND, coordinator, factory, diagnostics);

        try {
            return compute(first, second, factory);
        } catch (ExpressionEvaluationException e) {
            diagnostics.reportError(e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private DebugObject evaluateOperand(IExpressionEvaluator operand, OperandPosition position,
                                        IEvalCoordinator coordinator, IDebugObjectFactory factory,
                                        DiagnosticsEngine diagnostics)
            throws ExpressionEvaluationException, InterruptedException {
        try {
            return operand.evaluate(coordinator, factory, diagnostics);
        } catch (ExpressionEvaluationException e) {
            diagnostics.reportNote(position == OperandPosition.FIRST
                    ? ErrorMessages.FAILED_TO_EVAL_FIRST_SUB_EXPR
                    : ErrorMessages.FAILED_TO_EVAL_SECOND_SUB_EXPR);
            throw ExpressionEvaluationException.inOperand(position, e);
        }
    }

    private DebugObject compute(DebugObject first, DebugObject second, IDebugObjectFactory factory)
            throws ExpressionEvaluationException {
        ScalarKind scalar = computation.scalar();
        return switch (computation.kind()) {
            case ARITHMETIC -> factory.createPrimitive(scalar.getElementKind(), computeArithmetic(scalar, first, second));
            case BITWISE -> factory.createPrimitive(scalar.getElementKind(), computeBitwise(scalar, first, second));
            case SHIFT -> factory.createPrimitive(scalar.getElementKind(), computeShift(scalar, first, second));
            case NUMERIC_COMPARISON -> factory.createBoolean(compareNumbers(scalar, first, second));
            case BOOLEAN_CONDITIONAL -> factory.createBoolean(computeBoolean(first, second));
            case STRING_COMPARISON -> factory.createBoolean(compareStrings(first, second));
            case REFERENCE_COMPARISON -> factory.createBoolean(compareReferences(first, second));
        };
    }

    private Object computeArithmetic(ScalarKind scalar, DebugObject first, DebugObject second)
            throws ExpressionEvaluationException {
        return switch (scalar) {
            case INT32 -> arithmetic(NumericCompilerHelper.extractInt32(first), NumericCompilerHelper.extractInt32(second), false);
            case UINT32 -> arithmetic(NumericCompilerHelper.extractUInt32(first), NumericCompilerHelper.extractUInt32(second), true);
            case INT64 -> arithmetic(NumericCompilerHelper.extractInt64(first), NumericCompilerHelper.extractInt64(second), false);
            case UINT64 -> arithmetic(NumericCompilerHelper.extractUInt64(first), NumericCompilerHelper.extractUInt64(second), true);
            case FLOAT32 -> arithmetic(NumericCompilerHelper.extractFloat32(first), NumericCompilerHelper.extractFloat32(second));
            case FLOAT64 -> arithmetic(NumericCompilerHelper.extractFloat64(first), NumericCompilerHelper.extractFloat64(second));
        };
    }

    private int arithmetic(int x, int y, boolean unsigned) throws ExpressionEvaluationException {
        switch (operator) {
            case ADD: return x + y;
            case SUB: return x - y;
            case MUL: return x * y;
            default: break;
        }
        checkDivision(y == 0, !unsigned && x == Integer.MIN_VALUE && y == -1);
        if (operator == BinaryOperator.DIV) {
            return unsigned ? Integer.divideUnsigned(x, y) : x / y;
        }
        return unsigned ? Integer.remainderUnsigned(x, y) : x % y;
    }

    private long arithmetic(long x, long y, boolean unsigned) throws ExpressionEvaluationException {
        switch (operator) {
            case ADD: return x + y;
            case SUB: return x - y;
            case MUL: return x * y;
            default: break;
        }
        checkDivision(y == 0L, !unsigned && x == Long.MIN_VALUE && y == -1L);
        if (operator == BinaryOperator.DIV) {
            return unsigned ? Long.divideUnsigned(x, y) : x / y;
        }
        return unsigned ? Long.remainderUnsigned(x, y) : x % y;
    }

    // Floating point never traps: x / 0 is an infinity or NaN and % is the IEEE fmod.
    private float arithmetic(float x, float y) {
        return switch (operator) {
            case ADD -> x + y;
            case SUB -> x - y;
            case MUL -> x * y;
            case DIV -> x / y;
            case MOD -> x % y;
            default -> throw unexpectedOperator();
        };
    }

    private double arithmetic(double x, double y) {
        return switch (operator) {
            case ADD -> x + y;
            case SUB -> x - y;
            case MUL -> x * y;
            case DIV -> x / y;
            case MOD -> x % y;
            default -> throw unexpectedOperator();
        };
    }

    private void checkDivision(boolean divisorIsZero, boolean overflows) throws ExpressionEvaluationException {
        if (divisorIsZero) {
            throw new ExpressionEvaluationException(EvaluationErrorCode.DIVISION_BY_ZERO, ErrorMessages.DIVISION_BY_ZERO);
        }
        if (overflows) {
            throw new ExpressionEvaluationException(EvaluationErrorCode.ARITHMETIC_OVERFLOW, ErrorMessages.ARITHMETIC_OVERFLOW);
        }
    }

    private Object computeBitwise(ScalarKind scalar, DebugObject first, DebugObject second)
            throws ExpressionEvaluationException {
        switch (scalar) {
            case INT32, UINT32 -> {
                int x = scalar == ScalarKind.INT32 ? NumericCompilerHelper.extractInt32(first) : NumericCompilerHelper.extractUInt32(first);
                int y = scalar == ScalarKind.INT32 ? NumericCompilerHelper.extractInt32(second) : NumericCompilerHelper.extractUInt32(second);
                return switch (operator) {
                    case BITWISE_AND -> x & y;
                    case BITWISE_OR -> x | y;
                    case BITWISE_XOR -> x ^ y;
                    default -> throw unexpectedOperator();
                };
            }
            case INT64, UINT64 -> {
                long x = scalar == ScalarKind.INT64 ? NumericCompilerHelper.extractInt64(first) : NumericCompilerHelper.extractUInt64(first);
                long y = scalar == ScalarKind.INT64 ? NumericCompilerHelper.extractInt64(second) : NumericCompilerHelper.extractUInt64(second);
                return switch (operator) {
                    case BITWISE_AND -> x & y;
                    case BITWISE_OR -> x | y;
                    case BITWISE_XOR -> x ^ y;
                    default -> throw unexpectedOperator();
                };
            }
            default -> throw new IllegalStateException("Bitwise operation on " + scalar);
        }
    }

    /**
     * Shifts by the count masked to the width of the working kind. The two right shifts
     * differ only in the working kind picked at compile time: {@code >>} is logical on
     * unsigned kinds and arithmetic on signed ones.
     */
    private Object computeShift(ScalarKind scalar, DebugObject first, DebugObject second)
            throws ExpressionEvaluationException {
        int count = NumericCompilerHelper.extractInt32(second) & scalar.getShiftMask();
        boolean leftShift = operator == BinaryOperator.SHL;
        switch (scalar) {
            case INT32, UINT32 -> {
                int value = scalar == ScalarKind.INT32 ? NumericCompilerHelper.extractInt32(first) : NumericCompilerHelper.extractUInt32(first);
                if (leftShift) {
                    return value << count;
                }
                return scalar.isUnsigned() ? value >>> count : value >> count;
            }
            case INT64, UINT64 -> {
                long value = scalar == ScalarKind.INT64 ? NumericCompilerHelper.extractInt64(first) : NumericCompilerHelper.extractUInt64(first);
                if (leftShift) {
                    return value << count;
                }
                return scalar.isUnsigned() ? value >>> count : value >> count;
            }
            default -> throw new IllegalStateException("Shift operation on " + scalar);
        }
    }

    private boolean compareNumbers(ScalarKind scalar, DebugObject first, DebugObject second)
            throws ExpressionEvaluationException {
        if (scalar.isFloatingPoint()) {
            // float widens to double exactly, so one branch serves both kinds.
            double x = scalar == ScalarKind.FLOAT32 ? NumericCompilerHelper.extractFloat32(first) : NumericCompilerHelper.extractFloat64(first);
            double y = scalar == ScalarKind.FLOAT32 ? NumericCompilerHelper.extractFloat32(second) : NumericCompilerHelper.extractFloat64(second);
            return switch (operator) {
                case EQ -> x == y;
                case NE -> x != y;
                case LT -> x < y;
                case LE -> x <= y;
                case GT -> x > y;
                case GE -> x >= y;
                default -> throw unexpectedOperator();
            };
        }

        int comparison = switch (scalar) {
            case INT32 -> Integer.compare(NumericCompilerHelper.extractInt32(first), NumericCompilerHelper.extractInt32(second));
            case UINT32 -> Integer.compareUnsigned(NumericCompilerHelper.extractUInt32(first), NumericCompilerHelper.extractUInt32(second));
            case INT64 -> Long.compare(NumericCompilerHelper.extractInt64(first), NumericCompilerHelper.extractInt64(second));
            case UINT64 -> Long.compareUnsigned(NumericCompilerHelper.extractUInt64(first), NumericCompilerHelper.extractUInt64(second));
            default -> throw new IllegalStateException("Comparison on " + scalar);
        };
        return switch (operator) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LE -> comparison <= 0;
            case GT -> comparison > 0;
            case GE -> comparison >= 0;
            default -> throw unexpectedOperator();
        };
    }

    private boolean computeBoolean(DebugObject first, DebugObject second) throws ExpressionEvaluationException {
        boolean x = NumericCompilerHelper.extractBoolean(first);
        boolean y = NumericCompilerHelper.extractBoolean(second);
        return switch (operator) {
            case CONDITIONAL_AND, BITWISE_AND -> x && y;
            case CONDITIONAL_OR, BITWISE_OR -> x || y;
            case EQ -> x == y;
            case NE, BITWISE_XOR -> x != y;
            default -> throw unexpectedOperator();
        };
    }

    private boolean compareStrings(DebugObject first, DebugObject second) throws ExpressionEvaluationException {
        boolean equal = NumericCompilerHelper.extractText(first).equals(NumericCompilerHelper.extractText(second));
        return operator == BinaryOperator.EQ ? equal : !equal;
    }

    // Address 0 is both the null reference and a value without identity in the target.
    private boolean compareReferences(DebugObject first, DebugObject second) {
        boolean same = isNullReference(first)
                ? isNullReference(second)
                : first.getAddress() != 0L && first.getAddress() == second.getAddress();
        return operator == BinaryOperator.EQ ? same : !same;
    }

    private static boolean isNullReference(DebugObject object) {
        return object instanceof DebugReference reference && reference.isNull();
    }

    private IllegalStateException unexpectedOperator() {
        return new IllegalStateException("Operator " + operator + " does not apply to " + computation);
    }

    // endregion

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
