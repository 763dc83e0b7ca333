package org.snapeval.session;

import org.snapeval.compiler.api.IExpressionContext;
import org.snapeval.compiler.expr.IExpressionEvaluator;

import java.util.Objects;

/**
 * One expression to evaluate when the target stops.
 *
 * @param name    The label the result is reported under, e.g. the source text.
 * @param tree    The expression tree, compiled by the worker.
 * @param context The frame the tree is compiled against.
 */
public record ExpressionRequest(
        String name,
        IExpressionEvaluator tree,
        IExpressionContext context
) {
    public ExpressionRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(context, "context");
    }
}
