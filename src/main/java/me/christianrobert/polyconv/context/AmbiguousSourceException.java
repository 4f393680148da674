package me.christianrobert.polyconv.context;

import me.christianrobert.polyconv.ast.ExpressionNode;

/**
 * The snippet uses a construct the target backend cannot express without guessing,
 * such as a chained comparison on a backend that only renders binary comparisons.
 */
public class AmbiguousSourceException extends ConversionException {

    public AmbiguousSourceException(String message, ExpressionNode node) {
        super(message, node);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.AMBIGUOUS_SOURCE;
    }
}
