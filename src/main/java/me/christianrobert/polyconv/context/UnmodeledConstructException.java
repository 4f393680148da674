package me.christianrobert.polyconv.context;

import me.christianrobert.polyconv.ast.ExpressionNode;

/**
 * No conversion rule exists for an observed node kind or shape.
 * Signals a gap in the converter, not a problem with the snippet.
 */
public class UnmodeledConstructException extends ConversionException {

    public UnmodeledConstructException(String message, ExpressionNode node) {
        super(message, node);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.UNMODELED_CONSTRUCT;
    }
}
