package me.christianrobert.polyconv.context;

import me.christianrobert.polyconv.ast.ExpressionNode;

/**
 * A skip rule recognized a snippet that deliberately has no translation for the target
 * (for example an arity assertion the target's type system already enforces).
 * Callers treat this as an expected omission rather than a bug.
 */
public class IntentionallyUnsupportedException extends ConversionException {

    public IntentionallyUnsupportedException(String message, ExpressionNode node) {
        super(message, node);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.INTENTIONALLY_UNSUPPORTED;
    }
}
