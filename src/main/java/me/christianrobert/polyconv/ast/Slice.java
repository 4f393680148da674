package me.christianrobert.polyconv.ast;

/**
 * Slice bounds inside a subscript: {@code [lower:upper:step]}. Every bound is optional (null).
 */
public class Slice implements ExpressionNode {

    private final ExpressionNode lower;
    private final ExpressionNode upper;
    private final ExpressionNode step;

    public Slice(ExpressionNode lower, ExpressionNode upper, ExpressionNode step) {
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    public Slice(ExpressionNode lower, ExpressionNode upper) {
        this(lower, upper, null);
    }

    public ExpressionNode getLower() {
        return lower;
    }

    public ExpressionNode getUpper() {
        return upper;
    }

    public ExpressionNode getStep() {
        return step;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SLICE;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }

    @Override
    public String toString() {
        return "Slice{lower=" + lower + ", upper=" + upper + ", step=" + step + "}";
    }
}
