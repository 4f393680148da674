package me.christianrobert.polyconv.ast;

/**
 * The source language's null constant.
 */
public class NullLiteral implements ExpressionNode {

    @Override
    public NodeKind getKind() {
        return NodeKind.NULL;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNull(this);
    }

    @Override
    public String toString() {
        return "NullLiteral{}";
    }
}
