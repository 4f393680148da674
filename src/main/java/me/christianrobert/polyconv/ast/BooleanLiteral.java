package me.christianrobert.polyconv.ast;

public class BooleanLiteral implements ExpressionNode {

    private final boolean value;

    public BooleanLiteral(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BOOLEAN;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public String toString() {
        return "BooleanLiteral{value=" + value + "}";
    }
}
