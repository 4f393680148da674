package me.christianrobert.polyconv.ast;

public class BinOp implements ExpressionNode {

    private final BinaryOperator operator;
    private final ExpressionNode left;
    private final ExpressionNode right;

    public BinOp(BinaryOperator operator, ExpressionNode left, ExpressionNode right) {
        if (operator == null) {
            throw new IllegalArgumentException("Binary operator cannot be null");
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Binary operands cannot be null");
        }
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public ExpressionNode getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BIN_OP;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinOp(this);
    }

    @Override
    public String toString() {
        return "BinOp{operator=" + operator + ", left=" + left + ", right=" + right + "}";
    }
}
