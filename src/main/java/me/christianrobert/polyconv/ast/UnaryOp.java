package me.christianrobert.polyconv.ast;

public class UnaryOp implements ExpressionNode {

    private final UnaryOperator operator;
    private final ExpressionNode operand;

    public UnaryOp(UnaryOperator operator, ExpressionNode operand) {
        if (operator == null) {
            throw new IllegalArgumentException("Unary operator cannot be null");
        }
        if (operand == null) {
            throw new IllegalArgumentException("Unary operand cannot be null");
        }
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getOperand() {
        return operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public String toString() {
        return "UnaryOp{operator=" + operator + ", operand=" + operand + "}";
    }
}
