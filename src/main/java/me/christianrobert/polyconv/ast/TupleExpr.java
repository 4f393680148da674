package me.christianrobert.polyconv.ast;

import java.util.List;

/**
 * Tuple display. Every target renders it exactly like a {@link ListExpr}.
 */
public class TupleExpr implements ExpressionNode {

    private final List<ExpressionNode> elements;

    public TupleExpr(List<ExpressionNode> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("Tuple elements cannot be null");
        }
        this.elements = List.copyOf(elements);
    }

    public List<ExpressionNode> getElements() {
        return elements;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TUPLE;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public String toString() {
        return "TupleExpr{elements=" + elements + "}";
    }
}
