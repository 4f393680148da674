package me.christianrobert.polyconv.ast;

import java.util.List;

public class ListExpr implements ExpressionNode {

    private final List<ExpressionNode> elements;

    public ListExpr(List<ExpressionNode> elements) {
        if (elements == null) {
            throw new IllegalArgumentException("List elements cannot be null");
        }
        this.elements = List.copyOf(elements);
    }

    public List<ExpressionNode> getElements() {
        return elements;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public String toString() {
        return "ListExpr{elements=" + elements + "}";
    }
}
