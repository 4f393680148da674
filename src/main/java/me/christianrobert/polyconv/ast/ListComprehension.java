package me.christianrobert.polyconv.ast;

/**
 * Single-generator list comprehension: {@code [element for target in iterable]}.
 *
 * <p>Only the {@code range(...)} map idiom used by the test corpus is translatable;
 * code builders reject every other iterable.</p>
 */
public class ListComprehension implements ExpressionNode {

    private final ExpressionNode element;
    private final ExpressionNode target;
    private final ExpressionNode iterable;

    public ListComprehension(ExpressionNode element, ExpressionNode target, ExpressionNode iterable) {
        if (element == null || target == null || iterable == null) {
            throw new IllegalArgumentException("List comprehension element, target and iterable are required");
        }
        this.element = element;
        this.target = target;
        this.iterable = iterable;
    }

    public ExpressionNode getElement() {
        return element;
    }

    public ExpressionNode getTarget() {
        return target;
    }

    public ExpressionNode getIterable() {
        return iterable;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LIST_COMPREHENSION;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitListComprehension(this);
    }

    @Override
    public String toString() {
        return "ListComprehension{element=" + element + ", target=" + target + ", iterable=" + iterable + "}";
    }
}
