package me.christianrobert.polyconv.ast;

import java.util.List;

/**
 * Comparison, possibly chained: {@code left op1 c1 op2 c2 ...}.
 * There is exactly one operator per comparator.
 */
public class Compare implements ExpressionNode {

    private final ExpressionNode left;
    private final List<CompareOperator> operators;
    private final List<ExpressionNode> comparators;

    public Compare(ExpressionNode left, List<CompareOperator> operators, List<ExpressionNode> comparators) {
        if (left == null) {
            throw new IllegalArgumentException("Compare left operand cannot be null");
        }
        if (operators == null || comparators == null || operators.isEmpty()) {
            throw new IllegalArgumentException("Compare needs at least one operator and comparator");
        }
        if (operators.size() != comparators.size()) {
            throw new IllegalArgumentException(
                "Compare operator count " + operators.size() + " does not match comparator count " + comparators.size());
        }
        this.left = left;
        this.operators = List.copyOf(operators);
        this.comparators = List.copyOf(comparators);
    }

    /**
     * Creates a simple two-operand comparison.
     */
    public static Compare of(ExpressionNode left, CompareOperator operator, ExpressionNode right) {
        return new Compare(left, List.of(operator), List.of(right));
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public List<CompareOperator> getOperators() {
        return operators;
    }

    public List<ExpressionNode> getComparators() {
        return comparators;
    }

    public boolean isChained() {
        return comparators.size() > 1;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPARE;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCompare(this);
    }

    @Override
    public String toString() {
        return "Compare{left=" + left + ", operators=" + operators + ", comparators=" + comparators + "}";
    }
}
