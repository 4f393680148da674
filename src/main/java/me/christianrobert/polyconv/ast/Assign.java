package me.christianrobert.polyconv.ast;

import java.util.List;

/**
 * Simple assignment: {@code name = value}.
 *
 * <p>The source grammar allows several targets ({@code a = b = value}); the model keeps them so
 * code builders can reject that shape explicitly instead of silently dropping targets.</p>
 */
public class Assign implements ExpressionNode {

    private final List<ExpressionNode> targets;
    private final ExpressionNode value;

    public Assign(List<ExpressionNode> targets, ExpressionNode value) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("Assignment needs at least one target");
        }
        if (value == null) {
            throw new IllegalArgumentException("Assignment value cannot be null");
        }
        this.targets = List.copyOf(targets);
        this.value = value;
    }

    public Assign(ExpressionNode target, ExpressionNode value) {
        this(List.of(target), value);
    }

    public List<ExpressionNode> getTargets() {
        return targets;
    }

    public ExpressionNode getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGN;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    @Override
    public String toString() {
        return "Assign{targets=" + targets + ", value=" + value + "}";
    }
}
