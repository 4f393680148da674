package me.christianrobert.polyconv.ast;

/**
 * Indexing: {@code base[index]}. The index is either a plain expression or a {@link Slice}.
 */
public class Subscript implements ExpressionNode {

    private final ExpressionNode base;
    private final ExpressionNode index;

    public Subscript(ExpressionNode base, ExpressionNode index) {
        if (base == null) {
            throw new IllegalArgumentException("Subscript base cannot be null");
        }
        if (index == null) {
            throw new IllegalArgumentException("Subscript index cannot be null");
        }
        this.base = base;
        this.index = index;
    }

    public ExpressionNode getBase() {
        return base;
    }

    public ExpressionNode getIndex() {
        return index;
    }

    public boolean isSlice() {
        return index instanceof Slice;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SUBSCRIPT;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }

    @Override
    public String toString() {
        return "Subscript{base=" + base + ", index=" + index + "}";
    }
}
