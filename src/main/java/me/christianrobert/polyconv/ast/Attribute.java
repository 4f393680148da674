package me.christianrobert.polyconv.ast;

/**
 * Member access: {@code base.name}.
 */
public class Attribute implements ExpressionNode {

    private final ExpressionNode base;
    private final String name;

    public Attribute(ExpressionNode base, String name) {
        if (base == null) {
            throw new IllegalArgumentException("Attribute base cannot be null");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Attribute name cannot be null or empty");
        }
        this.base = base;
        this.name = name;
    }

    public ExpressionNode getBase() {
        return base;
    }

    public String getName() {
        return name;
    }

    /**
     * Checks for the shape {@code root.name} where root is a bare identifier.
     */
    public boolean matches(String rootName, String attributeName) {
        return base instanceof Identifier
            && ((Identifier) base).hasName(rootName)
            && name.equals(attributeName);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }

    @Override
    public String toString() {
        return "Attribute{base=" + base + ", name='" + name + "'}";
    }
}
