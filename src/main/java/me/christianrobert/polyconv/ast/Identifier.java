package me.christianrobert.polyconv.ast;

/**
 * A bare name: a variable, a lambda parameter, a function, or the query-API root itself.
 */
public class Identifier implements ExpressionNode {

    private final String name;

    public Identifier(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Identifier name cannot be null or empty");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean hasName(String candidate) {
        return name.equals(candidate);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return "Identifier{name='" + name + "'}";
    }
}
