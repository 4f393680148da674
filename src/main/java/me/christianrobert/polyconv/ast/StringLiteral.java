package me.christianrobert.polyconv.ast;

/**
 * A text literal. The value is the decoded string, escapes already resolved by the parser.
 */
public class StringLiteral implements ExpressionNode {

    private final String value;

    public StringLiteral(String value) {
        if (value == null) {
            throw new IllegalArgumentException("String literal value cannot be null");
        }
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STRING;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public String toString() {
        return "StringLiteral{value='" + value + "'}";
    }
}
