package me.christianrobert.polyconv.ast;

/**
 * A named argument of a {@link Call}: {@code name=value}.
 * Not an expression on its own; it is analyzed and rendered through its call.
 */
public class Keyword {

    private final String name;
    private final ExpressionNode value;

    public Keyword(String name, ExpressionNode value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Keyword name cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("Keyword value cannot be null");
        }
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public ExpressionNode getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "Keyword{name='" + name + "', value=" + value + "}";
    }
}
