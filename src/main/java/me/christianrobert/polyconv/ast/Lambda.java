package me.christianrobert.polyconv.ast;

import java.util.List;

/**
 * Anonymous function: {@code lambda a, b: body}.
 */
public class Lambda implements ExpressionNode {

    private final List<String> parameters;
    private final ExpressionNode body;

    public Lambda(List<String> parameters, ExpressionNode body) {
        if (parameters == null) {
            throw new IllegalArgumentException("Lambda parameters cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("Lambda body cannot be null");
        }
        this.parameters = List.copyOf(parameters);
        this.body = body;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public ExpressionNode getBody() {
        return body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LAMBDA;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLambda(this);
    }

    @Override
    public String toString() {
        return "Lambda{parameters=" + parameters + ", body=" + body + "}";
    }
}
