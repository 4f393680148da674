package me.christianrobert.polyconv.ast;

import java.util.Collections;
import java.util.List;

/**
 * Function or method invocation: {@code callee(arg1, arg2, name=value)}.
 * Positional arguments always precede keyword arguments.
 */
public class Call implements ExpressionNode {

    private final ExpressionNode callee;
    private final List<ExpressionNode> arguments;
    private final List<Keyword> keywords;

    public Call(ExpressionNode callee, List<ExpressionNode> arguments, List<Keyword> keywords) {
        if (callee == null) {
            throw new IllegalArgumentException("Call callee cannot be null");
        }
        this.callee = callee;
        this.arguments = arguments == null ? Collections.emptyList() : List.copyOf(arguments);
        this.keywords = keywords == null ? Collections.emptyList() : List.copyOf(keywords);
    }

    public Call(ExpressionNode callee, List<ExpressionNode> arguments) {
        this(callee, arguments, null);
    }

    public ExpressionNode getCallee() {
        return callee;
    }

    public List<ExpressionNode> getArguments() {
        return arguments;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    public boolean hasArguments() {
        return !arguments.isEmpty() || !keywords.isEmpty();
    }

    /**
     * Name of the invoked member when the callee is an attribute, else null.
     */
    public String getMethodName() {
        return callee instanceof Attribute ? ((Attribute) callee).getName() : null;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CALL;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public String toString() {
        return "Call{callee=" + callee + ", arguments=" + arguments + ", keywords=" + keywords + "}";
    }
}
