package me.christianrobert.polyconv.ast;

import java.util.List;

/**
 * Mapping display: {@code {k1: v1, k2: v2}}. Keys and values are parallel lists.
 */
public class DictExpr implements ExpressionNode {

    private final List<ExpressionNode> keys;
    private final List<ExpressionNode> values;

    public DictExpr(List<ExpressionNode> keys, List<ExpressionNode> values) {
        if (keys == null || values == null) {
            throw new IllegalArgumentException("Dict keys and values cannot be null");
        }
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException(
                "Dict has " + keys.size() + " keys but " + values.size() + " values");
        }
        this.keys = List.copyOf(keys);
        this.values = List.copyOf(values);
    }

    public List<ExpressionNode> getKeys() {
        return keys;
    }

    public List<ExpressionNode> getValues() {
        return values;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DICT;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDict(this);
    }

    @Override
    public String toString() {
        return "DictExpr{keys=" + keys + ", values=" + values + "}";
    }
}
