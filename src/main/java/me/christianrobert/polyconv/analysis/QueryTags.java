package me.christianrobert.polyconv.analysis;

import me.christianrobert.polyconv.ast.ExpressionNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Analyzer output: for each node (by identity) whether it is a query-API expression.
 *
 * <p>Kept outside the nodes so the same tree can be analyzed under different scopes.
 * Instances are read-only once the analyzer hands them out.</p>
 */
public final class QueryTags {

    private final Map<ExpressionNode, Boolean> tags;

    QueryTags(IdentityHashMap<ExpressionNode, Boolean> tags) {
        this.tags = Collections.unmodifiableMap(tags);
    }

    /**
     * Whether the node must render as a query-API call or method chain.
     *
     * @throws IllegalStateException if the node was not part of the analyzed tree
     */
    public boolean isQueryExpr(ExpressionNode node) {
        Boolean tag = tags.get(node);
        if (tag == null) {
            throw new IllegalStateException("Node was not analyzed: " + node);
        }
        return tag;
    }

    public boolean contains(ExpressionNode node) {
        return tags.containsKey(node);
    }

    public int size() {
        return tags.size();
    }

    public long countQueryExprs() {
        return tags.values().stream().filter(Boolean::booleanValue).count();
    }

    @Override
    public String toString() {
        return "QueryTags{nodes=" + tags.size() + ", queryExprs=" + countQueryExprs() + "}";
    }
}
