package me.christianrobert.polyconv.ast;

/**
 * Base interface for all nodes of a parsed snippet.
 *
 * <p>Nodes are immutable. They carry no analysis state: whether a node belongs to the
 * query API is recorded by {@link me.christianrobert.polyconv.analysis.QueryContextAnalyzer}
 * in a separate identity map, so one tree can be analyzed under several scopes.</p>
 *
 * <p>Every consumer walks the tree through {@link ExpressionVisitor}, which has one method per
 * {@link NodeKind}. A new kind therefore has to be handled by the analyzer and by every code
 * builder before the project compiles again.</p>
 */
public interface ExpressionNode {

    NodeKind getKind();

    <R> R accept(ExpressionVisitor<R> visitor);
}
