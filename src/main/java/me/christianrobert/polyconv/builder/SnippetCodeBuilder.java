package me.christianrobert.polyconv.builder;

import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;
import me.christianrobert.polyconv.context.UnmodeledConstructException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class of the target code builders.
 *
 * <p>A builder renders one analyzed snippet: it is created per conversion, walks the tree once
 * left to right and returns the target code. Each subclass must handle every {@link NodeKind};
 * anything it cannot express aborts the conversion with a
 * {@link me.christianrobert.polyconv.context.ConversionException}.</p>
 *
 * <p>The helpers here cover what the targets share: tag lookups, the skip/transform rule chain,
 * and rendering query-API operators as method chains with an explicit lift of native left operands.</p>
 */
public abstract class SnippetCodeBuilder implements ExpressionVisitor<String> {

    // no logging here, builders run once per fixture and failures surface as exceptions

    protected final QueryTags tags;
    protected final EmitterConfig config;

    protected SnippetCodeBuilder(QueryTags tags, EmitterConfig config) {
        if (tags == null) {
            throw new IllegalArgumentException("Query tags cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("Emitter config cannot be null");
        }
        this.tags = tags;
        this.config = config;
    }

    /**
     * Renders a whole snippet.
     */
    public String build(ExpressionNode root) {
        return visit(root);
    }

    public String visit(ExpressionNode node) {
        return node.accept(this);
    }

    public boolean isQueryExpr(ExpressionNode node) {
        return tags.isQueryExpr(node);
    }

    public EmitterConfig getConfig() {
        return config;
    }

    /**
     * Ordered skip/transform rules consulted before a call is rendered generically.
     */
    protected abstract List<CallRule> callRules();

    /**
     * Runs the rule chain; the first rule that produces code wins.
     *
     * @return replacement code, or null when no rule matched
     */
    protected String applyCallRules(Call call) {
        for (CallRule rule : callRules()) {
            String rewritten = rule.apply(call, this);
            if (rewritten != null) {
                return rewritten;
            }
        }
        return null;
    }

    protected String join(String separator, List<ExpressionNode> nodes) {
        return nodes.stream().map(this::visit).collect(Collectors.joining(separator));
    }

    // ========== Query-API operator chains ==========

    /**
     * Renders a node, wrapping it in {@code r.expr(...)} unless it already is a query expression.
     */
    protected String liftIfNative(ExpressionNode node) {
        String rendered = visit(node);
        if (isQueryExpr(node)) {
            return rendered;
        }
        return config.getDefaultRootName() + ".expr(" + rendered + ")";
    }

    /**
     * {@code left.add(right)}; a native left operand is lifted first.
     */
    protected String renderQueryBinOp(BinOp node) {
        String method = QueryOperatorNames.binary(node.getOperator());
        if (method == null) {
            throw new UnmodeledConstructException(
                "Operator " + node.getOperator() + " has no query-API method", node);
        }
        return liftIfNative(node.getLeft()) + "." + method + "(" + visit(node.getRight()) + ")";
    }

    /**
     * {@code (left).gt(right)} for a binary comparison; a native left operand is lifted instead
     * of parenthesized.
     */
    protected String renderQueryCompare(Compare node) {
        CompareOperator operator = node.getOperators().get(0);
        String method = QueryOperatorNames.compare(operator);
        if (method == null) {
            throw new UnmodeledConstructException(
                "Comparison " + operator + " has no query-API method", node);
        }
        ExpressionNode left = node.getLeft();
        String leftCode = isQueryExpr(left) ? "(" + visit(left) + ")" : liftIfNative(left);
        return leftCode + "." + method + "(" + visit(node.getComparators().get(0)) + ")";
    }

    // ========== Shared rejections ==========

    /**
     * Frozen sets have no literal in any target driver.
     */
    protected void rejectUnsupportedName(Identifier node) {
        if (node.hasName("frozenset")) {
            throw new IntentionallyUnsupportedException("Frozen sets cannot be converted to grouped data", node);
        }
    }

    /**
     * Slices only make sense as a subscript index; builders render them from
     * {@link #visitSubscript(Subscript)}.
     */
    @Override
    public String visitSlice(Slice node) {
        throw new UnmodeledConstructException("Slice outside of a subscript", node);
    }
}
