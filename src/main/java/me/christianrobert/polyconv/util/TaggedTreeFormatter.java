package me.christianrobert.polyconv.util;

import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats an analyzed expression tree into an indented, human-readable listing.
 *
 * <p>Each node shows its kind, a short label, and {@code [query]} when the analyzer tagged it
 * as a query-API expression. Useful for seeing why a subexpression was rendered as a method
 * chain instead of native syntax.</p>
 *
 * <p>Example output for {@code r.table('users').filter(lambda row: row['age'] > 18)}:</p>
 * <pre>
 * CALL [query]
 *   ATTRIBUTE .filter [query]
 *     CALL [query]
 *       ATTRIBUTE .table [query]
 *         IDENTIFIER r [query]
 *       STRING 'users'
 *   LAMBDA (row) [query]
 *     COMPARE GT [query]
 *       SUBSCRIPT [query]
 *         IDENTIFIER row [query]
 *         STRING 'age'
 *       NUMBER 18
 * </pre>
 */
public class TaggedTreeFormatter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 40;

    /**
     * Formats a tree; nodes absent from {@code tags} are shown without a marker.
     *
     * @param root Root of the expression tree
     * @param tags Analyzer output, may be null for an untagged listing
     * @return Formatted string representation
     */
    public static String format(ExpressionNode root, QueryTags tags) {
        if (root == null) {
            return "(null tree)";
        }
        StringBuilder sb = new StringBuilder();
        formatNode(root, tags, 0, sb);
        return sb.toString();
    }

    private static void formatNode(ExpressionNode node, QueryTags tags, int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        sb.append(node.getKind());

        String label = label(node);
        if (!label.isEmpty()) {
            sb.append(' ').append(label);
        }
        if (tags != null && tags.contains(node) && tags.isQueryExpr(node)) {
            sb.append(" [query]");
        }
        sb.append('\n');

        for (ExpressionNode child : children(node)) {
            formatNode(child, tags, depth + 1, sb);
        }
    }

    private static String label(ExpressionNode node) {
        switch (node.getKind()) {
            case STRING:
                return "'" + escapeAndTruncate(((StringLiteral) node).getValue()) + "'";
            case BYTES:
                return "(" + ((BytesLiteral) node).size() + " bytes)";
            case NUMBER:
                return ((NumberLiteral) node).getText();
            case BOOLEAN:
                return String.valueOf(((BooleanLiteral) node).getValue());
            case IDENTIFIER:
                return ((Identifier) node).getName();
            case ATTRIBUTE:
                return "." + ((Attribute) node).getName();
            case UNARY_OP:
                return ((UnaryOp) node).getOperator().name();
            case BIN_OP:
                return ((BinOp) node).getOperator().name();
            case COMPARE:
                List<String> ops = new ArrayList<>();
                ((Compare) node).getOperators().forEach(op -> ops.add(op.name()));
                return String.join(" ", ops);
            case LAMBDA:
                return "(" + String.join(", ", ((Lambda) node).getParameters()) + ")";
            default:
                return "";
        }
    }

    /**
     * Children in source order. Keyword argument values follow positional arguments.
     */
    static List<ExpressionNode> children(ExpressionNode node) {
        List<ExpressionNode> children = new ArrayList<>();
        switch (node.getKind()) {
            case ATTRIBUTE:
                children.add(((Attribute) node).getBase());
                break;
            case CALL:
                Call call = (Call) node;
                children.add(call.getCallee());
                children.addAll(call.getArguments());
                for (Keyword keyword : call.getKeywords()) {
                    children.add(keyword.getValue());
                }
                break;
            case SUBSCRIPT:
                children.add(((Subscript) node).getBase());
                children.add(((Subscript) node).getIndex());
                break;
            case SLICE:
                Slice slice = (Slice) node;
                addIfPresent(children, slice.getLower());
                addIfPresent(children, slice.getUpper());
                addIfPresent(children, slice.getStep());
                break;
            case UNARY_OP:
                children.add(((UnaryOp) node).getOperand());
                break;
            case BIN_OP:
                children.add(((BinOp) node).getLeft());
                children.add(((BinOp) node).getRight());
                break;
            case COMPARE:
                children.add(((Compare) node).getLeft());
                children.addAll(((Compare) node).getComparators());
                break;
            case LIST:
                children.addAll(((ListExpr) node).getElements());
                break;
            case TUPLE:
                children.addAll(((TupleExpr) node).getElements());
                break;
            case DICT:
                DictExpr dict = (DictExpr) node;
                for (int i = 0; i < dict.size(); i++) {
                    children.add(dict.getKeys().get(i));
                    children.add(dict.getValues().get(i));
                }
                break;
            case LAMBDA:
                children.add(((Lambda) node).getBody());
                break;
            case ASSIGN:
                children.addAll(((Assign) node).getTargets());
                children.add(((Assign) node).getValue());
                break;
            case LIST_COMPREHENSION:
                ListComprehension comp = (ListComprehension) node;
                children.add(comp.getElement());
                children.add(comp.getTarget());
                children.add(comp.getIterable());
                break;
            default:
                // literals and identifiers are leaves
                break;
        }
        return children;
    }

    private static void addIfPresent(List<ExpressionNode> children, ExpressionNode node) {
        if (node != null) {
            children.add(node);
        }
    }

    private static String escapeAndTruncate(String text) {
        text = text.replace("\n", "\\n")
                   .replace("\r", "\\r")
                   .replace("\t", "\\t");
        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH) + "...";
        }
        return text;
    }
}
