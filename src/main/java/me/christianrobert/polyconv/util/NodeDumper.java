package me.christianrobert.polyconv.util;

import me.christianrobert.polyconv.ast.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a node as a compact one-line structural dump, used in error messages and logs.
 *
 * <p>Example: {@code Call(callee=Attribute(Identifier('r'), 'table'), args=[String('users')])}</p>
 */
public final class NodeDumper implements ExpressionVisitor<String> {

    private static final NodeDumper INSTANCE = new NodeDumper();

    private NodeDumper() {
    }

    public static String dump(ExpressionNode node) {
        if (node == null) {
            return "None";
        }
        return node.accept(INSTANCE);
    }

    private String all(List<ExpressionNode> nodes) {
        return nodes.stream().map(NodeDumper::dump).collect(Collectors.joining(", ", "[", "]"));
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + "'";
    }

    @Override
    public String visitString(StringLiteral node) {
        return "String(" + quote(node.getValue()) + ")";
    }

    @Override
    public String visitBytes(BytesLiteral node) {
        StringBuilder sb = new StringBuilder("Bytes(");
        for (int i = 0; i < node.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("%02x", node.get(i)));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitNumber(NumberLiteral node) {
        return "Number(" + node.getText() + ")";
    }

    @Override
    public String visitBoolean(BooleanLiteral node) {
        return node.getValue() ? "True" : "False";
    }

    @Override
    public String visitNull(NullLiteral node) {
        return "None";
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return "Identifier(" + quote(node.getName()) + ")";
    }

    @Override
    public String visitAttribute(Attribute node) {
        return "Attribute(" + dump(node.getBase()) + ", " + quote(node.getName()) + ")";
    }

    @Override
    public String visitCall(Call node) {
        StringBuilder sb = new StringBuilder("Call(callee=").append(dump(node.getCallee()));
        sb.append(", args=").append(all(node.getArguments()));
        if (!node.getKeywords().isEmpty()) {
            sb.append(", keywords=").append(node.getKeywords().stream()
                    .map(k -> k.getName() + "=" + dump(k.getValue()))
                    .collect(Collectors.joining(", ", "[", "]")));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitSubscript(Subscript node) {
        return "Subscript(" + dump(node.getBase()) + ", " + dump(node.getIndex()) + ")";
    }

    @Override
    public String visitSlice(Slice node) {
        return "Slice(" + dump(node.getLower()) + ", " + dump(node.getUpper()) + ", " + dump(node.getStep()) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return "UnaryOp(" + node.getOperator() + ", " + dump(node.getOperand()) + ")";
    }

    @Override
    public String visitBinOp(BinOp node) {
        return "BinOp(" + dump(node.getLeft()) + ", " + node.getOperator() + ", " + dump(node.getRight()) + ")";
    }

    @Override
    public String visitCompare(Compare node) {
        return "Compare(" + dump(node.getLeft()) + ", " + node.getOperators() + ", " + all(node.getComparators()) + ")";
    }

    @Override
    public String visitList(ListExpr node) {
        return "List(" + all(node.getElements()) + ")";
    }

    @Override
    public String visitTuple(TupleExpr node) {
        return "Tuple(" + all(node.getElements()) + ")";
    }

    @Override
    public String visitDict(DictExpr node) {
        return "Dict(keys=" + all(node.getKeys()) + ", values=" + all(node.getValues()) + ")";
    }

    @Override
    public String visitLambda(Lambda node) {
        return "Lambda(" + node.getParameters() + ", " + dump(node.getBody()) + ")";
    }

    @Override
    public String visitAssign(Assign node) {
        return "Assign(targets=" + all(node.getTargets()) + ", value=" + dump(node.getValue()) + ")";
    }

    @Override
    public String visitListComprehension(ListComprehension node) {
        return "ListComp(" + dump(node.getElement()) + ", for " + dump(node.getTarget())
                + " in " + dump(node.getIterable()) + ")";
    }
}
