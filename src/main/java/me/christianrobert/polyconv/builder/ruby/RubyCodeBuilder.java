package me.christianrobert.polyconv.builder.ruby;

import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.builder.CallRule;
import me.christianrobert.polyconv.builder.LiteralEscaper;
import me.christianrobert.polyconv.builder.SnippetCodeBuilder;
import me.christianrobert.polyconv.builder.rules.StringEncodeRule;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;
import me.christianrobert.polyconv.context.UnmodeledConstructException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a snippet as Ruby code against the Ruby driver.
 *
 * <p>The Ruby driver overloads the operators, so operators are always native and query tags only
 * matter to the call rules. Names keep their source spelling; a trailing lambda argument becomes
 * a block.</p>
 */
public class RubyCodeBuilder extends SnippetCodeBuilder {

    private static final List<CallRule> CALL_RULES = List.of(
        StringEncodeRule.forRuby()
    );

    private static final Map<String, String> NAME_CONSTANTS = Map.of(
        "True", "true",
        "False", "false",
        "None", "nil"
    );

    private static final Map<UnaryOperator, String> UNARY_OPERATORS = Map.of(
        UnaryOperator.MINUS, "-",
        UnaryOperator.PLUS, "+",
        UnaryOperator.NOT, "!",
        UnaryOperator.INVERT, "~"
    );

    private static final Map<BinaryOperator, String> BINARY_OPERATORS = Map.of(
        BinaryOperator.ADD, " + ",
        BinaryOperator.SUB, " - ",
        BinaryOperator.MULT, " * ",
        BinaryOperator.DIV, " / ",
        BinaryOperator.MOD, " % ",
        BinaryOperator.POW, " ** ",
        BinaryOperator.BIT_AND, " & ",
        BinaryOperator.BIT_OR, " | ",
        BinaryOperator.BIT_XOR, " ^ "
    );

    private static final Map<CompareOperator, String> COMPARE_OPERATORS = Map.of(
        CompareOperator.LT, " < ",
        CompareOperator.GT, " > ",
        CompareOperator.LT_E, " <= ",
        CompareOperator.GT_E, " >= ",
        CompareOperator.EQ, " == ",
        CompareOperator.NOT_EQ, " != "
    );

    public RubyCodeBuilder(QueryTags tags, EmitterConfig config) {
        super(tags, config);
    }

    @Override
    protected List<CallRule> callRules() {
        return CALL_RULES;
    }

    // ========== Literals ==========

    @Override
    public String visitString(StringLiteral node) {
        return LiteralEscaper.rubyString(node.getValue());
    }

    @Override
    public String visitBytes(BytesLiteral node) {
        return LiteralEscaper.byteString(node, '"', true) + ".force_encoding('BINARY')";
    }

    @Override
    public String visitNumber(NumberLiteral node) {
        return node.getText();
    }

    @Override
    public String visitBoolean(BooleanLiteral node) {
        return node.getValue() ? "true" : "false";
    }

    @Override
    public String visitNull(NullLiteral node) {
        return "nil";
    }

    // ========== Names ==========

    @Override
    public String visitIdentifier(Identifier node) {
        rejectUnsupportedName(node);
        return NAME_CONSTANTS.getOrDefault(node.getName(), node.getName());
    }

    @Override
    public String visitAttribute(Attribute node) {
        return visit(node.getBase()) + "." + node.getName();
    }

    // ========== Calls ==========

    /**
     * {@code r.expr(x)} is spelled {@code r(x)}; empty argument lists are dropped and a trailing
     * lambda is passed as a block.
     */
    @Override
    public String visitCall(Call node) {
        String rewritten = applyCallRules(node);
        if (rewritten != null) {
            return rewritten;
        }

        String callee = isExprCall(node) ? visit(((Attribute) node.getCallee()).getBase()) : visit(node.getCallee());

        List<ExpressionNode> positional = new ArrayList<>(node.getArguments());
        ExpressionNode block = null;
        if (!positional.isEmpty() && positional.get(positional.size() - 1) instanceof Lambda) {
            block = positional.remove(positional.size() - 1);
        }

        StringBuilder sb = new StringBuilder(callee);
        if (!positional.isEmpty() || !node.getKeywords().isEmpty()) {
            StringJoiner arguments = new StringJoiner(", ", "(", ")");
            for (ExpressionNode argument : positional) {
                arguments.add(visit(argument));
            }
            for (Keyword keyword : node.getKeywords()) {
                arguments.add(keyword.getName() + ": " + visit(keyword.getValue()));
            }
            sb.append(arguments);
        }
        if (block != null) {
            sb.append(visit(block));
        }
        return sb.toString();
    }

    private boolean isExprCall(Call node) {
        if (!(node.getCallee() instanceof Attribute)) {
            return false;
        }
        Attribute callee = (Attribute) node.getCallee();
        return "expr".equals(callee.getName())
                && callee.getBase() instanceof Identifier
                && config.isQueryRoot(((Identifier) callee.getBase()).getName());
    }

    @Override
    public String visitLambda(Lambda node) {
        return "{|" + String.join(", ", node.getParameters()) + "| " + visit(node.getBody()) + "}";
    }

    // ========== Subscripts ==========

    /**
     * {@code base[idx]}; slices use an exclusive range, or {@code (l..-1)} when open-ended.
     */
    @Override
    public String visitSubscript(Subscript node) {
        String base = visit(node.getBase());
        if (!node.isSlice()) {
            return base + "[" + visit(node.getIndex()) + "]";
        }
        Slice slice = (Slice) node.getIndex();
        if (slice.getStep() != null) {
            throw new UnmodeledConstructException("Slice steps have no Ruby equivalent", node);
        }
        String lower = slice.getLower() != null ? visit(slice.getLower()) : "0";
        String range = slice.getUpper() != null ? lower + "..." + visit(slice.getUpper()) : lower + "..-1";
        return base + "[(" + range + ")]";
    }

    // ========== Operators ==========

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return UNARY_OPERATORS.get(node.getOperator()) + visit(node.getOperand());
    }

    @Override
    public String visitBinOp(BinOp node) {
        String symbol = BINARY_OPERATORS.get(node.getOperator());
        if (symbol == null) {
            throw new UnmodeledConstructException("No Ruby operator for " + node.getOperator(), node);
        }
        return "(" + visit(node.getLeft()) + symbol + visit(node.getRight()) + ")";
    }

    /**
     * Chained comparisons are split into pairs: {@code a < b < c} becomes {@code a < b && b < c}.
     * The shared operand is rendered twice.
     */
    @Override
    public String visitCompare(Compare node) {
        StringJoiner pairs = new StringJoiner(" && ");
        ExpressionNode left = node.getLeft();
        for (int i = 0; i < node.getOperators().size(); i++) {
            CompareOperator operator = node.getOperators().get(i);
            String symbol = COMPARE_OPERATORS.get(operator);
            if (symbol == null) {
                throw new UnmodeledConstructException("No Ruby operator for " + operator, node);
            }
            ExpressionNode right = node.getComparators().get(i);
            pairs.add(visit(left) + symbol + visit(right));
            left = right;
        }
        return pairs.toString();
    }

    // ========== Containers ==========

    @Override
    public String visitList(ListExpr node) {
        return "[" + join(", ", node.getElements()) + "]";
    }

    @Override
    public String visitTuple(TupleExpr node) {
        return "[" + join(", ", node.getElements()) + "]";
    }

    @Override
    public String visitDict(DictExpr node) {
        StringJoiner entries = new StringJoiner(", ", "{", "}");
        for (int i = 0; i < node.size(); i++) {
            entries.add(visit(node.getKeys().get(i)) + " => " + visit(node.getValues().get(i)));
        }
        return entries.toString();
    }

    @Override
    public String visitListComprehension(ListComprehension node) {
        throw new IntentionallyUnsupportedException("List comprehensions are not converted to Ruby", node);
    }

    // ========== Statements ==========

    @Override
    public String visitAssign(Assign node) {
        if (node.getTargets().size() != 1) {
            throw new UnmodeledConstructException("Only single-target assignment is supported", node);
        }
        ExpressionNode target = node.getTargets().get(0);
        if (!(target instanceof Identifier)) {
            throw new UnmodeledConstructException("Assignment target must be a plain name", node);
        }
        return ((Identifier) target).getName() + " = " + visit(node.getValue());
    }
}
