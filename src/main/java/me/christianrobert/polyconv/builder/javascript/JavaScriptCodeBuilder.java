package me.christianrobert.polyconv.builder.javascript;

import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.builder.CallRule;
import me.christianrobert.polyconv.builder.LiteralEscaper;
import me.christianrobert.polyconv.builder.SnippetCodeBuilder;
import me.christianrobert.polyconv.builder.rules.StringEncodeRule;
import me.christianrobert.polyconv.context.AmbiguousSourceException;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;
import me.christianrobert.polyconv.context.UnmodeledConstructException;
import me.christianrobert.polyconv.naming.CaseConverter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders a snippet as JavaScript code against the JavaScript driver.
 *
 * <p>Names are lead-lower camel-cased. Query-API subscripts are calls ({@code row('age')}), named
 * arguments collapse into a trailing options object, and query operators become methods like in
 * the Java target.</p>
 */
public class JavaScriptCodeBuilder extends SnippetCodeBuilder {

    private static final List<CallRule> CALL_RULES = List.of(
        StringEncodeRule.forJavaScript()
    );

    private static final Pattern PLAIN_KEY = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private static final Map<String, String> NAME_CONSTANTS = Map.of(
        "True", "true",
        "False", "false",
        "None", "null",
        "nil", "null"
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

    public JavaScriptCodeBuilder(QueryTags tags, EmitterConfig config) {
        super(tags, config);
    }

    @Override
    protected List<CallRule> callRules() {
        return CALL_RULES;
    }

    // ========== Literals ==========

    @Override
    public String visitString(StringLiteral node) {
        return LiteralEscaper.javaScriptString(node.getValue());
    }

    @Override
    public String visitBytes(BytesLiteral node) {
        return "Buffer(" + LiteralEscaper.byteString(node, '\'', false) + ", 'binary')";
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
        return "null";
    }

    // ========== Names ==========

    @Override
    public String visitIdentifier(Identifier node) {
        rejectUnsupportedName(node);
        String constant = NAME_CONSTANTS.get(node.getName());
        return constant != null ? constant : CaseConverter.leadLower(node.getName());
    }

    @Override
    public String visitAttribute(Attribute node) {
        String name = isQueryExpr(node) ? CaseConverter.leadLower(node.getName()) : node.getName();
        return visit(node.getBase()) + "." + name;
    }

    // ========== Calls ==========

    /**
     * {@code f(a, b, {name: value})}; option names are camel-cased on query calls.
     */
    @Override
    public String visitCall(Call node) {
        String rewritten = applyCallRules(node);
        if (rewritten != null) {
            return rewritten;
        }

        StringJoiner arguments = new StringJoiner(", ", "(", ")");
        for (ExpressionNode argument : node.getArguments()) {
            arguments.add(visit(argument));
        }
        if (!node.getKeywords().isEmpty()) {
            boolean queryCall = isQueryExpr(node);
            StringJoiner options = new StringJoiner(", ", "{", "}");
            for (Keyword keyword : node.getKeywords()) {
                String name = queryCall ? CaseConverter.leadLower(keyword.getName()) : keyword.getName();
                options.add(name + ": " + visit(keyword.getValue()));
            }
            arguments.add(options.toString());
        }
        return visit(node.getCallee()) + arguments;
    }

    @Override
    public String visitLambda(Lambda node) {
        List<String> parameters = new ArrayList<>();
        node.getParameters().forEach(p -> parameters.add(CaseConverter.leadLower(p)));
        return "function(" + String.join(", ", parameters) + ") { return " + visit(node.getBody()) + " }";
    }

    // ========== Subscripts ==========

    /**
     * Query subscripts are calls in the JavaScript driver: {@code row('age')}; native ones use brackets.
     */
    @Override
    public String visitSubscript(Subscript node) {
        String base = visit(node.getBase());
        if (node.isSlice()) {
            Slice slice = (Slice) node.getIndex();
            if (slice.getStep() != null) {
                throw new UnmodeledConstructException("Slice steps have no JavaScript equivalent", node);
            }
            String lower = slice.getLower() != null ? visit(slice.getLower()) : "0";
            String upper = slice.getUpper() != null ? ", " + visit(slice.getUpper()) : "";
            return base + ".slice(" + lower + upper + ")";
        }
        if (isQueryExpr(node)) {
            return base + "(" + visit(node.getIndex()) + ")";
        }
        return base + "[" + visit(node.getIndex()) + "]";
    }

    // ========== Operators ==========

    @Override
    public String visitUnaryOp(UnaryOp node) {
        UnaryOperator operator = node.getOperator();
        if (isQueryExpr(node)) {
            if (operator == UnaryOperator.NOT || operator == UnaryOperator.INVERT) {
                return visit(node.getOperand()) + ".not()";
            }
            throw new UnmodeledConstructException("No query method for unary " + operator, node);
        }
        return UNARY_OPERATORS.get(operator) + visit(node.getOperand());
    }

    @Override
    public String visitBinOp(BinOp node) {
        if (isQueryExpr(node)) {
            return renderQueryBinOp(node);
        }
        String symbol = BINARY_OPERATORS.get(node.getOperator());
        if (symbol == null) {
            throw new UnmodeledConstructException("No JavaScript operator for " + node.getOperator(), node);
        }
        return visit(node.getLeft()) + symbol + visit(node.getRight());
    }

    @Override
    public String visitCompare(Compare node) {
        if (node.isChained()) {
            throw new AmbiguousSourceException("Chained comparisons are not supported in JavaScript", node);
        }
        if (isQueryExpr(node)) {
            return renderQueryCompare(node);
        }
        String symbol = COMPARE_OPERATORS.get(node.getOperators().get(0));
        if (symbol == null) {
            throw new UnmodeledConstructException(
                "No JavaScript operator for " + node.getOperators().get(0), node);
        }
        return visit(node.getLeft()) + symbol + visit(node.getComparators().get(0));
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
            entries.add(renderKey(node.getKeys().get(i)) + ": " + visit(node.getValues().get(i)));
        }
        return entries.toString();
    }

    /**
     * Identifier-like string keys stay bare, other strings are quoted, anything else is computed.
     */
    private String renderKey(ExpressionNode key) {
        if (key instanceof StringLiteral) {
            String value = ((StringLiteral) key).getValue();
            return PLAIN_KEY.matcher(value).matches() ? value : visit(key);
        }
        if (key instanceof NumberLiteral) {
            return visit(key);
        }
        return "[" + visit(key) + "]";
    }

    @Override
    public String visitListComprehension(ListComprehension node) {
        throw new IntentionallyUnsupportedException("List comprehensions are not converted to JavaScript", node);
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
        return "var " + ((Identifier) target).getName() + " = " + visit(node.getValue());
    }
}
