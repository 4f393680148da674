package me.christianrobert.polyconv.builder.java;

import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.builder.CallRule;
import me.christianrobert.polyconv.builder.LiteralEscaper;
import me.christianrobert.polyconv.builder.SnippetCodeBuilder;
import me.christianrobert.polyconv.builder.rules.ArityCheckRule;
import me.christianrobert.polyconv.builder.rules.ForEachFunctionRule;
import me.christianrobert.polyconv.builder.rules.MapFunctionRule;
import me.christianrobert.polyconv.builder.rules.StringEncodeRule;
import me.christianrobert.polyconv.context.AmbiguousSourceException;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;
import me.christianrobert.polyconv.context.UnmodeledConstructException;
import me.christianrobert.polyconv.naming.CaseConverter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a snippet as Java code against the Java driver.
 *
 * <p>Native values use JDK idioms ({@code 1L}, {@code Arrays.asList(...)}, {@code Math.pow}).
 * Query expressions become fluent driver calls: operators turn into methods such as
 * {@code .gt(...)}, subscripts into {@code .g(...)}/{@code .nth(...)}/{@code .bracket(...)}, and
 * named arguments into chained {@code .optArg("name", value)} calls.</p>
 *
 * <p>Query-API method names are converted to lead-lower camel case. Names colliding with Java
 * reserved words or {@code Object} methods get a trailing underscore.</p>
 */
public class JavaCodeBuilder extends SnippetCodeBuilder {

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private static final List<CallRule> CALL_RULES = List.of(
        new ArityCheckRule(),
        StringEncodeRule.forJava(),
        new ForEachFunctionRule(),
        new MapFunctionRule()
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

    public JavaCodeBuilder(QueryTags tags, EmitterConfig config) {
        super(tags, config);
    }

    @Override
    protected List<CallRule> callRules() {
        return CALL_RULES;
    }

    // ========== Literals ==========

    @Override
    public String visitString(StringLiteral node) {
        return LiteralEscaper.javaString(node.getValue());
    }

    /**
     * {@code new byte[]{...}}; Java bytes are signed, so values above 127 wrap to negatives.
     */
    @Override
    public String visitBytes(BytesLiteral node) {
        StringJoiner values = new StringJoiner(", ", "new byte[]{", "}");
        for (int value : node.getValues()) {
            values.add(String.valueOf((byte) value));
        }
        return values.toString();
    }

    @Override
    public String visitNumber(NumberLiteral node) {
        if (!node.isIntegral()) {
            return node.getText();
        }
        if (node.getIntegerValue().compareTo(LONG_MAX) > 0) {
            return node.getText() + ".0";
        }
        return node.getText() + "L";
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
        String name = node.getName();
        String constant = JavaLexicon.NAME_CONSTANTS.get(name);
        if (constant != null) {
            return constant;
        }
        return localName(name);
    }

    /**
     * Names bound by the snippet itself (lambda parameters, assignment targets) get the same
     * suffix as their references.
     */
    private static String localName(String name) {
        return JavaLexicon.collides(name) ? name + "_" : name;
    }

    @Override
    public String visitAttribute(Attribute node) {
        return renderAttribute(node, true);
    }

    /**
     * @param emitParens Whether a top-level constant needs {@code ()}; false when the attribute is
     *                   already the callee of a call
     */
    private String renderAttribute(Attribute node, boolean emitParens) {
        // The Java driver has no ast namespace; tests declare an ast member instead
        if (isAstNamespace(node)) {
            return CaseConverter.leadLower(node.getName());
        }
        if (!isQueryExpr(node)) {
            return visit(node.getBase()) + "." + CaseConverter.leadLower(node.getName());
        }

        boolean onRoot = node.getBase() instanceof Identifier
                && config.isQueryRoot(((Identifier) node.getBase()).getName());
        if (onRoot && "row".equals(node.getName())) {
            throw new IntentionallyUnsupportedException("Java driver doesn't support r.row", node);
        }

        String name = JavaLexicon.SOURCE_KEYWORD_ESCAPES.getOrDefault(
                node.getName(), CaseConverter.leadLower(node.getName()));
        name = JavaLexicon.METHOD_ALIASES.getOrDefault(name, name);
        if (JavaLexicon.collides(name)) {
            name += "_";
        }
        String rendered = visit(node.getBase()) + "." + name;
        if (emitParens && onRoot && JavaLexicon.TOPLEVEL_CONSTANTS.contains(node.getName())) {
            rendered += "()";
        }
        return rendered;
    }

    private boolean isAstNamespace(Attribute node) {
        return "ast".equals(node.getName())
                && node.getBase() instanceof Identifier
                && config.isQueryRoot(((Identifier) node.getBase()).getName());
    }

    // ========== Calls ==========

    @Override
    public String visitCall(Call node) {
        String rewritten = applyCallRules(node);
        if (rewritten != null) {
            return rewritten;
        }

        StringBuilder sb = new StringBuilder();
        if (node.getCallee() instanceof Attribute) {
            sb.append(renderAttribute((Attribute) node.getCallee(), false));
        } else {
            sb.append(visit(node.getCallee()));
        }

        StringJoiner arguments = new StringJoiner(", ", "(", ")");
        for (ExpressionNode argument : node.getArguments()) {
            arguments.add(castNull(argument));
        }
        sb.append(arguments);

        for (Keyword keyword : node.getKeywords()) {
            sb.append(".optArg(")
              .append(LiteralEscaper.javaString(keyword.getName()))
              .append(", ")
              .append(visit(keyword.getValue()))
              .append(")");
        }
        return sb.toString();
    }

    /**
     * A bare null argument is ambiguous between driver overloads; cast it to the query expression type.
     */
    private String castNull(ExpressionNode argument) {
        String rendered = visit(argument);
        if (config.isCastNulls() && isNullSentinel(argument)) {
            return "(" + JavaLexicon.QUERY_EXPR_TYPE + ") " + rendered;
        }
        return rendered;
    }

    private static boolean isNullSentinel(ExpressionNode node) {
        if (node instanceof NullLiteral) {
            return true;
        }
        if (node instanceof Identifier) {
            Identifier identifier = (Identifier) node;
            return identifier.hasName("null") || identifier.hasName("None") || identifier.hasName("nil");
        }
        return false;
    }

    @Override
    public String visitLambda(Lambda node) {
        List<String> parameters = new ArrayList<>();
        node.getParameters().forEach(p -> parameters.add(localName(p)));
        String head = parameters.size() == 1
                ? parameters.get(0)
                : "(" + String.join(", ", parameters) + ")";
        return head + " -> " + visit(node.getBody());
    }

    // ========== Subscripts ==========

    @Override
    public String visitSubscript(Subscript node) {
        if (isQueryExpr(node)) {
            return renderQuerySubscript(node);
        }
        ExpressionNode index = node.getIndex();
        if (!(index instanceof NumberLiteral) || !((NumberLiteral) index).isIntegral()) {
            throw new UnmodeledConstructException("Only integer subscripts can be converted", node);
        }
        return visit(node.getBase()) + ".get(" + ((NumberLiteral) index).getText() + ")";
    }

    private String renderQuerySubscript(Subscript node) {
        String base = visit(node.getBase());
        ExpressionNode index = node.getIndex();

        if (node.isSlice()) {
            Slice slice = (Slice) index;
            if (slice.getStep() != null) {
                throw new UnmodeledConstructException("Slice steps have no query-API equivalent", node);
            }
            String rendered = base + ".slice(" + sliceBound(slice.getLower(), 0) + ", "
                    + sliceBound(slice.getUpper(), -1) + ")";
            if (slice.getUpper() == null) {
                rendered += ".optArg(\"right_bound\", \"closed\")";
            }
            return rendered;
        }

        String method;
        if (config.isSmartBracket() && index instanceof StringLiteral) {
            method = ".g(";
        } else if (config.isSmartBracket() && index instanceof NumberLiteral) {
            method = ".nth(";
        } else {
            method = ".bracket(";
        }
        return base + method + visit(index) + ")";
    }

    /**
     * Slice bounds must be integer literals; a negated literal is folded into a negative number.
     */
    private long sliceBound(ExpressionNode bound, long defaultValue) {
        if (bound == null) {
            return defaultValue;
        }
        if (bound instanceof UnaryOp) {
            UnaryOp unary = (UnaryOp) bound;
            if (unary.getOperator() == UnaryOperator.MINUS && isIntegerLiteral(unary.getOperand())) {
                return -((NumberLiteral) unary.getOperand()).getIntegerValue().longValueExact();
            }
        } else if (isIntegerLiteral(bound)) {
            return ((NumberLiteral) bound).getIntegerValue().longValueExact();
        }
        throw new UnmodeledConstructException("Slice bound is not an integer literal", bound);
    }

    private static boolean isIntegerLiteral(ExpressionNode node) {
        return node instanceof NumberLiteral
                && ((NumberLiteral) node).isIntegral()
                && ((NumberLiteral) node).getIntegerValue().compareTo(LONG_MAX) <= 0;
    }

    // ========== Operators ==========

    @Override
    public String visitUnaryOp(UnaryOp node) {
        if (isQueryExpr(node)) {
            if (node.getOperator() == UnaryOperator.NOT || node.getOperator() == UnaryOperator.INVERT) {
                return visit(node.getOperand()) + ".not()";
            }
            throw new UnmodeledConstructException("No query method for unary " + node.getOperator(), node);
        }
        return UNARY_OPERATORS.get(node.getOperator()) + visit(node.getOperand());
    }

    @Override
    public String visitBinOp(BinOp node) {
        if (isQueryExpr(node)) {
            return renderQueryBinOp(node);
        }
        if (node.getOperator() == BinaryOperator.POW) {
            return "Math.pow(" + visit(node.getLeft()) + ", " + visit(node.getRight()) + ")";
        }
        String symbol = BINARY_OPERATORS.get(node.getOperator());
        if (symbol == null) {
            throw new UnmodeledConstructException("No Java operator for " + node.getOperator(), node);
        }
        return visit(node.getLeft()) + symbol + visit(node.getRight());
    }

    @Override
    public String visitCompare(Compare node) {
        if (node.isChained()) {
            throw new AmbiguousSourceException("Chained comparisons are not supported in Java", node);
        }
        if (isQueryExpr(node)) {
            return renderQueryCompare(node);
        }
        String symbol = COMPARE_OPERATORS.get(node.getOperators().get(0));
        if (symbol == null) {
            throw new UnmodeledConstructException(
                "No Java operator for " + node.getOperators().get(0), node);
        }
        return visit(node.getLeft()) + symbol + visit(node.getComparators().get(0));
    }

    // ========== Containers ==========

    @Override
    public String visitList(ListExpr node) {
        return "Arrays.asList(" + join(", ", node.getElements()) + ")";
    }

    @Override
    public String visitTuple(TupleExpr node) {
        return "Arrays.asList(" + join(", ", node.getElements()) + ")";
    }

    /**
     * {@code r.hashMap(k1, v1).with(k2, v2)...}
     */
    @Override
    public String visitDict(DictExpr node) {
        StringBuilder sb = new StringBuilder(config.getDefaultRootName()).append(".hashMap(");
        for (int i = 0; i < node.size(); i++) {
            if (i > 0) {
                sb.append(").with(");
            }
            sb.append(visit(node.getKeys().get(i)))
              .append(", ")
              .append(visit(node.getValues().get(i)));
        }
        return sb.append(")").toString();
    }

    /**
     * Only the {@code [e for i in range(...)]} shape is supported, as a boxed {@code LongStream}.
     */
    @Override
    public String visitListComprehension(ListComprehension node) {
        ExpressionNode iterable = node.getIterable();
        if (!(iterable instanceof Call) || !isRangeCall((Call) iterable)) {
            throw new UnmodeledConstructException("Only comprehensions over range(...) can be converted", node);
        }
        List<ExpressionNode> rangeArgs = ((Call) iterable).getArguments();
        String bounds;
        if (rangeArgs.size() == 1) {
            bounds = "0, " + visit(rangeArgs.get(0));
        } else if (rangeArgs.size() == 2) {
            bounds = visit(rangeArgs.get(0)) + ", " + visit(rangeArgs.get(1));
        } else {
            throw new UnmodeledConstructException("range() with a step cannot be converted", iterable);
        }
        return "LongStream.range(" + bounds + ").boxed()"
                + ".map(" + visit(node.getTarget()) + " -> " + visit(node.getElement()) + ")"
                + ".collect(Collectors.toList())";
    }

    private static boolean isRangeCall(Call call) {
        return call.getCallee() instanceof Identifier
                && ((Identifier) call.getCallee()).getName().endsWith("range");
    }

    // ========== Statements ==========

    /**
     * {@code Type name = (Type) (value);} with the type taken from the declared value type.
     */
    @Override
    public String visitAssign(Assign node) {
        if (node.getTargets().size() != 1) {
            throw new UnmodeledConstructException("Only single-target assignment is supported", node);
        }
        ExpressionNode target = node.getTargets().get(0);
        if (!(target instanceof Identifier)) {
            throw new UnmodeledConstructException("Assignment target must be a plain name", node);
        }
        String type = JavaTypeMapper.toJavaType(config.getDeclaredType(), node);
        return type + " " + localName(((Identifier) target).getName())
                + " = (" + type + ") (" + visit(node.getValue()) + ");";
    }
}
