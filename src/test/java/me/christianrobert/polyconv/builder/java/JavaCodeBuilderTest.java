package me.christianrobert.polyconv.builder.java;

import me.christianrobert.polyconv.analysis.QueryContextAnalyzer;
import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.context.AmbiguousSourceException;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;
import me.christianrobert.polyconv.context.TypeMappingGapException;
import me.christianrobert.polyconv.context.UnmodeledConstructException;
import me.christianrobert.polyconv.context.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static me.christianrobert.polyconv.ast.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Java rendering of analyzed snippets.
 */
class JavaCodeBuilderTest {

    private QueryContextAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryContextAnalyzer();
    }

    private String toJava(ExpressionNode tree) {
        return toJava(tree, EmitterConfig.defaults());
    }

    private String toJava(ExpressionNode tree, EmitterConfig config) {
        QueryTags tags = analyzer.analyze(tree, config.getQueryRootNames(), false);
        return new JavaCodeBuilder(tags, config).build(tree);
    }

    // ========== Scenarios ==========

    @Test
    @DisplayName("filter(lambda row: row['age'] > 18) renders as a fluent comparison")
    void filterWithLambda() {
        assertEquals("r.table(\"users\").filter(row -> (row.g(\"age\")).gt(18L))", toJava(usersOlderThan18()));
    }

    @Test
    void listRendersAsNativeSequence() {
        assertEquals("Arrays.asList(1L, 2L, 3L)", toJava(list(num(1), num(2), num(3))));
        assertEquals("Arrays.asList()", toJava(tuple()));
    }

    @Test
    void controlCharacterExpandsToUnicodeEscape() {
        assertEquals("\"\\u0001\"", toJava(str(String.valueOf((char) 1))));
    }

    @Test
    @DisplayName("data[-2:] renders as a right-closed slice")
    void openEndedNegativeSlice() {
        EmitterConfig config = EmitterConfig.defaults()
                .withQueryRootNames(new LinkedHashSet<>(List.of("r", "data")));
        Subscript tree = sub(name("data"), slice(neg(num(2)), null));

        assertEquals("data.slice(-2, -1).optArg(\"right_bound\", \"closed\")", toJava(tree, config));
    }

    @Test
    void reservedWordGetsTrailingUnderscore() {
        assertEquals("default_", toJava(name("default")));
        assertEquals("r.table(\"t\").default_(1L)", toJava(method(table("t"), "default", num(1))));
    }

    @Test
    void renderingIsDeterministic() {
        Call tree = usersOlderThan18();
        QueryTags tags = analyzer.analyze(tree);

        String first = new JavaCodeBuilder(tags, EmitterConfig.defaults()).build(tree);
        String second = new JavaCodeBuilder(tags, EmitterConfig.defaults()).build(tree);

        assertEquals(first, second);
    }

    // ========== Literals ==========

    @Test
    void numbers() {
        assertEquals("42L", toJava(num(42)));
        assertEquals("1.5", toJava(num("1.5")));
        assertEquals("9223372036854775808.0", toJava(num("9223372036854775808")));
    }

    @Test
    void bytesAreSigned() {
        assertEquals("new byte[]{1, -56}", toJava(new BytesLiteral(new int[]{1, 200})));
    }

    @Test
    void nameConstants() {
        assertEquals("true", toJava(name("True")));
        assertEquals("null", toJava(name("None")));
        assertEquals("null", toJava(new NullLiteral()));
        assertEquals("false", toJava(new BooleanLiteral(false)));
    }

    @Test
    void dictRendersAsHashMapChain() {
        assertEquals("r.hashMap(\"a\", 1L).with(\"b\", 2L)", toJava(dict(str("a"), num(1), str("b"), num(2))));
        assertEquals("r.hashMap()", toJava(dict()));
    }

    // ========== Attributes and calls ==========

    @Test
    void namedArgumentsBecomeOptArgs() {
        Call tree = callWithKeywords(attr(r(), "table"), List.of(str("t")), kw("read_mode", str("outdated")));

        assertEquals("r.table(\"t\").optArg(\"read_mode\", \"outdated\")", toJava(tree));
    }

    @Test
    void methodNamesAreCamelCasedAndAliased() {
        assertEquals("r.table(\"t\").g(\"id\")", toJava(method(table("t"), "get_field", str("id"))));
        assertEquals("r.table(\"t\").indexCreate(\"x\")", toJava(method(table("t"), "index_create", str("x"))));
    }

    @Test
    void sourceKeywordWorkaroundsDropUnderscore() {
        Call tree = method(method(r(), "expr", new BooleanLiteral(true)), "or_", new BooleanLiteral(false));

        assertEquals("r.expr(true).or(false)", toJava(tree));
    }

    @Test
    void topLevelConstantsGetParentheses() {
        assertEquals("r.monday()", toJava(attr(r(), "monday")));
        assertEquals("r.minval()", toJava(call(attr(r(), "minval"))));
        assertEquals("r.error(\"boom\")", toJava(call(attr(r(), "error"), str("boom"))));
    }

    @Test
    void astNamespaceIsDropped() {
        Call tree = method(attr(r(), "ast"), "rql_tzinfo", str("00:00"));

        assertEquals("ast.rqlTzinfo(\"00:00\")", toJava(tree));
    }

    @Test
    void rowIsUnsupported() {
        assertThrows(IntentionallyUnsupportedException.class, () -> toJava(method(attr(r(), "row"), "add", num(1))));
    }

    @Test
    void nullArgumentsAreCast() {
        Call tree = method(table("t"), "insert", new NullLiteral());

        assertEquals("r.table(\"t\").insert((ReqlExpr) null)", toJava(tree));
        assertEquals("r.table(\"t\").insert(null)", toJava(tree, EmitterConfig.defaults().withCastNulls(false)));
    }

    @Test
    void lambdaWithSeveralParameters() {
        Call tree = method(table("t"), "reduce", lambda(bin(BinaryOperator.ADD, name("a"), name("b")), "a", "b"));

        assertEquals("r.table(\"t\").reduce((a, b) -> a.add(b))", toJava(tree));
    }

    @Test
    @DisplayName("map(lambda int: int + 1) suffixes the parameter like its references")
    void reservedLambdaParameterIsSuffixed() {
        Call tree = method(table("t"), "map", lambda(bin(BinaryOperator.ADD, name("int"), num(1)), "int"));

        assertEquals("r.table(\"t\").map(int_ -> int_.add(1L))", toJava(tree));
    }

    // ========== Subscripts ==========

    @Test
    void smartBracket() {
        assertEquals("r.table(\"t\").nth(0L)", toJava(sub(table("t"), num(0))));
        assertEquals("r.table(\"t\").bracket(\"age\")",
                toJava(sub(table("t"), str("age")), EmitterConfig.defaults().withSmartBracket(false)));
        assertEquals("r.table(\"t\").bracket(x)", toJava(sub(table("t"), name("x"))));
    }

    @Test
    void closedSlice() {
        assertEquals("r.expr(Arrays.asList(1L, 2L, 3L)).slice(1, 2)",
                toJava(sub(method(r(), "expr", list(num(1), num(2), num(3))), slice(num(1), num(2)))));
    }

    @Test
    void nativeSubscriptNeedsIntegerIndex() {
        assertEquals("arr.get(1)", toJava(sub(name("arr"), num(1))));
        assertThrows(UnmodeledConstructException.class, () -> toJava(sub(name("obj"), str("k"))));
    }

    // ========== Operators ==========

    @Test
    void nativeOperators() {
        assertEquals("1L + 2L", toJava(bin(BinaryOperator.ADD, num(1), num(2))));
        assertEquals("Math.pow(2L, 3L)", toJava(bin(BinaryOperator.POW, num(2), num(3))));
        assertEquals("1L < 2L", toJava(cmp(num(1), CompareOperator.LT, num(2))));
        assertEquals("-1L", toJava(neg(num(1))));
    }

    @Test
    void nativeLeftOperandIsLifted() {
        BinOp sum = bin(BinaryOperator.ADD, num(1), method(r(), "expr", num(2)));
        Compare less = cmp(num(1), CompareOperator.LT, method(r(), "expr", num(2)));

        assertEquals("r.expr(1L).add(r.expr(2L))", toJava(sum));
        assertEquals("r.expr(1L).lt(r.expr(2L))", toJava(less));
    }

    @Test
    void queryPowerStaysNative() {
        BinOp power = bin(BinaryOperator.POW, method(r(), "expr", num(2)), num(3));

        assertEquals("Math.pow(r.expr(2L), 3L)", toJava(power));
    }

    @Test
    void invertOnQueryBecomesNot() {
        UnaryOp tree = new UnaryOp(UnaryOperator.INVERT, method(r(), "expr", new BooleanLiteral(true)));

        assertEquals("r.expr(true).not()", toJava(tree));
    }

    @Test
    void notOnQueryBecomesNot() {
        UnaryOp tree = new UnaryOp(UnaryOperator.NOT, method(r(), "expr", new BooleanLiteral(true)));

        assertEquals("r.expr(true).not()", toJava(tree));
    }

    @Test
    void signOnQueryIsUnmodeled() {
        UnaryOp negated = neg(method(r(), "expr", num(1)));
        UnaryOp plus = new UnaryOp(UnaryOperator.PLUS, method(r(), "expr", num(1)));

        assertThrows(UnmodeledConstructException.class, () -> toJava(negated));
        assertThrows(UnmodeledConstructException.class, () -> toJava(plus));
    }

    @Test
    void prefixedIntegersRenderAsDecimalLongs() {
        assertEquals("16L", toJava(num("0x10")));
        assertEquals("1000000L", toJava(num("1_000_000")));
    }

    @Test
    void chainedComparisonIsAmbiguous() {
        Compare chained = new Compare(num(1), List.of(CompareOperator.LT, CompareOperator.LT), List.of(name("x"), num(3)));

        assertThrows(AmbiguousSourceException.class, () -> toJava(chained));
    }

    @Test
    void floorDivisionIsUnmodeled() {
        assertThrows(UnmodeledConstructException.class, () -> toJava(bin(BinaryOperator.FLOOR_DIV, num(7), num(2))));
    }

    // ========== Comprehensions and assignments ==========

    @Test
    void rangeComprehensionBecomesLongStream() {
        ListComprehension tree = new ListComprehension(name("i"), name("i"), call(name("range"), num(3)));

        assertEquals("LongStream.range(0, 3L).boxed().map(i -> i).collect(Collectors.toList())", toJava(tree));
    }

    @Test
    void otherComprehensionsAreUnmodeled() {
        ListComprehension tree = new ListComprehension(name("i"), name("i"), name("items"));

        assertThrows(UnmodeledConstructException.class, () -> toJava(tree));
    }

    @Test
    void typedAssignment() {
        Assign tree = new Assign(name("tbl"), table("users"));
        EmitterConfig config = EmitterConfig.defaults().withDeclaredType(ValueType.queryTerm("Table"));

        assertEquals("Table tbl = (Table) (r.table(\"users\"));", toJava(tree, config));
    }

    @Test
    void reservedAssignmentTargetIsSuffixed() {
        Assign tree = new Assign(name("default"), num(1));
        EmitterConfig config = EmitterConfig.defaults().withDeclaredType(ValueType.INTEGER);

        assertEquals("Long default_ = (Long) (1L);", toJava(tree, config));
    }

    @Test
    void assignmentWithoutDeclaredTypeIsAMappingGap() {
        assertThrows(TypeMappingGapException.class, () -> toJava(new Assign(name("n"), num(1))));
    }

    @Test
    void multiTargetAssignmentIsUnmodeled() {
        Assign tree = new Assign(List.of(name("a"), name("b")), num(1));
        EmitterConfig config = EmitterConfig.defaults().withDeclaredType(ValueType.INTEGER);

        assertThrows(UnmodeledConstructException.class, () -> toJava(tree, config));
    }

    // ========== Call rules ==========

    @Test
    void stringEncodeBecomesGetBytes() {
        Call tree = method(str("foo"), "encode", str("utf-8"));

        assertEquals("\"foo\".getBytes(StandardCharsets.UTF_8)", toJava(tree));
    }

    @Test
    void arityChecksAreSkipped() {
        Call tree = call(name("err"), str("ReqlCompileError"), str("Expected 2 arguments but found 1."));

        assertThrows(IntentionallyUnsupportedException.class, () -> toJava(tree));
    }

    @Test
    void mapNeedsFunctionArgument() {
        Call rejected = method(method(r(), "expr", list(num(1))), "map", num(1));
        Call accepted = method(method(r(), "expr", list(num(1))), "map", lambda(name("x"), "x"));

        assertThrows(IntentionallyUnsupportedException.class, () -> toJava(rejected));
        assertEquals("r.expr(Arrays.asList(1L)).map(x -> x)", toJava(accepted));
    }

    @Test
    void forEachNeedsFunctionArgument() {
        Call tree = method(table("t"), "for_each", num(1));

        assertThrows(IntentionallyUnsupportedException.class, () -> toJava(tree));
    }

    @Test
    void frozenSetIsUnsupported() {
        assertThrows(IntentionallyUnsupportedException.class, () -> toJava(call(name("frozenset"), list())));
    }
}
