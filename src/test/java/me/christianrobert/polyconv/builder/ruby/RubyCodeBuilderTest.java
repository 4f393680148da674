package me.christianrobert.polyconv.builder.ruby;

import me.christianrobert.polyconv.analysis.QueryContextAnalyzer;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.polyconv.ast.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Ruby rendering of analyzed snippets.
 */
class RubyCodeBuilderTest {

    private QueryContextAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new QueryContextAnalyzer();
    }

    private String toRuby(ExpressionNode tree) {
        return new RubyCodeBuilder(analyzer.analyze(tree), EmitterConfig.defaults()).build(tree);
    }

    @Test
    @DisplayName("A trailing lambda becomes a block")
    void filterWithBlock() {
        assertEquals("r.table('users').filter{|row| row['age'] > 18}", toRuby(usersOlderThan18()));
    }

    @Test
    void listRendersAsArrayLiteral() {
        assertEquals("[1, 2, 3]", toRuby(list(num(1), num(2), num(3))));
    }

    @Test
    void reservedJavaWordIsUnchanged() {
        assertEquals("default", toRuby(name("default")));
    }

    @Test
    void exprShorthand() {
        assertEquals("r(1)", toRuby(method(r(), "expr", num(1))));
    }

    @Test
    void callArguments() {
        Call withKeywords = callWithKeywords(attr(r(), "table"), List.of(str("t")), kw("read_mode", str("outdated")));

        assertEquals("r.table('t', read_mode: 'outdated')", toRuby(withKeywords));
        assertEquals("r.table('t').count", toRuby(method(table("t"), "count")));
        assertEquals("r.table('t').index_create('x')", toRuby(method(table("t"), "index_create", str("x"))));
    }

    @Test
    void literals() {
        assertEquals("nil", toRuby(new NullLiteral()));
        assertEquals("nil", toRuby(name("None")));
        assertEquals("true", toRuby(name("True")));
        assertEquals("\"a\\tb\"", toRuby(str("a\tb")));
        assertEquals("\"hi\\x00\".force_encoding('BINARY')", toRuby(new BytesLiteral(new int[]{'h', 'i', 0})));
        assertEquals("{'a' => 1}", toRuby(dict(str("a"), num(1))));
    }

    @Test
    void slicesUseRanges() {
        Call array = method(r(), "expr", list(num(1), num(2), num(3)));

        assertEquals("r([1, 2, 3])[(1...2)]", toRuby(sub(array, slice(num(1), num(2)))));
        assertEquals("r([1, 2, 3])[(1..-1)]", toRuby(sub(array, slice(num(1), null))));
    }

    @Test
    void operatorsAreNativeAndParenthesized() {
        assertEquals("(1 + 2)", toRuby(bin(BinaryOperator.ADD, num(1), num(2))));
        assertEquals("(r(1) + 2)", toRuby(bin(BinaryOperator.ADD, method(r(), "expr", num(1)), num(2))));
        assertEquals("!flag", toRuby(new UnaryOp(UnaryOperator.NOT, name("flag"))));
    }

    @Test
    void chainedComparisonIsSplitIntoPairs() {
        Compare chained = new Compare(num(1), List.of(CompareOperator.LT, CompareOperator.LT), List.of(name("x"), num(3)));

        assertEquals("1 < x && x < 3", toRuby(chained));
    }

    @Test
    void assignment() {
        assertEquals("tbl = r.table('users')", toRuby(new Assign(name("tbl"), table("users"))));
    }

    @Test
    void stringEncode() {
        assertEquals("'foo'.encode('UTF-8').force_encoding('BINARY')", toRuby(method(str("foo"), "encode", str("utf-8"))));
    }

    @Test
    void unsupportedConstructs() {
        ListComprehension comprehension = new ListComprehension(name("i"), name("i"), call(name("range"), num(3)));

        assertThrows(IntentionallyUnsupportedException.class, () -> toRuby(comprehension));
        assertThrows(IntentionallyUnsupportedException.class, () -> toRuby(call(name("frozenset"), list())));
    }
}
