package me.christianrobert.polyconv.ast.json;

import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.context.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTreeReaderTest {

    private ExpressionTreeReader reader;

    @BeforeEach
    void setUp() {
        reader = new ExpressionTreeReader();
    }

    @Test
    void readsFilterScenario() {
        String json = """
            {"kind": "CALL",
             "callee": {"kind": "ATTRIBUTE", "name": "filter",
                        "base": {"kind": "CALL",
                                 "callee": {"kind": "ATTRIBUTE", "base": {"kind": "IDENTIFIER", "name": "r"}, "name": "table"},
                                 "args": [{"kind": "STRING", "value": "users"}]}},
             "args": [{"kind": "LAMBDA", "params": ["row"],
                       "body": {"kind": "COMPARE",
                                "left": {"kind": "SUBSCRIPT",
                                         "base": {"kind": "IDENTIFIER", "name": "row"},
                                         "index": {"kind": "STRING", "value": "age"}},
                                "ops": ["GT"],
                                "comparators": [{"kind": "NUMBER", "value": "18"}]}}]}
            """;

        ExpressionNode tree = reader.read(json);

        assertInstanceOf(Call.class, tree);
        Call filter = (Call) tree;
        assertEquals("filter", filter.getMethodName());
        assertTrue(filter.getKeywords().isEmpty());

        Lambda fn = (Lambda) filter.getArguments().get(0);
        assertEquals(List.of("row"), fn.getParameters());
        Compare comparison = (Compare) fn.getBody();
        assertEquals(CompareOperator.GT, comparison.getOperators().get(0));
        assertEquals("18", ((NumberLiteral) comparison.getComparators().get(0)).getText());
    }

    @Test
    void readsKeywordsAndOperators() {
        String json = """
            {"kind": "CALL", "callee": {"kind": "IDENTIFIER", "name": "f"},
             "args": [{"kind": "BIN_OP", "op": "POW",
                       "left": {"kind": "NUMBER", "value": 2},
                       "right": {"kind": "UNARY_OP", "op": "MINUS", "operand": {"kind": "NUMBER", "value": "1.5"}}}],
             "keywords": [{"name": "read_mode", "value": {"kind": "NULL"}}]}
            """;

        Call call = (Call) reader.read(json);

        BinOp power = (BinOp) call.getArguments().get(0);
        assertEquals(BinaryOperator.POW, power.getOperator());
        assertEquals("2", ((NumberLiteral) power.getLeft()).getText());
        assertEquals(UnaryOperator.MINUS, ((UnaryOp) power.getRight()).getOperator());
        assertEquals("read_mode", call.getKeywords().get(0).getName());
        assertInstanceOf(NullLiteral.class, call.getKeywords().get(0).getValue());
    }

    @Test
    void negativeNumbersBecomeUnaryMinus() {
        UnaryOp fromNumber = (UnaryOp) reader.read("{\"kind\": \"NUMBER\", \"value\": -2}");
        UnaryOp fromText = (UnaryOp) reader.read("{\"kind\": \"NUMBER\", \"value\": \"-2.5\"}");

        assertEquals(UnaryOperator.MINUS, fromNumber.getOperator());
        NumberLiteral magnitude = (NumberLiteral) fromNumber.getOperand();
        assertTrue(magnitude.isIntegral());
        assertEquals("2", magnitude.getText());
        assertEquals("2.5", ((NumberLiteral) fromText.getOperand()).getText());
    }

    @Test
    void malformedNumberIsReportedWithPath() {
        TreeFormatException e = assertThrows(TreeFormatException.class,
                () -> reader.read("{\"kind\": \"NUMBER\", \"value\": \"-\"}"));

        assertEquals("$", e.getPath());
    }

    @Test
    void readsSlicesWithMissingBounds() {
        String json = """
            {"kind": "SUBSCRIPT", "base": {"kind": "IDENTIFIER", "name": "data"},
             "index": {"kind": "SLICE", "lower": {"kind": "UNARY_OP", "op": "MINUS",
                                                   "operand": {"kind": "NUMBER", "value": "2"}}}}
            """;

        Subscript subscript = (Subscript) reader.read(json);

        assertTrue(subscript.isSlice());
        Slice slice = (Slice) subscript.getIndex();
        assertNotNull(slice.getLower());
        assertNull(slice.getUpper());
        assertNull(slice.getStep());
    }

    @Test
    void readsBytesAndContainers() {
        BytesLiteral bytes = (BytesLiteral) reader.read("{\"kind\": \"BYTES\", \"value\": [0, 127, 255]}");
        assertArrayEquals(new int[]{0, 127, 255}, bytes.getValues());

        DictExpr dict = (DictExpr) reader.read(
                "{\"kind\": \"DICT\", \"keys\": [{\"kind\": \"STRING\", \"value\": \"a\"}],"
                        + " \"values\": [{\"kind\": \"BOOLEAN\", \"value\": true}]}");
        assertEquals(1, dict.size());
        assertTrue(((BooleanLiteral) dict.getValues().get(0)).getValue());

        ListExpr empty = (ListExpr) reader.read("{\"kind\": \"LIST\"}");
        assertTrue(empty.getElements().isEmpty());
    }

    @Test
    void malformedJsonIsRejected() {
        TreeFormatException e = assertThrows(TreeFormatException.class, () -> reader.read("{\"kind\": "));

        assertEquals("$", e.getPath());
    }

    @Test
    void unknownKindIsRejectedWithPath() {
        String json = "{\"kind\": \"CALL\", \"callee\": {\"kind\": \"STARRED\"}}";

        TreeFormatException e = assertThrows(TreeFormatException.class, () -> reader.read(json));

        assertEquals("$.callee.kind", e.getPath());
    }

    @Test
    void missingFieldIsRejected() {
        assertThrows(TreeFormatException.class, () -> reader.read("{\"kind\": \"ATTRIBUTE\", \"name\": \"x\"}"));
    }

    @Test
    void byteOutOfRangeIsRejected() {
        assertThrows(TreeFormatException.class, () -> reader.read("{\"kind\": \"BYTES\", \"value\": [256]}"));
    }

    @Test
    void inconsistentCompareIsRejected() {
        String json = """
            {"kind": "COMPARE", "left": {"kind": "NUMBER", "value": "1"},
             "ops": ["LT", "LT"], "comparators": [{"kind": "NUMBER", "value": "2"}]}
            """;

        assertThrows(TreeFormatException.class, () -> reader.read(json));
    }

    // ========== Value types ==========

    @Test
    void readsValueTypes() {
        assertEquals(ValueType.queryTerm("Table"), reader.readValueType("{\"kind\": \"QUERY_TERM\", \"name\": \"Table\"}"));
        assertEquals(ValueType.INTEGER, reader.readValueType("{\"kind\": \"INTEGER\"}"));
        assertEquals(ValueType.foreign("decimal", "Decimal"),
                reader.readValueType("{\"kind\": \"FOREIGN\", \"origin\": \"decimal\", \"name\": \"Decimal\"}"));
    }

    @Test
    void unknownValueTypeKindIsRejected() {
        assertThrows(TreeFormatException.class, () -> reader.readValueType("{\"kind\": \"COMPLEX\"}"));
    }
}
