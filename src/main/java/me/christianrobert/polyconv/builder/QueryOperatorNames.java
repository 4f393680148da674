package me.christianrobert.polyconv.builder;

import me.christianrobert.polyconv.ast.BinaryOperator;
import me.christianrobert.polyconv.ast.CompareOperator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Method names of the query API's operator terms, shared by the builders that render
 * query-API operators as method chains.
 *
 * <p>Exponentiation has no entry: it is never a query-API operator.</p>
 */
public final class QueryOperatorNames {

    private static final Map<BinaryOperator, String> BINARY;
    private static final Map<CompareOperator, String> COMPARE;

    static {
        Map<BinaryOperator, String> binary = new EnumMap<>(BinaryOperator.class);
        binary.put(BinaryOperator.ADD, "add");
        binary.put(BinaryOperator.SUB, "sub");
        binary.put(BinaryOperator.MULT, "mul");
        binary.put(BinaryOperator.DIV, "div");
        binary.put(BinaryOperator.MOD, "mod");
        binary.put(BinaryOperator.BIT_AND, "and");
        binary.put(BinaryOperator.BIT_OR, "or");
        BINARY = Collections.unmodifiableMap(binary);

        Map<CompareOperator, String> compare = new EnumMap<>(CompareOperator.class);
        compare.put(CompareOperator.LT, "lt");
        compare.put(CompareOperator.GT, "gt");
        compare.put(CompareOperator.LT_E, "le");
        compare.put(CompareOperator.GT_E, "ge");
        compare.put(CompareOperator.EQ, "eq");
        compare.put(CompareOperator.NOT_EQ, "ne");
        COMPARE = Collections.unmodifiableMap(compare);
    }

    private QueryOperatorNames() {
    }

    /**
     * @return method name, or null when the operator has no query-API term
     */
    public static String binary(BinaryOperator operator) {
        return BINARY.get(operator);
    }

    /**
     * @return method name, or null when the operator has no query-API term
     */
    public static String compare(CompareOperator operator) {
        return COMPARE.get(operator);
    }
}
