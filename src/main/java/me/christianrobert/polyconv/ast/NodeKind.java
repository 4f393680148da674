package me.christianrobert.polyconv.ast;

/**
 * Closed set of expression kinds the converter understands.
 *
 * <p>The enum names double as the {@code kind} discriminator of the JSON wire format
 * (see {@link me.christianrobert.polyconv.ast.json.ExpressionTreeReader}).</p>
 */
public enum NodeKind {
    STRING,
    BYTES,
    NUMBER,
    BOOLEAN,
    NULL,
    IDENTIFIER,
    ATTRIBUTE,
    CALL,
    SUBSCRIPT,
    SLICE,
    UNARY_OP,
    BIN_OP,
    COMPARE,
    LIST,
    TUPLE,
    DICT,
    LAMBDA,
    ASSIGN,
    LIST_COMPREHENSION
}
