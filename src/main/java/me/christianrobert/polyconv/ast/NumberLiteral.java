package me.christianrobert.polyconv.ast;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A numeric literal as written in the source.
 *
 * <p>The source text is kept verbatim because targets render floats differently than
 * {@link Double#toString(double)} would. Integral literals may exceed the 64-bit range.
 * Digit separators are dropped and hex, octal and binary integers are normalized to decimal,
 * so {@code 0x10} and {@code 1_6} both read as {@code 16}.</p>
 *
 * <p>Negative numbers never reach this class: the parser delivers {@code -2} as a
 * {@link UnaryOp} (minus) over the literal {@code 2}.</p>
 */
public class NumberLiteral implements ExpressionNode {

    private static final Pattern INTEGRAL = Pattern.compile("[0-9]+");
    private static final Pattern PREFIXED_INTEGRAL = Pattern.compile("0([xXoObB])([0-9a-fA-F]+)");

    private final String text;
    private final boolean integral;

    public NumberLiteral(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Number literal text cannot be null or empty");
        }
        this.text = normalize(text.trim());
        this.integral = INTEGRAL.matcher(this.text).matches();
    }

    private static String normalize(String text) {
        if (text.startsWith("-")) {
            throw new IllegalArgumentException("Negative literals are expressed as unary minus: " + text);
        }
        String digits = text.replace("_", "");
        Matcher prefixed = PREFIXED_INTEGRAL.matcher(digits);
        if (!prefixed.matches()) {
            return digits;
        }
        int radix;
        switch (Character.toLowerCase(prefixed.group(1).charAt(0))) {
            case 'x': radix = 16; break;
            case 'o': radix = 8; break;
            default: radix = 2; break;
        }
        try {
            return new BigInteger(prefixed.group(2), radix).toString();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed number literal: " + text, e);
        }
    }

    public static NumberLiteral of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Negative literals are expressed as unary minus: " + value);
        }
        return new NumberLiteral(Long.toString(value));
    }

    public String getText() {
        return text;
    }

    public boolean isIntegral() {
        return integral;
    }

    /**
     * Returns the integral value.
     *
     * @throws IllegalStateException if this is a floating point literal
     */
    public BigInteger getIntegerValue() {
        if (!integral) {
            throw new IllegalStateException("Not an integral literal: " + text);
        }
        return new BigInteger(text);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NUMBER;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return "NumberLiteral{text='" + text + "'}";
    }
}
