package me.christianrobert.polyconv.ast;

import java.util.Arrays;

/**
 * A byte-string literal ({@code b'...'} in the source language).
 * Bytes are held as unsigned values 0-255.
 */
public class BytesLiteral implements ExpressionNode {

    private final int[] values;

    public BytesLiteral(int[] values) {
        if (values == null) {
            throw new IllegalArgumentException("Bytes literal values cannot be null");
        }
        for (int v : values) {
            if (v < 0 || v > 255) {
                throw new IllegalArgumentException("Byte value out of range 0-255: " + v);
            }
        }
        this.values = values.clone();
    }

    /**
     * Creates a bytes literal from a Java byte array, reading each byte as unsigned.
     */
    public static BytesLiteral of(byte[] bytes) {
        int[] values = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            values[i] = bytes[i] & 0xFF;
        }
        return new BytesLiteral(values);
    }

    public int size() {
        return values.length;
    }

    public int get(int index) {
        return values[index];
    }

    public int[] getValues() {
        return values.clone();
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BYTES;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBytes(this);
    }

    @Override
    public String toString() {
        return "BytesLiteral{values=" + Arrays.toString(values) + "}";
    }
}
