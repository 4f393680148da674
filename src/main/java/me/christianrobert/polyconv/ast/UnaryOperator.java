package me.christianrobert.polyconv.ast;

public enum UnaryOperator {
    MINUS("-"),
    PLUS("+"),
    NOT("not"),
    INVERT("~");

    private final String sourceSymbol;

    UnaryOperator(String sourceSymbol) {
        this.sourceSymbol = sourceSymbol;
    }

    public String getSourceSymbol() {
        return sourceSymbol;
    }
}
