package me.christianrobert.polyconv.ast;

public enum CompareOperator {
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_E("<="),
    GT(">"),
    GT_E(">="),
    IN("in"),
    NOT_IN("not in"),
    IS("is"),
    IS_NOT("is not");

    private final String sourceSymbol;

    CompareOperator(String sourceSymbol) {
        this.sourceSymbol = sourceSymbol;
    }

    public String getSourceSymbol() {
        return sourceSymbol;
    }
}
