package me.christianrobert.polyconv.ast;

/**
 * Visitor over the closed {@link NodeKind} set.
 *
 * @param <R> result type produced per node
 */
public interface ExpressionVisitor<R> {

    R visitString(StringLiteral node);

    R visitBytes(BytesLiteral node);

    R visitNumber(NumberLiteral node);

    R visitBoolean(BooleanLiteral node);

    R visitNull(NullLiteral node);

    R visitIdentifier(Identifier node);

    R visitAttribute(Attribute node);

    R visitCall(Call node);

    R visitSubscript(Subscript node);

    R visitSlice(Slice node);

    R visitUnaryOp(UnaryOp node);

    R visitBinOp(BinOp node);

    R visitCompare(Compare node);

    R visitList(ListExpr node);

    R visitTuple(TupleExpr node);

    R visitDict(DictExpr node);

    R visitLambda(Lambda node);

    R visitAssign(Assign node);

    R visitListComprehension(ListComprehension node);
}
