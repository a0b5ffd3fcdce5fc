package me.christianrobert.convertifier.translator.semantic.expression;

/**
 * Visitor over every expression variant of the semantic tree.
 *
 * @param <R> Result type of the visit
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Literal literal);

    R visitName(Name name);

    R visitBinaryOp(BinaryOp binaryOp);

    R visitCompare(Compare compare);

    R visitBoolOp(BoolOp boolOp);

    R visitUnaryOp(UnaryOp unaryOp);

    R visitCall(Call call);

    R visitAttribute(Attribute attribute);

    R visitSubscript(Subscript subscript);

    R visitListDisplay(ListDisplay listDisplay);

    R visitConditional(Conditional conditional);

    R visitRawExpression(RawExpression rawExpression);
}
