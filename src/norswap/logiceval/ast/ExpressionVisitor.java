package norswap.logiceval.ast;

public interface ExpressionVisitor<R>
{
    R visitBinary (BinaryExpressionNode node);
    R visitUnary (UnaryExpressionNode node);
    R visitReference (ReferenceNode node);
    R visitLiteral (BoolLiteralNode node);
}
