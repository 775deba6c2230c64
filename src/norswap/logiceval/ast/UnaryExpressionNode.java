package norswap.logiceval.ast;

import norswap.logiceval.Position;

public final class UnaryExpressionNode extends ExpressionNode
{
    public final UnaryOperator operator;
    public final ExpressionNode operand;

    public UnaryExpressionNode (Position position, UnaryOperator operator, ExpressionNode operand) {
        super(position, 1 + operand.height);
        this.operator = operator;
        this.operand = operand;
    }

    @Override public <R> R accept (ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override public String contents () {
        return operator.string + operand.contents();
    }
}
