package norswap.logiceval.ast;

import norswap.logiceval.Position;

public final class BinaryExpressionNode extends ExpressionNode
{
    public final ExpressionNode left;
    public final BinaryOperator operator;
    public final ExpressionNode right;

    public BinaryExpressionNode
            (Position position, ExpressionNode left, BinaryOperator operator, ExpressionNode right) {
        super(position, 1 + Math.max(left.height, right.height));
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    @Override public <R> R accept (ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override public String contents () {
        return String.format("(%s %s %s)", left.contents(), operator.string, right.contents());
    }
}
