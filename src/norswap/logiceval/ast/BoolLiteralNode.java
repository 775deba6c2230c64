package norswap.logiceval.ast;

import norswap.logiceval.Position;

public final class BoolLiteralNode extends ExpressionNode
{
    public final boolean value;

    public BoolLiteralNode (Position position, boolean value) {
        super(position, 0);
        this.value = value;
    }

    @Override public <R> R accept (ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override public String contents () {
        return value ? "1" : "0";
    }
}
