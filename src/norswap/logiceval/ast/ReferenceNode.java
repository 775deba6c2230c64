package norswap.logiceval.ast;

import norswap.logiceval.Position;

/**
 * A variable, or the value of a rule.
 */
public final class ReferenceNode extends ExpressionNode
{
    public final String name;

    public ReferenceNode (Position position, String name) {
        super(position, 0);
        this.name = name;
    }

    @Override public <R> R accept (ExpressionVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override public String contents () {
        return name;
    }
}
