package norswap.logiceval.ast;

import norswap.logiceval.Position;

/**
 * The closed set of expressions. Every pass handles all of them through an
 * {@link ExpressionVisitor}.
 */
public abstract class ExpressionNode extends LogicNode
{
    /** Operator nodes on the longest path down to a leaf; 0 for a leaf. */
    public final int height;

    ExpressionNode (Position position, int height) {
        super(position);
        this.height = height;
    }

    public abstract <R> R accept (ExpressionVisitor<R> visitor);
}
