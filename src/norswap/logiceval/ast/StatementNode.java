package norswap.logiceval.ast;

import norswap.logiceval.Position;

/**
 * The closed set of statements. Every pass handles all of them through a
 * {@link StatementVisitor}.
 */
public abstract class StatementNode extends LogicNode
{
    StatementNode (Position position) {
        super(position);
    }

    public abstract <R> R accept (StatementVisitor<R> visitor);
}
