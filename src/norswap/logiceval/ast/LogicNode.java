package norswap.logiceval.ast;

import norswap.logiceval.Position;

/**
 * Base of every AST node. Nodes are immutable and owned by the {@link ProgramNode} that
 * contains them.
 */
public abstract class LogicNode
{
    /** Position of the first token of the node. */
    public final Position position;

    LogicNode (Position position) {
        this.position = position;
    }

    /**
     * A source-like rendering of the node, used in diagnostics and traces.
     */
    public abstract String contents ();

    @Override public String toString () {
        return contents();
    }
}
