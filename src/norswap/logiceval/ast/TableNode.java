package norswap.logiceval.ast;

import norswap.logiceval.Position;

public final class TableNode extends StatementNode
{
    /** The rule or named expression to tabulate, or null for the last unnamed expression. */
    public final String target;

    public TableNode (Position position, String target) {
        super(position);
        this.target = target;
    }

    @Override public <R> R accept (StatementVisitor<R> visitor) {
        return visitor.visitTable(this);
    }

    @Override public String contents () {
        return target == null ? "table;" : "table " + target + ";";
    }
}
