package norswap.logiceval.ast;

import norswap.logiceval.Position;

public final class SetNode extends StatementNode
{
    public final String name;
    public final boolean value;

    public SetNode (Position position, String name, boolean value) {
        super(position);
        this.name = name;
        this.value = value;
    }

    @Override public <R> R accept (StatementVisitor<R> visitor) {
        return visitor.visitSet(this);
    }

    @Override public String contents () {
        return "set " + name + " = " + (value ? "1" : "0") + ";";
    }
}
