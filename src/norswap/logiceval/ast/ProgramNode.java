package norswap.logiceval.ast;

import norswap.logiceval.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class ProgramNode extends LogicNode
{
    public final List<StatementNode> statements;

    public ProgramNode (Position position, List<StatementNode> statements) {
        super(position);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    @Override public String contents () {
        StringBuilder b = new StringBuilder();
        for (StatementNode statement : statements) {
            if (b.length() > 0) b.append(' ');
            b.append(statement.contents());
        }
        return b.toString();
    }
}
