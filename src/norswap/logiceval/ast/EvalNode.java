package norswap.logiceval.ast;

import norswap.logiceval.Position;

public final class EvalNode extends StatementNode
{
    public EvalNode (Position position) {
        super(position);
    }

    @Override public <R> R accept (StatementVisitor<R> visitor) {
        return visitor.visitEval(this);
    }

    @Override public String contents () {
        return "eval;";
    }
}
