package norswap.logiceval.ast;

import norswap.logiceval.Position;

/**
 * {@code name : expression;}
 */
public final class RuleNode extends StatementNode
{
    public final String name;
    public final ExpressionNode expression;

    public RuleNode (Position position, String name, ExpressionNode expression) {
        super(position);
        this.name = name;
        this.expression = expression;
    }

    @Override public <R> R accept (StatementVisitor<R> visitor) {
        return visitor.visitRule(this);
    }

    @Override public String contents () {
        return name + ": " + expression.contents() + ";";
    }
}
