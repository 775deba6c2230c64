package norswap.logiceval.ast;

import norswap.logiceval.Position;

/**
 * {@code expr [name] expression;}
 */
public final class ExpressionStatementNode extends StatementNode
{
    /** Null for an unnamed expression. */
    public final String name;
    public final ExpressionNode expression;

    public ExpressionStatementNode (Position position, String name, ExpressionNode expression) {
        super(position);
        this.name = name;
        this.expression = expression;
    }

    @Override public <R> R accept (StatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override public String contents () {
        return name == null
            ? "expr " + expression.contents() + ";"
            : "expr " + name + " " + expression.contents() + ";";
    }
}
