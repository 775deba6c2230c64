package norswap.logiceval.ast;

public interface StatementVisitor<R>
{
    R visitExpressionStatement (ExpressionStatementNode node);
    R visitSet (SetNode node);
    R visitTable (TableNode node);
    R visitEval (EvalNode node);
    R visitRule (RuleNode node);
    R visitInfer (InferNode node);
}
