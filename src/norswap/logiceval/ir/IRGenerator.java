package norswap.logiceval.ir;

import norswap.logiceval.ast.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers statements to three-address code.
 *
 * <p>Expressions are walked in post-order: each operator node gets a fresh temporary and one
 * instruction over the locations of its operands, while references and literals are used in
 * place. Temporaries are numbered from {@code t1} again for every statement.
 *
 * <p>The generator remembers the code of named expressions and rules, and of the last unnamed
 * expression, so that a {@code table} statement can be emitted as that code followed by the
 * {@code TABLE} directive. One generator should therefore be used per session.
 */
public final class IRGenerator implements StatementVisitor<Void>, ExpressionVisitor<Operand>
{
    // ---------------------------------------------------------------------------------------------

    private final Map<String, List<Instruction>> staged = new HashMap<>();
    private List<Instruction> lastExpression = null;

    private List<Instruction> code;
    private int temporaries;

    // ---------------------------------------------------------------------------------------------

    public CodeBlock generate (StatementNode statement)
    {
        code = new ArrayList<>();
        temporaries = 0;
        try {
            statement.accept(this);
            return new CodeBlock(code);
        } finally {
            code = null;
        }
    }

    public List<CodeBlock> generate (ProgramNode program)
    {
        List<CodeBlock> blocks = new ArrayList<>(program.statements.size());
        for (StatementNode statement : program.statements)
            blocks.add(generate(statement));
        return blocks;
    }

    /** Forgets all staged code. */
    public void reset () {
        staged.clear();
        lastExpression = null;
    }

    // ---------------------------------------------------------------------------------------------

    private Operand newTemporary () {
        return Operand.temporary(++temporaries);
    }

    // ==== STATEMENTS =============================================================================

    @Override public Void visitExpressionStatement (ExpressionStatementNode node)
    {
        Operand result = node.expression.accept(this);

        if (node.name != null) {
            code.add(new CopyInstruction(Operand.name(node.name), result, Binding.EXPRESSION));
            staged.put(node.name, new ArrayList<>(code));
            return null;
        }

        // a bare reference or literal still needs a location holding the value
        if (code.isEmpty())
            code.add(CopyInstruction.temporary(newTemporary(), result));
        lastExpression = new ArrayList<>(code);
        return null;
    }

    @Override public Void visitSet (SetNode node) {
        code.add(new CopyInstruction(
            Operand.name(node.name), Operand.literal(node.value), Binding.VARIABLE));
        return null;
    }

    @Override public Void visitTable (TableNode node)
    {
        List<Instruction> target = node.target == null
            ? lastExpression
            : staged.get(node.target);
        if (target != null)
            code.addAll(target);
        code.add(new TableDirective(node.target));
        return null;
    }

    @Override public Void visitEval (EvalNode node) {
        code.add(EvalDirective.INSTANCE);
        return null;
    }

    @Override public Void visitRule (RuleNode node)
    {
        Operand result = node.expression.accept(this);
        code.add(new CopyInstruction(Operand.name(node.name), result, Binding.RULE));
        staged.put(node.name, new ArrayList<>(code));
        return null;
    }

    @Override public Void visitInfer (InferNode node) {
        code.add(new InferDirective(node.rules));
        return null;
    }

    // ==== EXPRESSIONS ============================================================================

    @Override public Operand visitBinary (BinaryExpressionNode node)
    {
        Operand left  = node.left.accept(this);
        Operand right = node.right.accept(this);
        Operand target = newTemporary();
        code.add(new BinaryInstruction(target, node.operator, left, right));
        return target;
    }

    @Override public Operand visitUnary (UnaryExpressionNode node)
    {
        Operand operand = node.operand.accept(this);
        Operand target = newTemporary();
        code.add(new UnaryInstruction(target, node.operator, operand));
        return target;
    }

    @Override public Operand visitReference (ReferenceNode node) {
        return Operand.name(node.name);
    }

    @Override public Operand visitLiteral (BoolLiteralNode node) {
        return Operand.literal(node.value);
    }
}
