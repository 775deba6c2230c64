package norswap.logiceval;

import norswap.logiceval.ast.*;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a parsed program before it is lowered to three-address code:
 * <ul>
 *     <li>a rule name is defined at most once;</li>
 *     <li>{@code infer} only names rules defined earlier;</li>
 *     <li>{@code set} does not assign a rule defined earlier.</li>
 * </ul>
 *
 * <p>Variables need no declaration: any name read in an expression is implicitly a variable.
 * The pass records them for diagnostics but never rejects them. The AST is not modified.
 */
public final class SemanticAnalysis implements StatementVisitor<Void>, ExpressionVisitor<Void>
{
    // ---------------------------------------------------------------------------------------------

    private final Set<String> rules = new LinkedHashSet<>();
    private final Set<String> variables = new TreeSet<>();

    // ---------------------------------------------------------------------------------------------

    public SemanticAnalysis () {}

    /**
     * Seeds the analysis with rules that were defined by earlier input in the same session.
     * They count as defined earlier for {@code infer} and clash with a new definition.
     */
    public SemanticAnalysis (Collection<String> knownRules) {
        rules.addAll(knownRules);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * @throws SemanticError on the first violation, in source order
     */
    public void check (ProgramNode program) {
        for (StatementNode statement : program.statements)
            statement.accept(this);
    }

    /** Rule names known after the check, in definition order. */
    public Set<String> rules () {
        return Collections.unmodifiableSet(rules);
    }

    /** Names read in expressions or assigned by {@code set}, sorted. */
    public Set<String> variables () {
        return Collections.unmodifiableSet(variables);
    }

    // ==== STATEMENTS =============================================================================

    @Override public Void visitExpressionStatement (ExpressionStatementNode node) {
        return node.expression.accept(this);
    }

    @Override public Void visitSet (SetNode node)
    {
        // a rule's value shadows the variable of the same name
        if (rules.contains(node.name))
            throw new SemanticError(node.name, node.position,
                "cannot set '" + node.name + "': it is a rule");
        variables.add(node.name);
        return null;
    }

    @Override public Void visitTable (TableNode node) {
        // the target may be a rule or a named expression, resolved when the table is built
        return null;
    }

    @Override public Void visitEval (EvalNode node) {
        return null;
    }

    @Override public Void visitRule (RuleNode node)
    {
        if (!rules.add(node.name))
            throw new SemanticError(node.name, node.position,
                "rule '" + node.name + "' is already defined");
        return node.expression.accept(this);
    }

    @Override public Void visitInfer (InferNode node)
    {
        for (String name : node.rules)
            if (!rules.contains(name))
                throw new SemanticError(name, node.position,
                    "inference on undefined rule '" + name + "'");
        return null;
    }

    // ==== EXPRESSIONS ============================================================================

    @Override public Void visitBinary (BinaryExpressionNode node) {
        node.left.accept(this);
        return node.right.accept(this);
    }

    @Override public Void visitUnary (UnaryExpressionNode node) {
        return node.operand.accept(this);
    }

    @Override public Void visitReference (ReferenceNode node) {
        variables.add(node.name);
        return null;
    }

    @Override public Void visitLiteral (BoolLiteralNode node) {
        return null;
    }
}
