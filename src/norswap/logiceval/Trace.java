package norswap.logiceval;

import norswap.logiceval.ast.*;
import norswap.logiceval.ir.CodeBlock;

import java.io.PrintStream;
import java.util.List;

/**
 * Verbose report of what each stage of {@link LogicCompiler} produced.
 */
final class Trace
{
    // ---------------------------------------------------------------------------------------------

    private static final String RULE = "=".repeat(60);
    private static final int MAX_EXAMPLES = 3;

    private final PrintStream out;

    Trace (PrintStream out) {
        this.out = out;
    }

    // ---------------------------------------------------------------------------------------------

    private void header (String stage) {
        out.println();
        out.println(RULE);
        out.println("  " + stage);
        out.println(RULE);
    }

    // ---------------------------------------------------------------------------------------------

    void source (String source)
    {
        header("SOURCE CODE");
        String[] lines = source.strip().split("\n", -1);
        for (int i = 0; i < lines.length; ++i)
            out.printf("  %2d | %s%n", i + 1, lines[i]);
    }

    void tokens (List<Token> tokens)
    {
        header("STAGE 1: LEXICAL ANALYSIS");
        int count = 0;
        for (Token token : tokens) {
            if (token.kind == TokenKind.EOF) continue;
            out.printf("  Token: %-12s Value: %-10s Pos: %d:%d%n",
                token.kind, token.text, token.line, token.column);
            ++count;
        }
        out.println();
        out.println("  Total tokens: " + count);
    }

    void program (ProgramNode program)
    {
        header("STAGE 2: SYNTAX ANALYSIS");
        out.println("  Total statements: " + program.statements.size());
        int i = 0;
        for (StatementNode statement : program.statements)
            out.printf("    Statement %d: %s  %s%n",
                ++i, statement.getClass().getSimpleName(), statement.contents());
    }

    void semantics (SemanticAnalysis analysis)
    {
        header("STAGE 3: SEMANTIC ANALYSIS");
        out.println("  Variables: " + analysis.variables().size());
        if (!analysis.variables().isEmpty())
            out.println("    " + String.join(", ", analysis.variables()));
        out.println("  Rules: " + analysis.rules().size());
        if (!analysis.rules().isEmpty())
            out.println("    " + String.join(", ", analysis.rules()));
    }

    // ---------------------------------------------------------------------------------------------

    void code (StatementNode statement, CodeBlock generated)
    {
        header("STAGE 4: INTERMEDIATE CODE  " + statement.contents());
        List<String> listing = generated.listing();
        for (int i = 0; i < listing.size(); ++i)
            out.printf("    %2d. %s%n", i + 1, listing.get(i));
    }

    void optimization (CodeBlock generated, CodeBlock optimized)
    {
        header("STAGE 5: CODE OPTIMIZATION");
        out.println("  Original instructions:  " + generated.instructions.size());
        out.println("  Optimized instructions: " + optimized.instructions.size());

        int changes = 0;
        for (int i = 0; i < generated.instructions.size(); ++i)
            if (!generated.instructions.get(i).equals(optimized.instructions.get(i)))
                ++changes;
        out.println("  Rewritten: " + changes);

        int shown = 0;
        for (int i = 0; i < generated.instructions.size() && shown < MAX_EXAMPLES; ++i) {
            if (generated.instructions.get(i).equals(optimized.instructions.get(i))) continue;
            out.println("    Before: " + generated.instructions.get(i));
            out.println("    After:  " + optimized.instructions.get(i));
            ++shown;
        }
    }

    void execution () {
        header("STAGE 6: EXECUTION");
    }

    void output (String line) {
        out.println("  " + line);
    }

    // ---------------------------------------------------------------------------------------------

    void failure (LogicException e) {
        out.println();
        out.println("  Failed: " + e.getMessage());
    }

    void success () {
        out.println();
        out.println(RULE);
        out.println("  COMPILATION AND EXECUTION COMPLETED");
        out.println(RULE);
    }
}
