package norswap.logiceval;

import norswap.logiceval.ast.ProgramNode;
import norswap.logiceval.ast.StatementNode;
import norswap.logiceval.interpreter.Interpreter;
import norswap.logiceval.ir.CodeBlock;
import norswap.logiceval.ir.Optimizer;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs source text through the whole pipeline: scanning, parsing, semantic analysis, then,
 * statement by statement, code generation, optimization and execution.
 *
 * <p>The first error stops the run and is returned in the {@link Result}, along with the lines
 * emitted by the statements that ran before it.
 */
public final class LogicCompiler
{
    // ---------------------------------------------------------------------------------------------

    private final Options options;
    private final Trace trace;
    private final Optimizer optimizer = new Optimizer();

    // ---------------------------------------------------------------------------------------------

    public LogicCompiler (Options options) {
        this(options, System.out);
    }

    /**
     * @param log where the stage trace goes when {@link Options#verbose} is set
     */
    public LogicCompiler (Options options, PrintStream log) {
        this.options = options;
        this.trace = options.verbose ? new Trace(log) : null;
    }

    // ---------------------------------------------------------------------------------------------

    public Result run (String source, Session session)
    {
        List<String> output = new ArrayList<>();

        try {
            // First, lexing and parsing
            List<Token> tokens = new LogicScanner(source).scan();
            if (trace != null) trace.tokens(tokens);

            ProgramNode program = new LogicParser(tokens, options.maxDepth).parse();
            if (trace != null) trace.program(program);

            // Second, semantic checks
            SemanticAnalysis analysis = new SemanticAnalysis(session.environment().ruleNames());
            analysis.check(program);
            if (trace != null) trace.semantics(analysis);

            // Third, lowering, optimization and execution, one statement at a time
            Interpreter interpreter = new Interpreter(line -> {
                output.add(line);
                if (trace != null) trace.output(line);
            });

            for (StatementNode statement : program.statements) {
                CodeBlock code = session.generator().generate(statement);
                if (trace != null) trace.code(statement, code);

                if (options.optimize) {
                    CodeBlock optimized = optimizer.optimize(code);
                    if (trace != null) trace.optimization(code, optimized);
                    code = optimized;
                }

                if (trace != null) trace.execution();
                interpreter.execute(code, session.environment());
            }

            if (trace != null) trace.success();
            return Result.success(output);
        }
        catch (LogicException e) {
            if (trace != null) trace.failure(e);
            return Result.failure(e, output);
        }
    }

    // ---------------------------------------------------------------------------------------------

    /** Prints the numbered source, when tracing. */
    void traceSource (String source) {
        if (trace != null) trace.source(source);
    }
}
