package norswap.logiceval.interpreter;

import norswap.logiceval.ir.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Executes three-address code against an {@link Environment}, emitting result lines to a
 * consumer.
 *
 * <p>Instructions of a block that precede a directive are collected, then:
 * <ul>
 *     <li>with no directive, they run: temporaries live for this run only, assignments write
 *     the environment, and the code is stored as a named expression, a rule, or the last
 *     unnamed expression;</li>
 *     <li>{@code EVAL} runs them the same way and emits the last computed value; with nothing
 *     before it, it evaluates the last unnamed expression;</li>
 *     <li>{@code TABLE} enumerates them as a truth table without touching the environment;
 *     with nothing before it, the target is looked up in the environment;</li>
 *     <li>{@code INFER} runs them, then emits {@code name = value} for each rule.</li>
 * </ul>
 *
 * <p>A name is read from the truth-table row first, then as the last value of a rule, then as
 * a variable. A variable sharing a rule's name is therefore never seen once the rule has run.
 * Names read by an expression that have no value yet are declared false when the
 * expression runs. Reading any other unbound name is a {@link RuntimeError}.
 *
 * <p>Runtime value representation: {@code boolean}; lines show them as {@code 0} and
 * {@code 1}.
 */
public final class Interpreter
{
    // ---------------------------------------------------------------------------------------------

    private final Consumer<String> output;

    // ---------------------------------------------------------------------------------------------

    public Interpreter (Consumer<String> output) {
        this.output = output;
    }

    // ---------------------------------------------------------------------------------------------

    public void execute (List<Instruction> code, Environment env) {
        execute(new CodeBlock(code), env);
    }

    /**
     * Executes a block. Runs of its non-directive instructions are taken to read the block's
     * free variables, which may include names the optimizer folded away.
     */
    public void execute (CodeBlock block, Environment env)
    {
        List<Instruction> pending = new ArrayList<>();

        InstructionVisitor<Void> dispatch = new InstructionVisitor<Void>()
        {
            private CodeBlock takePending () {
                CodeBlock code = new CodeBlock(pending, block.freeVariables);
                pending.clear();
                return code;
            }

            @Override public Void visitBinary (BinaryInstruction insn) {
                pending.add(insn);
                return null;
            }

            @Override public Void visitUnary (UnaryInstruction insn) {
                pending.add(insn);
                return null;
            }

            @Override public Void visitCopy (CopyInstruction insn) {
                pending.add(insn);
                return null;
            }

            @Override public Void visitTable (TableDirective insn)
            {
                CodeBlock target = pending.isEmpty()
                    ? resolve(insn.target, env)
                    : takePending();
                table(target, env).lines().forEach(output);
                return null;
            }

            @Override public Void visitEval (EvalDirective insn)
            {
                boolean value = pending.isEmpty()
                    ? evaluate(env)
                    : commit(takePending(), env);
                output.accept(value ? "1" : "0");
                return null;
            }

            @Override public Void visitInfer (InferDirective insn)
            {
                if (!pending.isEmpty())
                    commit(takePending(), env);

                for (String rule : insn.rules) {
                    Boolean value = env.ruleValue(rule);
                    if (value == null)
                        throw new RuntimeError(rule, "rule '" + rule + "' was never evaluated");
                    output.accept(rule + " = " + (value ? "1" : "0"));
                }
                return null;
            }
        };

        for (Instruction insn : block.instructions)
            insn.accept(dispatch);

        if (!pending.isEmpty())
            commit(new CodeBlock(pending, block.freeVariables), env);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Evaluates the last unnamed expression against the current variables.
     */
    public boolean evaluate (Environment env)
    {
        CodeBlock code = env.lastExpression();
        if (code == null)
            throw new RuntimeError(null, "no expression to evaluate");
        return new Frame(env, new HashMap<>(), code).run();
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Builds the truth table of the named expression or rule, or of the last unnamed
     * expression if {@code target} is null.
     */
    public TruthTable table (String target, Environment env) {
        return table(resolve(target, env), env);
    }

    /**
     * Builds the truth table of a block over its free variables. Each row runs the code afresh
     * with the variables bound to the row's values. The environment is only read, for the
     * values of rules the code refers to.
     */
    public TruthTable table (CodeBlock code, Environment env)
    {
        List<String> variables = new ArrayList<>(code.freeVariables);
        TruthTable table = new TruthTable(variables);
        boolean[] assignment = new boolean[variables.size()];

        do {
            Map<String, Boolean> locals = new HashMap<>();
            for (int i = 0; i < assignment.length; ++i)
                locals.put(variables.get(i), assignment[i]);
            table.add(assignment, new Frame(env, locals, code).run());
        } while (increment(assignment));

        return table;
    }

    // ---------------------------------------------------------------------------------------------

    private static CodeBlock resolve (String target, Environment env)
    {
        if (target == null) {
            CodeBlock code = env.lastExpression();
            if (code == null)
                throw new RuntimeError(null, "no expression to build a table for");
            return code;
        }
        CodeBlock code = env.code(target);
        if (code == null)
            throw new RuntimeError(target, "unknown rule or expression '" + target + "'");
        return code;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Runs code for its effect on the environment and returns the last value it computed.
     */
    private static boolean commit (CodeBlock code, Environment env)
    {
        for (String name : code.freeVariables)
            if (env.ruleValue(name) == null)
                env.declare(name);

        Frame frame = new Frame(env, null, code);
        boolean value = frame.run();
        if (!frame.bindsName)
            env.setLastExpression(code);
        return value;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Advances to the next assignment in binary order. Returns false after the last one.
     */
    private static boolean increment (boolean[] bits)
    {
        for (int i = bits.length - 1; i >= 0; --i) {
            if (!bits[i]) {
                bits[i] = true;
                return true;
            }
            bits[i] = false;
        }
        return false;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * One run of a list of non-directive instructions.
     *
     * <p>With {@code locals} set, names are read there first and assignments go there, so the
     * environment is left untouched. Without it, assignments write the environment.
     */
    private static final class Frame implements InstructionVisitor<Void>
    {
        final Environment env;
        final Map<String, Boolean> locals;
        final CodeBlock code;
        final Map<Integer, Boolean> temporaries = new HashMap<>();

        Boolean last = null;
        boolean bindsName = false;

        Frame (Environment env, Map<String, Boolean> locals, CodeBlock code) {
            this.env = env;
            this.locals = locals;
            this.code = code;
        }

        boolean run ()
        {
            for (Instruction insn : code.instructions)
                if (!insn.isDirective()) insn.accept(this);
            if (last == null)
                throw new RuntimeError(null, "no instructions to run");
            return last;
        }

        // -----------------------------------------------------------------------------------------

        @Override public Void visitBinary (BinaryInstruction insn)
        {
            boolean left  = read(insn.left);
            boolean right = read(insn.right);
            writeTemporary(insn.target, insn.operator.apply(left, right));
            return null;
        }

        @Override public Void visitUnary (UnaryInstruction insn) {
            // there is only NOT
            writeTemporary(insn.target, !read(insn.operand));
            return null;
        }

        @Override public Void visitCopy (CopyInstruction insn)
        {
            boolean value = read(insn.source);
            last = value;

            if (insn.binding == Binding.TEMPORARY) {
                temporaries.put(insn.target.index(), value);
                return null;
            }

            bindsName = true;
            String name = insn.target.name();

            if (locals != null) {
                locals.put(name, value);
                return null;
            }

            switch (insn.binding) {
                case VARIABLE:
                    env.setVariable(name, value);
                    break;
                case EXPRESSION:
                    env.setVariable(name, value);
                    env.storeExpression(name, code);
                    break;
                case RULE:
                    env.defineRule(name, code, value);
                    break;
                default:
                    throw new Error("should not reach here");
            }
            return null;
        }

        @Override public Void visitTable (TableDirective insn) {
            throw new Error("should not reach here");
        }

        @Override public Void visitEval (EvalDirective insn) {
            throw new Error("should not reach here");
        }

        @Override public Void visitInfer (InferDirective insn) {
            throw new Error("should not reach here");
        }

        // -----------------------------------------------------------------------------------------

        private void writeTemporary (Operand target, boolean value) {
            temporaries.put(target.index(), value);
            last = value;
        }

        private boolean read (Operand operand)
        {
            switch (operand.kind) {
                case LITERAL:
                    return operand.value();

                case TEMPORARY:
                    Boolean temporary = temporaries.get(operand.index());
                    if (temporary == null)
                        throw new RuntimeError(operand.toString(),
                            "temporary " + operand + " read before it is defined");
                    return temporary;

                case NAME:
                    String name = operand.name();
                    Boolean value = locals == null ? null : locals.get(name);
                    if (value == null) value = env.ruleValue(name);
                    if (value == null) value = env.variable(name);
                    if (value == null)
                        throw new RuntimeError(name, "undefined variable '" + name + "'");
                    return value;

                default:
                    throw new Error("should not reach here");
            }
        }
    }
}
