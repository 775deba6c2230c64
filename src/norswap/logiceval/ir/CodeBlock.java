package norswap.logiceval.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static norswap.utils.Vanilla.map;

/**
 * The three-address code for one statement, with the variable names it reads.
 */
public final class CodeBlock
{
    public final List<Instruction> instructions;

    /** Names read as operands, sorted. Assignment targets are not included. */
    public final SortedSet<String> freeVariables;

    public CodeBlock (List<Instruction> instructions, Collection<String> freeVariables) {
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.freeVariables = Collections.unmodifiableSortedSet(new TreeSet<>(freeVariables));
    }

    public CodeBlock (List<Instruction> instructions) {
        this(instructions, freeVariables(instructions));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns a block with the same free variables and the given instructions, which must be
     * a rewrite of these that reads no other names.
     */
    public CodeBlock withInstructions (List<Instruction> rewritten) {
        return new CodeBlock(rewritten, freeVariables);
    }

    public boolean isEmpty () {
        return instructions.isEmpty();
    }

    /** One line of text per instruction. */
    public List<String> listing () {
        return List.of(map(instructions, new String[0], Instruction::toString));
    }

    @Override public String toString () {
        return String.join("\n", listing());
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Collects the variable and rule names the instructions read, sorted by name.
     */
    public static SortedSet<String> freeVariables (List<Instruction> code)
    {
        SortedSet<String> names = new TreeSet<>();
        InstructionVisitor<Void> collector = new InstructionVisitor<Void>()
        {
            private void read (Operand operand) {
                if (operand.isName()) names.add(operand.name());
            }

            @Override public Void visitBinary (BinaryInstruction insn) {
                read(insn.left);
                read(insn.right);
                return null;
            }

            @Override public Void visitUnary (UnaryInstruction insn) {
                read(insn.operand);
                return null;
            }

            @Override public Void visitCopy (CopyInstruction insn) {
                read(insn.source);
                return null;
            }

            @Override public Void visitTable (TableDirective insn) { return null; }
            @Override public Void visitEval  (EvalDirective insn)  { return null; }
            @Override public Void visitInfer (InferDirective insn) { return null; }
        };

        for (Instruction insn : code)
            insn.accept(collector);
        return names;
    }
}
