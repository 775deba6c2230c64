package norswap.logiceval.ir;

import norswap.logiceval.ast.BinaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Peephole optimizer: rewrites single operator instructions using boolean identities.
 *
 * <p>For {@code t = OP a b}, in order:
 * <ol>
 *     <li>both operands literal: fold to {@code t = <value>};</li>
 *     <li>one operand is the identity of OP (1 for AND, 0 for OR and XOR):
 *     {@code t = <other operand>};</li>
 *     <li>one operand is the annihilator of OP (0 for AND, 1 for OR):
 *     {@code t = <annihilator>}.</li>
 * </ol>
 * {@code t = NOT <literal>} folds to the complement. Everything else passes through.
 *
 * <p>This is one forward pass without any look at neighbouring instructions. Rewrites only
 * ever produce copies, which are never rewritten, so optimizing twice is the same as
 * optimizing once. The output has the same length as the input.
 */
public final class Optimizer implements InstructionVisitor<Instruction>
{
    // ---------------------------------------------------------------------------------------------

    public List<Instruction> optimize (List<Instruction> code)
    {
        List<Instruction> result = new ArrayList<>(code.size());
        for (Instruction insn : code)
            result.add(insn.accept(this));
        return result;
    }

    public CodeBlock optimize (CodeBlock block) {
        return block.withInstructions(optimize(block.instructions));
    }

    // ---------------------------------------------------------------------------------------------

    @Override public Instruction visitBinary (BinaryInstruction insn)
    {
        Operand left  = insn.left;
        Operand right = insn.right;

        if (left.isLiteral() && right.isLiteral()) {
            boolean value = insn.operator.apply(left.value(), right.value());
            return CopyInstruction.temporary(insn.target, Operand.literal(value));
        }

        Operand identity = identity(insn.operator);
        if (identity != null) {
            if (left.equals(identity))
                return CopyInstruction.temporary(insn.target, right);
            if (right.equals(identity))
                return CopyInstruction.temporary(insn.target, left);
        }

        Operand annihilator = annihilator(insn.operator);
        if (annihilator != null && (left.equals(annihilator) || right.equals(annihilator)))
            return CopyInstruction.temporary(insn.target, annihilator);

        return insn;
    }

    // ---------------------------------------------------------------------------------------------

    @Override public Instruction visitUnary (UnaryInstruction insn)
    {
        // there is only NOT
        return insn.operand.isLiteral()
            ? CopyInstruction.temporary(insn.target, Operand.literal(!insn.operand.value()))
            : insn;
    }

    // ---------------------------------------------------------------------------------------------

    @Override public Instruction visitCopy (CopyInstruction insn) {
        return insn;
    }

    @Override public Instruction visitTable (TableDirective insn) {
        return insn;
    }

    @Override public Instruction visitEval (EvalDirective insn) {
        return insn;
    }

    @Override public Instruction visitInfer (InferDirective insn) {
        return insn;
    }

    // ---------------------------------------------------------------------------------------------

    private static Operand identity (BinaryOperator operator)
    {
        switch (operator) {
            case AND: return Operand.TRUE;
            case OR:
            case XOR: return Operand.FALSE;
            default:  return null;
        }
    }

    private static Operand annihilator (BinaryOperator operator)
    {
        switch (operator) {
            case AND: return Operand.FALSE;
            case OR:  return Operand.TRUE;
            default:  return null;
        }
    }
}
