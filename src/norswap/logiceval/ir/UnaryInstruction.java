package norswap.logiceval.ir;

import norswap.logiceval.ast.UnaryOperator;

/**
 * {@code target = NOT operand}
 */
public final class UnaryInstruction extends Instruction
{
    public final Operand target;
    public final UnaryOperator operator;
    public final Operand operand;

    public UnaryInstruction (Operand target, UnaryOperator operator, Operand operand) {
        if (!target.isTemporary())
            throw new IllegalArgumentException("operations compute into temporaries: " + target);
        this.target = target;
        this.operator = operator;
        this.operand = operand;
    }

    @Override public <R> R accept (InstructionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override public String toString () {
        return target + " = " + operator.code + " " + operand;
    }
}
