package norswap.logiceval.ir;

import norswap.logiceval.ast.BinaryOperator;

/**
 * {@code target = OP left right}
 */
public final class BinaryInstruction extends Instruction
{
    public final Operand target;
    public final BinaryOperator operator;
    public final Operand left;
    public final Operand right;

    public BinaryInstruction (Operand target, BinaryOperator operator, Operand left, Operand right) {
        if (!target.isTemporary())
            throw new IllegalArgumentException("operations compute into temporaries: " + target);
        this.target = target;
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override public <R> R accept (InstructionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override public String toString () {
        return target + " = " + operator.code + " " + left + " " + right;
    }
}
