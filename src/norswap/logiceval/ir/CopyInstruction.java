package norswap.logiceval.ir;

/**
 * {@code target = source}
 *
 * <p>The binding tells the interpreter where the value goes; it does not show in the text.
 */
public final class CopyInstruction extends Instruction
{
    public final Operand target;
    public final Operand source;
    public final Binding binding;

    public CopyInstruction (Operand target, Operand source, Binding binding)
    {
        if (target.isTemporary() != (binding == Binding.TEMPORARY))
            throw new IllegalArgumentException("binding " + binding + " for target " + target);
        if (target.isLiteral())
            throw new IllegalArgumentException("cannot assign to a literal");
        this.target = target;
        this.source = source;
        this.binding = binding;
    }

    public static CopyInstruction temporary (Operand target, Operand source) {
        return new CopyInstruction(target, source, Binding.TEMPORARY);
    }

    @Override public <R> R accept (InstructionVisitor<R> visitor) {
        return visitor.visitCopy(this);
    }

    @Override String key () {
        return binding + ":" + this;
    }

    @Override public String toString () {
        return target + " = " + source;
    }
}
