package norswap.logiceval.ir;

/**
 * A three-address code instruction. The set of instructions is closed: every consumer
 * handles all of them through an {@link InstructionVisitor}.
 *
 * <p>Instructions are immutable values; two instructions are equal when they print
 * the same and bind the same kind of target.
 */
public abstract class Instruction
{
    Instruction () {}

    public abstract <R> R accept (InstructionVisitor<R> visitor);

    /** True for {@code TABLE}, {@code EVAL} and {@code INFER}. */
    public boolean isDirective () {
        return false;
    }

    /** What equality is decided on. */
    String key () {
        return toString();
    }

    @Override public final boolean equals (Object other) {
        return other instanceof Instruction
            && other.getClass() == getClass()
            && ((Instruction) other).key().equals(key());
    }

    @Override public final int hashCode () {
        return key().hashCode();
    }
}
