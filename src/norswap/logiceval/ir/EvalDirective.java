package norswap.logiceval.ir;

/**
 * {@code EVAL}
 */
public final class EvalDirective extends Instruction
{
    public static final EvalDirective INSTANCE = new EvalDirective();

    private EvalDirective () {}

    @Override public boolean isDirective () {
        return true;
    }

    @Override public <R> R accept (InstructionVisitor<R> visitor) {
        return visitor.visitEval(this);
    }

    @Override public String toString () {
        return "EVAL";
    }
}
