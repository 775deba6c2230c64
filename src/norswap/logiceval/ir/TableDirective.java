package norswap.logiceval.ir;

/**
 * {@code TABLE [name]}
 */
public final class TableDirective extends Instruction
{
    /** Null when the table is for the last unnamed expression. */
    public final String target;

    public TableDirective (String target) {
        this.target = target;
    }

    @Override public boolean isDirective () {
        return true;
    }

    @Override public <R> R accept (InstructionVisitor<R> visitor) {
        return visitor.visitTable(this);
    }

    @Override public String toString () {
        return target == null ? "TABLE" : "TABLE " + target;
    }
}
