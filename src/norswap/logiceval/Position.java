package norswap.logiceval;

/**
 * A 1-based line and column in the source text.
 */
public final class Position
{
    public final int line;
    public final int column;

    public Position (int line, int column) {
        this.line = line;
        this.column = column;
    }

    @Override public boolean equals (Object other) {
        if (!(other instanceof Position)) return false;
        Position that = (Position) other;
        return line == that.line && column == that.column;
    }

    @Override public int hashCode () {
        return 31 * line + column;
    }

    @Override public String toString () {
        return line + ":" + column;
    }
}
