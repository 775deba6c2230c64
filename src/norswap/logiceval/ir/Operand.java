package norswap.logiceval.ir;

import java.util.Objects;

/**
 * A value location in three-address code: a temporary {@code t<n>}, a variable or rule name,
 * or one of the literals {@code 0} and {@code 1}.
 */
public final class Operand
{
    public enum Kind { TEMPORARY, NAME, LITERAL }

    public static final Operand TRUE  = new Operand(Kind.LITERAL, null, 0, true);
    public static final Operand FALSE = new Operand(Kind.LITERAL, null, 0, false);

    public final Kind kind;
    private final String name;
    private final int index;
    private final boolean value;

    private Operand (Kind kind, String name, int index, boolean value) {
        this.kind = kind;
        this.name = name;
        this.index = index;
        this.value = value;
    }

    // ---------------------------------------------------------------------------------------------

    public static Operand temporary (int index) {
        if (index < 1) throw new IllegalArgumentException("temporaries are numbered from 1");
        return new Operand(Kind.TEMPORARY, null, index, false);
    }

    public static Operand name (String name) {
        return new Operand(Kind.NAME, Objects.requireNonNull(name), 0, false);
    }

    public static Operand literal (boolean value) {
        return value ? TRUE : FALSE;
    }

    // ---------------------------------------------------------------------------------------------

    public boolean isTemporary () {
        return kind == Kind.TEMPORARY;
    }

    public boolean isName () {
        return kind == Kind.NAME;
    }

    public boolean isLiteral () {
        return kind == Kind.LITERAL;
    }

    public boolean isLiteral (boolean value) {
        return kind == Kind.LITERAL && this.value == value;
    }

    /** Number of a temporary. */
    public int index () {
        if (kind != Kind.TEMPORARY) throw new IllegalStateException("not a temporary: " + this);
        return index;
    }

    /** Identifier of a variable or rule. */
    public String name () {
        if (kind != Kind.NAME) throw new IllegalStateException("not a name: " + this);
        return name;
    }

    /** Value of a literal. */
    public boolean value () {
        if (kind != Kind.LITERAL) throw new IllegalStateException("not a literal: " + this);
        return value;
    }

    // ---------------------------------------------------------------------------------------------

    @Override public boolean equals (Object other)
    {
        if (this == other) return true;
        if (!(other instanceof Operand)) return false;
        Operand that = (Operand) other;
        return kind == that.kind
            && index == that.index
            && value == that.value
            && Objects.equals(name, that.name);
    }

    @Override public int hashCode () {
        return Objects.hash(kind, name, index, value);
    }

    @Override public String toString ()
    {
        switch (kind) {
            case TEMPORARY: return "t" + index;
            case NAME:      return name;
            case LITERAL:   return value ? "1" : "0";
            default:
                throw new Error("should not reach here");
        }
    }
}
