package norswap.logiceval.ast;

public enum BinaryOperator
{
    AND     ("&",   "AND"),
    OR      ("|",   "OR"),
    XOR     ("xor", "XOR"),
    IMPLIES ("->",  "IMPLIES");

    /** Source spelling. */
    public final String string;

    /** Spelling in three-address code. */
    public final String code;

    BinaryOperator (String string, String code) {
        this.string = string;
        this.code = code;
    }

    public boolean apply (boolean left, boolean right)
    {
        switch (this) {
            case AND:     return left && right;
            case OR:      return left || right;
            case XOR:     return left != right;
            case IMPLIES: return !left || right;
            default:
                throw new Error("should not reach here");
        }
    }
}
