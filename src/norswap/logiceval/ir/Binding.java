package norswap.logiceval.ir;

/**
 * What the target of a {@link CopyInstruction} is.
 */
public enum Binding
{
    /** A temporary, local to one run of a block. */
    TEMPORARY,
    /** A variable given a value by {@code set}. */
    VARIABLE,
    /** The result of a named {@code expr} statement. */
    EXPRESSION,
    /** The result of a rule. */
    RULE
}
