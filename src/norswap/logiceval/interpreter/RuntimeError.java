package norswap.logiceval.interpreter;

import norswap.logiceval.LogicException;

/**
 * Raised while executing three-address code.
 */
public final class RuntimeError extends LogicException
{
    /** The variable, rule or expression the error is about, or null. */
    public final String name;

    public RuntimeError (String name, String detail) {
        super(detail);
        this.name = name;
    }

    @Override public String kind () {
        return "Runtime Error";
    }
}
