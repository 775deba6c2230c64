package norswap.logiceval;

import norswap.utils.exceptions.NoStackException;

/**
 * Root of the errors the pipeline reports to its caller. Each stage fails with its own
 * subclass and the first error aborts the run.
 *
 * <p>These are diagnostics about the input, not about the program, so they carry no stack
 * trace.
 */
public abstract class LogicException extends NoStackException
{
    private final String detail;

    protected LogicException (String detail) {
        this.detail = detail;
    }

    /** A label for the stage that failed, e.g. "Syntax Error". */
    public abstract String kind ();

    /** Where the error occurred, or null if it is not tied to a source position. */
    public Position position () {
        return null;
    }

    /** The message without kind and position. */
    public String detail () {
        return detail;
    }

    @Override public String getMessage ()
    {
        Position position = position();
        return position == null
            ? kind() + ": " + detail
            : kind() + " at " + position + ": " + detail;
    }
}
