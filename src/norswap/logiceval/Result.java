package norswap.logiceval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of running a piece of source: the lines it emitted and, if it failed, the error
 * that stopped it. Lines emitted by statements before the failing one are kept.
 */
public final class Result
{
    private final List<String> output;
    private final LogicException error;

    private Result (List<String> output, LogicException error) {
        this.output = Collections.unmodifiableList(new ArrayList<>(output));
        this.error = error;
    }

    public static Result success (List<String> output) {
        return new Result(output, null);
    }

    public static Result failure (LogicException error, List<String> output) {
        return new Result(output, error);
    }

    // ---------------------------------------------------------------------------------------------

    public boolean successful () {
        return error == null;
    }

    public List<String> output () {
        return output;
    }

    /** The error that stopped the run, or null if it succeeded. */
    public LogicException error () {
        return error;
    }

    @Override public String toString () {
        return successful()
            ? "success " + output
            : "failure " + error.getMessage() + " after " + output;
    }
}
