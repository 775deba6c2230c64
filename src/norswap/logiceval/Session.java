package norswap.logiceval;

import norswap.logiceval.interpreter.Environment;
import norswap.logiceval.ir.IRGenerator;

/**
 * The state kept between runs of the same session: the interpreter's environment and the code
 * the generator has staged for {@code table}. Sessions share nothing.
 */
public final class Session
{
    private Environment environment = new Environment();
    private final IRGenerator generator = new IRGenerator();

    public Environment environment () {
        return environment;
    }

    public IRGenerator generator () {
        return generator;
    }

    /** Starts over with no variables, rules or stored expressions. */
    public void reset () {
        environment = new Environment();
        generator.reset();
    }
}
