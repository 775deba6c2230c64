package norswap.logiceval;

/**
 * Settings of a run, read from the command line.
 */
public final class Options
{
    // ---------------------------------------------------------------------------------------------

    public static final String USAGE =
        "usage: logiceval [--verbose | -v] [--no-optimize] [--max-depth N] [file]";

    public static final Options DEFAULT =
        new Options(false, true, LogicParser.DEFAULT_MAX_DEPTH, null);

    // ---------------------------------------------------------------------------------------------

    /** Print a trace of every compilation stage. */
    public final boolean verbose;

    /** Run the peephole optimizer on the generated code. */
    public final boolean optimize;

    /** Deepest expression nesting the parser accepts. */
    public final int maxDepth;

    /** File to run, or null for the interactive loop. */
    public final String sourceFile;

    // ---------------------------------------------------------------------------------------------

    public Options (boolean verbose, boolean optimize, int maxDepth, String sourceFile)
    {
        if (maxDepth < 1)
            throw new IllegalArgumentException("--max-depth must be positive: " + maxDepth);
        this.verbose = verbose;
        this.optimize = optimize;
        this.maxDepth = maxDepth;
        this.sourceFile = sourceFile;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * @throws IllegalArgumentException on an unknown flag, a malformed value or a second file
     */
    public static Options parse (String... args)
    {
        boolean verbose = false;
        boolean optimize = true;
        int maxDepth = LogicParser.DEFAULT_MAX_DEPTH;
        String file = null;

        for (int i = 0; i < args.length; ++i) {
            String arg = args[i];
            switch (arg) {
                case "--verbose":
                case "-v":
                    verbose = true;
                    break;
                case "--no-optimize":
                    optimize = false;
                    break;
                case "--max-depth":
                    if (i + 1 == args.length)
                        throw new IllegalArgumentException("--max-depth needs a value\n" + USAGE);
                    maxDepth = parseDepth(args[++i]);
                    break;
                default:
                    if (arg.startsWith("-"))
                        throw new IllegalArgumentException("unknown option " + arg + "\n" + USAGE);
                    if (file != null)
                        throw new IllegalArgumentException("more than one file given\n" + USAGE);
                    file = arg;
            }
        }

        return new Options(verbose, optimize, maxDepth, file);
    }

    private static int parseDepth (String value)
    {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--max-depth expects a number, got " + value, e);
        }
    }

    // ---------------------------------------------------------------------------------------------

    public Options withVerbose (boolean verbose) {
        return new Options(verbose, optimize, maxDepth, sourceFile);
    }
}
