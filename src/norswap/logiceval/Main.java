package norswap.logiceval;

import norswap.utils.exceptions.Exceptions;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line driver: runs a source file, or reads statements interactively when no file is
 * given.
 *
 * <p>In the interactive loop, lines accumulate until one contains {@code ;}, then the buffer
 * runs against a session that lasts until {@code exit} or end of input. {@code verbose} toggles
 * the stage trace and {@code reset} starts a fresh session.
 */
public final class Main
{
    // ---------------------------------------------------------------------------------------------

    public static void main (String[] args) {
        int status = run(args, System.in, System.out);
        if (status != 0) System.exit(status);
    }

    // ---------------------------------------------------------------------------------------------

    static int run (String[] args, InputStream in, PrintStream out)
    {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            return 2;
        }

        return options.sourceFile != null
            ? runFile(options, out)
            : repl(options, new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), out);
    }

    // ---------------------------------------------------------------------------------------------

    private static int runFile (Options options, PrintStream out)
    {
        Path path = Paths.get(options.sourceFile);
        if (!Files.exists(path)) {
            out.println("File not found: " + options.sourceFile);
            out.println(Options.USAGE);
            return 1;
        }

        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            // includes input that is not valid UTF-8
            out.println("Error: cannot read " + options.sourceFile + ": " + e.getMessage());
            return 1;
        }

        if (source.isBlank()) {
            out.println("Error: empty source file");
            return 1;
        }

        LogicCompiler compiler = new LogicCompiler(options, out);
        compiler.traceSource(source);
        Result result = compiler.run(source, new Session());
        return report(result, options, out) ? 0 : 1;
    }

    // ---------------------------------------------------------------------------------------------

    private static int repl (Options options, BufferedReader in, PrintStream out)
    {
        out.println("LogicEval v1.0 (interactive mode)");
        out.println("End statements with ';'. Commands: verbose, reset, exit.");

        Session session = new Session();
        StringBuilder buffer = new StringBuilder();

        while (true) {
            out.print(buffer.length() == 0 ? "> " : "... ");
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw Exceptions.runtime(e);
            }
            if (line == null) break;

            if (buffer.length() == 0) {
                String command = line.strip();
                if (command.equals("exit"))
                    break;
                if (command.equals("verbose")) {
                    options = options.withVerbose(!options.verbose);
                    out.println("Verbose mode: " + (options.verbose ? "ON" : "OFF"));
                    continue;
                }
                if (command.equals("reset")) {
                    session.reset();
                    out.println("Session reset.");
                    continue;
                }
            }

            buffer.append(line).append('\n');
            if (line.indexOf(';') < 0) continue;

            Result result = new LogicCompiler(options, out).run(buffer.toString(), session);
            report(result, options, out);
            buffer.setLength(0);
        }

        out.println();
        return 0;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Prints the emitted lines and the error, if any, unless the trace already did.
     */
    private static boolean report (Result result, Options options, PrintStream out)
    {
        if (!options.verbose)
            result.output().forEach(out::println);
        if (!result.successful() && !options.verbose)
            out.println("Error: " + result.error().getMessage());
        return result.successful();
    }
}
