package norswap.logiceval;

import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.testng.Assert.*;

public final class MainTests
{
    // ---------------------------------------------------------------------------------------------

    private int status;

    private String run (String input, String... args)
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        ByteArrayInputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        status = Main.run(args, in, out);
        return bytes.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private Path file (String contents) throws IOException
    {
        Path path = Files.createTempFile("logiceval", ".logic");
        path.toFile().deleteOnExit();
        Files.writeString(path, contents, StandardCharsets.UTF_8);
        return path;
    }

    // ==== FILE MODE ==============================================================================

    @Test public void testFile () throws IOException
    {
        String out = run("", file("set A = 1;\nexpr A & 1;\neval;\n").toString());
        assertEquals(status, 0);
        assertEquals(out, "1\n");
    }

    @Test public void testFileWithError () throws IOException
    {
        String out = run("", file("expr A;\neval;\ninfer R;\n").toString());
        assertEquals(status, 1);
        assertEquals(out, "Error: Semantic Error at 3:1: inference on undefined rule 'R'\n");
    }

    @Test public void testMissingFile ()
    {
        String out = run("", "no/such/file.logic");
        assertEquals(status, 1);
        assertTrue(out.startsWith("File not found: no/such/file.logic\n"));
    }

    @Test public void testEmptyFile () throws IOException
    {
        String out = run("", file("  \n").toString());
        assertEquals(status, 1);
        assertEquals(out, "Error: empty source file\n");
    }

    @Test public void testUnreadableFile () throws IOException
    {
        Path path = file("");
        Files.write(path, new byte[] { 'e', 'x', 'p', 'r', ' ', (byte) 0xC3, ';' });

        String out = run("", path.toString());
        assertEquals(status, 1);
        assertTrue(out.startsWith("Error: cannot read " + path + ": "), out);
    }

    @Test public void testBadOption ()
    {
        String out = run("", "--nope");
        assertEquals(status, 2);
        assertTrue(out.contains(Options.USAGE));
    }

    @Test public void testVerboseFile () throws IOException
    {
        String out = run("", "-v", file("expr A;\neval;\n").toString());
        assertEquals(status, 0);
        assertTrue(out.contains("SOURCE CODE"));
        assertTrue(out.contains("   1 | expr A;"));
        assertTrue(out.contains("STAGE 6: EXECUTION"));
        // emitted lines are printed once, inside the trace
        assertTrue(out.contains("\n  0\n"));
        assertFalse(out.contains("\n0\n"));
    }

    @Test public void testVerboseFailureReportedOnce () throws IOException
    {
        String out = run("", "--verbose", file("expr A;\ninfer R;\n").toString());
        assertEquals(status, 1);
        assertTrue(out.contains("Failed: Semantic Error at 2:1: inference on undefined rule 'R'"));
        assertFalse(out.contains("Error: Semantic Error"));
    }

    // ==== INTERACTIVE MODE =======================================================================

    @Test public void testRepl ()
    {
        String out = run(String.join("\n",
            "set A = 1;",
            "expr A",
            "  & 0;",
            "eval;",
            "R: !A; infer R;",
            "exit",
            "eval;"));

        assertEquals(status, 0);
        assertTrue(out.startsWith("LogicEval v1.0 (interactive mode)\n"));
        assertTrue(out.contains("> ... > "));
        assertTrue(out.contains("> 0\n"));
        assertTrue(out.contains("> R = 0\n"));
        // nothing runs after exit
        assertTrue(out.endsWith("> R = 0\n> \n"));
    }

    @Test public void testReplErrorsDoNotEndSession ()
    {
        String out = run(String.join("\n",
            "expr A &;",
            "expr B;",
            "eval;"));

        assertTrue(out.contains("Error: Syntax Error at 1:9: unexpected ';' in expression"));
        assertTrue(out.contains("> 0\n"));
    }

    @Test public void testReplCommands ()
    {
        String out = run(String.join("\n",
            "set A = 1; expr A;",
            "reset",
            "eval;",
            "verbose",
            "verbose"));

        assertTrue(out.contains("Session reset.\n"));
        assertTrue(out.contains("Error: Runtime Error: no expression to evaluate\n"));
        assertTrue(out.contains("Verbose mode: ON\n"));
        assertTrue(out.contains("Verbose mode: OFF\n"));
    }
}
