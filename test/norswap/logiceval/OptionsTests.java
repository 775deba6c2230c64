package norswap.logiceval;

import org.testng.annotations.Test;

import static org.testng.Assert.*;

public final class OptionsTests
{
    @Test public void testDefaults ()
    {
        Options options = Options.parse();
        assertFalse(options.verbose);
        assertTrue(options.optimize);
        assertEquals(options.maxDepth, LogicParser.DEFAULT_MAX_DEPTH);
        assertNull(options.sourceFile);
    }

    @Test public void testFlags ()
    {
        Options options = Options.parse("-v", "--no-optimize", "--max-depth", "12", "rules.logic");
        assertTrue(options.verbose);
        assertFalse(options.optimize);
        assertEquals(options.maxDepth, 12);
        assertEquals(options.sourceFile, "rules.logic");

        assertTrue(Options.parse("--verbose").verbose);
        assertFalse(options.withVerbose(false).verbose);
        assertEquals(options.withVerbose(false).sourceFile, "rules.logic");
    }

    @Test public void testBadArguments ()
    {
        expectThrows(IllegalArgumentException.class, () -> Options.parse("--fast"));
        expectThrows(IllegalArgumentException.class, () -> Options.parse("a.logic", "b.logic"));
        expectThrows(IllegalArgumentException.class, () -> Options.parse("--max-depth"));
        expectThrows(IllegalArgumentException.class, () -> Options.parse("--max-depth", "deep"));
        expectThrows(IllegalArgumentException.class, () -> Options.parse("--max-depth", "0"));

        IllegalArgumentException e =
            expectThrows(IllegalArgumentException.class, () -> Options.parse("-x"));
        assertTrue(e.getMessage().endsWith(Options.USAGE));
    }
}
