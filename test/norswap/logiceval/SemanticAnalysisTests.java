package norswap.logiceval;

import norswap.logiceval.ast.ProgramNode;
import org.testng.annotations.Test;

import java.util.List;
import java.util.Set;

import static org.testng.Assert.*;

public final class SemanticAnalysisTests
{
    // ---------------------------------------------------------------------------------------------

    private static ProgramNode parse (String source) {
        return new LogicParser(new LogicScanner(source).scan()).parse();
    }

    private static SemanticAnalysis check (String source) {
        SemanticAnalysis analysis = new SemanticAnalysis();
        analysis.check(parse(source));
        return analysis;
    }

    private static SemanticError failure (SemanticAnalysis analysis, String source)
    {
        try {
            analysis.check(parse(source));
        } catch (SemanticError e) {
            return e;
        }
        throw new AssertionError("expected a semantic error for: " + source);
    }

    private static SemanticError failure (String source) {
        return failure(new SemanticAnalysis(), source);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testValidProgram ()
    {
        SemanticAnalysis analysis =
            check("set C = 1; expr A & B; R: A | C; S: !R; infer R, S; table R; eval;");
        assertEquals(List.copyOf(analysis.rules()), List.of("R", "S"));
        assertEquals(List.copyOf(analysis.variables()), List.of("A", "B", "C", "R"));
    }

    @Test public void testDuplicateRule ()
    {
        SemanticError e = failure("R: A; R: B;");
        assertEquals(e.name, "R");
        assertEquals(e.position(), new Position(1, 7));
        assertEquals(e.getMessage(), "Semantic Error at 1:7: rule 'R' is already defined");
    }

    @Test public void testUndefinedInference ()
    {
        SemanticError e = failure("R: A; infer R, S;");
        assertEquals(e.name, "S");
        assertEquals(e.detail(), "inference on undefined rule 'S'");

        // must be defined earlier, not later
        assertEquals(failure("infer R; R: A;").name, "R");
    }

    @Test public void testFirstErrorWins () {
        assertEquals(failure("infer X; R: A; R: B;").name, "X");
    }

    @Test public void testVariablesNeedNoDeclaration () {
        check("expr A & B; table; Q: Z -> Y;");
    }

    @Test public void testTableTargetIsNotChecked () {
        // resolved when the table is built
        check("table Nowhere;");
    }

    @Test public void testKnownRules ()
    {
        new SemanticAnalysis(Set.of("R")).check(parse("infer R;"));

        SemanticError e = failure(new SemanticAnalysis(Set.of("R")), "R: B;");
        assertEquals(e.name, "R");

        assertEquals(failure(new SemanticAnalysis(Set.of("R")), "set R = 0;").name, "R");
    }

    @Test public void testSetOnRule ()
    {
        SemanticError e = failure("R: A; set R = 1;");
        assertEquals(e.name, "R");
        assertEquals(e.position(), new Position(1, 7));
        assertEquals(e.detail(), "cannot set 'R': it is a rule");

        // a variable may still become a rule later
        check("set R = 1; R: A;");
    }
}
