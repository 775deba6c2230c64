package norswap.logiceval;

import norswap.logiceval.ast.*;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.*;

public final class LogicParserTests
{
    // ---------------------------------------------------------------------------------------------

    private static ProgramNode parse (String source) {
        return new LogicParser(new LogicScanner(source).scan()).parse();
    }

    private static StatementNode statement (String source)
    {
        ProgramNode program = parse(source);
        assertEquals(program.statements.size(), 1);
        return program.statements.get(0);
    }

    private static ExpressionNode expression (String source) {
        return ((ExpressionStatementNode) statement("expr " + source + ";")).expression;
    }

    private static SyntaxError failure (String source, int maxDepth)
    {
        try {
            new LogicParser(new LogicScanner(source).scan(), maxDepth).parse();
        } catch (SyntaxError e) {
            return e;
        }
        throw new AssertionError("expected a syntax error for: " + source);
    }

    private static SyntaxError failure (String source) {
        return failure(source, LogicParser.DEFAULT_MAX_DEPTH);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testLeftAssociativeOr ()
    {
        BinaryExpressionNode top = (BinaryExpressionNode) expression("A | B | C");
        assertEquals(top.operator, BinaryOperator.OR);
        assertEquals(((ReferenceNode) top.right).name, "C");

        BinaryExpressionNode left = (BinaryExpressionNode) top.left;
        assertEquals(left.operator, BinaryOperator.OR);
        assertEquals(((ReferenceNode) left.left).name, "A");
        assertEquals(((ReferenceNode) left.right).name, "B");
    }

    @Test public void testRightAssociativeImplication ()
    {
        BinaryExpressionNode top = (BinaryExpressionNode) expression("A -> B -> C");
        assertEquals(top.operator, BinaryOperator.IMPLIES);
        assertEquals(((ReferenceNode) top.left).name, "A");

        BinaryExpressionNode right = (BinaryExpressionNode) top.right;
        assertEquals(right.operator, BinaryOperator.IMPLIES);
        assertEquals(((ReferenceNode) right.left).name, "B");
        assertEquals(((ReferenceNode) right.right).name, "C");
    }

    @Test public void testNestedNegation ()
    {
        UnaryExpressionNode outer = (UnaryExpressionNode) expression("!!A");
        UnaryExpressionNode inner = (UnaryExpressionNode) outer.operand;
        assertEquals(inner.operator, UnaryOperator.NOT);
        assertEquals(((ReferenceNode) inner.operand).name, "A");
    }

    // ---------------------------------------------------------------------------------------------

    @DataProvider
    public Object[][] precedence ()
    {
        return new Object[][] {
            { "A | B & C",          "(A | (B & C))" },
            { "A & B | C",          "((A & B) | C)" },
            { "A ^ B | C",          "((A xor B) | C)" },
            { "A | B xor C",        "(A | (B xor C))" },
            { "A & B xor C & D",    "((A & B) xor (C & D))" },
            { "A xor B xor C",      "((A xor B) xor C)" },
            { "A & B & C",          "((A & B) & C)" },
            { "A | B -> C | D",     "((A | B) -> (C | D))" },
            { "!A & B",             "(!A & B)" },
            { "!(A & B)",           "!(A & B)" },
            { "(A | B) & C",        "((A | B) & C)" },
            { "(A -> B) -> C",      "((A -> B) -> C)" },
            { "1 & !0",             "(1 & !0)" },
        };
    }

    @Test(dataProvider = "precedence")
    public void testPrecedence (String source, String tree) {
        assertEquals(expression(source).contents(), tree);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testExpressionNames ()
    {
        ExpressionStatementNode node = (ExpressionStatementNode) statement("expr E A & B;");
        assertEquals(node.name, "E");
        assertEquals(node.expression.contents(), "(A & B)");

        assertEquals(((ExpressionStatementNode) statement("expr E (A);")).name, "E");
        assertEquals(((ExpressionStatementNode) statement("expr E !A;")).name, "E");
        assertEquals(((ExpressionStatementNode) statement("expr E 1;")).name, "E");
        assertEquals(((ExpressionStatementNode) statement("expr E A;")).expression.contents(), "A");
    }

    @Test public void testUnnamedExpressions ()
    {
        // the identifier is not followed by something that starts an expression
        ExpressionStatementNode node = (ExpressionStatementNode) statement("expr A;");
        assertNull(node.name);
        assertEquals(node.expression.contents(), "A");

        node = (ExpressionStatementNode) statement("expr A & B;");
        assertNull(node.name);
        assertEquals(node.expression.contents(), "(A & B)");

        node = (ExpressionStatementNode) statement("expr (A) | B;");
        assertNull(node.name);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testOtherStatements ()
    {
        SetNode set = (SetNode) statement("set A = 1;");
        assertEquals(set.name, "A");
        assertTrue(set.value);
        assertFalse(((SetNode) statement("set B = 0;")).value);

        assertNull(((TableNode) statement("table;")).target);
        assertEquals(((TableNode) statement("table R;")).target, "R");

        assertTrue(statement("eval;") instanceof EvalNode);

        RuleNode rule = (RuleNode) statement("R: A -> B;");
        assertEquals(rule.name, "R");
        assertEquals(rule.expression.contents(), "(A -> B)");

        assertEquals(((InferNode) statement("infer R;")).rules, List.of("R"));
        assertEquals(((InferNode) statement("infer R1, R2 ,R3;")).rules, List.of("R1", "R2", "R3"));
    }

    @Test public void testProgram ()
    {
        ProgramNode program = parse("set A = 1;\nexpr A & B;\neval;");
        assertEquals(program.statements.size(), 3);
        assertEquals(program.statements.get(1).position, new Position(2, 1));
        assertEquals(program.contents(), "set A = 1; expr (A & B); eval;");

        assertTrue(parse("").statements.isEmpty());
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testErrors ()
    {
        SyntaxError e = failure("A & B;");
        assertEquals(e.foundKind(), TokenKind.ID);
        assertEquals(e.position(), new Position(1, 1));

        e = failure("expr A & ;");
        assertEquals(e.foundKind(), TokenKind.SEMICOLON);
        assertEquals(e.position(), new Position(1, 10));

        e = failure("set A = B;");
        assertEquals(e.foundKind(), TokenKind.ID);
        assertEquals(e.detail(), "expected boolean literal, found identifier");

        e = failure("expr (A & B;");
        assertEquals(e.foundKind(), TokenKind.SEMICOLON);
        assertEquals(e.detail(), "expected ')', found ';'");

        assertEquals(failure("infer R,;").foundKind(), TokenKind.SEMICOLON);
        assertEquals(failure("infer;").foundKind(), TokenKind.SEMICOLON);
        assertEquals(failure("eval").foundKind(), TokenKind.EOF);
        assertEquals(failure("expr A B C;").foundKind(), TokenKind.ID);
        assertEquals(failure("table 1;").foundKind(), TokenKind.BOOL);
        assertEquals(failure("; eval;").foundKind(), TokenKind.SEMICOLON);
        assertEquals(failure("expr A -> ;").foundKind(), TokenKind.SEMICOLON);
        assertEquals(failure("R = A;").foundKind(), TokenKind.ID);
    }

    @Test public void testErrorStopsAtFirstStatement () {
        // the second statement is fine but never reached
        SyntaxError e = failure("expr | A; expr A;");
        assertEquals(e.foundKind(), TokenKind.OR);
        assertEquals(e.getMessage(), "Syntax Error at 1:6: unexpected '|' in expression");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testNestingLimit ()
    {
        String deep = "expr " + "(".repeat(300) + "A" + ")".repeat(300) + ";";
        SyntaxError e = failure(deep);
        assertEquals(e.foundKind(), TokenKind.LPAREN);
        assertTrue(e.detail().contains("256"), e.detail());

        ProgramNode program =
            new LogicParser(new LogicScanner(deep).scan(), 1000).parse();
        assertEquals(program.statements.size(), 1);

        assertEquals(failure("expr " + "!".repeat(6) + "A;", 5).foundKind(), TokenKind.NOT);
        assertEquals(failure("expr A -> B -> C -> D;", 2).foundKind(), TokenKind.IMPLIES);

        // siblings do not add up
        new LogicParser(new LogicScanner("expr (A) & (B) | (C) & (D);").scan(), 2).parse();
    }

    @Test public void testOperatorChainLimit ()
    {
        new LogicParser(new LogicScanner("expr A | A | A | A | A;").scan(), 4).parse();
        assertEquals(failure("expr A | A | A | A | A | A;", 4).foundKind(), TokenKind.OR);
        assertEquals(failure("expr A & B xor C & D xor E;", 2).foundKind(), TokenKind.XOR);

        ExpressionNode top = expression("A | ".repeat(LogicParser.DEFAULT_MAX_DEPTH) + "A");
        assertEquals(top.height, LogicParser.DEFAULT_MAX_DEPTH);

        SyntaxError e = failure("expr A" + " & A".repeat(LogicParser.DEFAULT_MAX_DEPTH + 1) + ";");
        assertEquals(e.foundKind(), TokenKind.AND);
        assertEquals(e.detail(), "expression nested more than 256 levels deep");
    }
}
