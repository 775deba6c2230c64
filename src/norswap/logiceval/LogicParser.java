package norswap.logiceval;

import norswap.logiceval.ast.*;

import java.util.ArrayList;
import java.util.List;

import static norswap.logiceval.TokenKind.*;

/**
 * Recursive-descent parser over the tokens produced by {@link LogicScanner}.
 *
 * <p>One token of lookahead suffices except in two places: a statement starting with an
 * identifier (a rule needs the next token to be {@code :}) and the optional name of an
 * {@code expr} statement. There is no backtracking and no error recovery: the first unexpected
 * token raises a {@link SyntaxError}.
 *
 * <p>Operator precedence, lowest to highest: {@code ->} (right-associative), {@code |},
 * {@code xor}/{@code ^}, {@code &} (all three left-associative), prefix {@code !}.
 */
public final class LogicParser
{
    // ---------------------------------------------------------------------------------------------

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final List<Token> tokens;
    private final int maxDepth;
    private int pos = 0;
    private int depth = 0;

    // ---------------------------------------------------------------------------------------------

    public LogicParser (List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth how deeply expressions may nest (parentheses, negations and operator
     *                 chains) before the input is rejected
     */
    public LogicParser (List<Token> tokens, int maxDepth)
    {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind != EOF)
            throw new IllegalArgumentException("token list must end with EOF");
        if (maxDepth < 1)
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    // ---------------------------------------------------------------------------------------------

    public ProgramNode parse ()
    {
        Position start = current().position();
        List<StatementNode> statements = new ArrayList<>();
        while (current().kind != EOF)
            statements.add(statement());
        return new ProgramNode(start, statements);
    }

    // ==== STATEMENTS =============================================================================

    private StatementNode statement ()
    {
        Token token = current();
        switch (token.kind) {
            case EXPR:  return expressionStatement();
            case SET:   return setStatement();
            case TABLE: return tableStatement();
            case EVAL:  return evalStatement();
            case INFER: return inferStatement();
            case ID:
                if (peek().kind == COLON)
                    return ruleStatement();
                throw new SyntaxError(token,
                    "unexpected identifier '" + token.text + "' at start of statement"
                        + " (did you mean 'expr' or 'set'?)");
            default:
                throw new SyntaxError(token,
                    "unexpected " + token.kind.description + " at start of statement");
        }
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionStatementNode expressionStatement ()
    {
        Token start = expect(EXPR);
        String name = null;

        // expr NAME A & B;  -- two-token lookahead: an identifier followed by something that
        // can start an expression is the name. "expr A;" is always the unnamed expression A.
        if (current().kind == ID && startsExpression(peek().kind))
            name = advance().text;

        ExpressionNode expression = expression();
        expect(SEMICOLON);
        return new ExpressionStatementNode(start.position(), name, expression);
    }

    private static boolean startsExpression (TokenKind kind) {
        return kind == ID || kind == BOOL || kind == NOT || kind == LPAREN;
    }

    // ---------------------------------------------------------------------------------------------

    private SetNode setStatement ()
    {
        Token start = expect(SET);
        String name = expect(ID).text;
        expect(EQUALS);
        boolean value = expect(BOOL).text.equals("1");
        expect(SEMICOLON);
        return new SetNode(start.position(), name, value);
    }

    // ---------------------------------------------------------------------------------------------

    private TableNode tableStatement ()
    {
        Token start = expect(TABLE);
        String target = current().kind == ID ? advance().text : null;
        expect(SEMICOLON);
        return new TableNode(start.position(), target);
    }

    // ---------------------------------------------------------------------------------------------

    private EvalNode evalStatement ()
    {
        Token start = expect(EVAL);
        expect(SEMICOLON);
        return new EvalNode(start.position());
    }

    // ---------------------------------------------------------------------------------------------

    private RuleNode ruleStatement ()
    {
        Token name = expect(ID);
        expect(COLON);
        ExpressionNode expression = expression();
        expect(SEMICOLON);
        return new RuleNode(name.position(), name.text, expression);
    }

    // ---------------------------------------------------------------------------------------------

    private InferNode inferStatement ()
    {
        Token start = expect(INFER);
        List<String> rules = new ArrayList<>();
        rules.add(expect(ID).text);
        while (current().kind == COMMA) {
            advance();
            rules.add(expect(ID).text);
        }
        expect(SEMICOLON);
        return new InferNode(start.position(), rules);
    }

    // ==== EXPRESSIONS ============================================================================

    private ExpressionNode expression () {
        return implication();
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode implication ()
    {
        ExpressionNode left = or();
        if (current().kind != IMPLIES)
            return left;

        Token op = advance();
        descend(op);
        ExpressionNode right = implication();
        ascend();
        return binary(op, left, BinaryOperator.IMPLIES, right);
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode or ()
    {
        ExpressionNode node = xor();
        while (current().kind == OR) {
            Token op = advance();
            node = binary(op, node, BinaryOperator.OR, xor());
        }
        return node;
    }

    private ExpressionNode xor ()
    {
        ExpressionNode node = and();
        while (current().kind == XOR) {
            Token op = advance();
            node = binary(op, node, BinaryOperator.XOR, and());
        }
        return node;
    }

    private ExpressionNode and ()
    {
        ExpressionNode node = not();
        while (current().kind == AND) {
            Token op = advance();
            node = binary(op, node, BinaryOperator.AND, not());
        }
        return node;
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode not ()
    {
        if (current().kind != NOT)
            return primary();

        Token op = advance();
        descend(op);
        ExpressionNode operand = not();
        ascend();
        return new UnaryExpressionNode(op.position(), UnaryOperator.NOT, operand);
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Builds a binary node, rejecting it if the tree gets taller than the nesting limit. Operator
     * chains are parsed in a loop, so {@link #descend} does not see them, but later passes walk
     * the tree recursively.
     */
    private ExpressionNode binary
            (Token op, ExpressionNode left, BinaryOperator operator, ExpressionNode right)
    {
        BinaryExpressionNode node = new BinaryExpressionNode(left.position, left, operator, right);
        if (node.height > maxDepth)
            throw nestingError(op);
        return node;
    }

    // ---------------------------------------------------------------------------------------------

    private ExpressionNode primary ()
    {
        Token token = current();
        switch (token.kind) {
            case ID:
                advance();
                return new ReferenceNode(token.position(), token.text);
            case BOOL:
                advance();
                return new BoolLiteralNode(token.position(), token.text.equals("1"));
            case LPAREN:
                advance();
                descend(token);
                ExpressionNode inner = expression();
                ascend();
                expect(RPAREN);
                return inner;
            default:
                throw new SyntaxError(token,
                    "unexpected " + token.kind.description + " in expression");
        }
    }

    // ==== TOKENS =================================================================================

    private Token current () {
        return tokens.get(pos);
    }

    private Token peek () {
        return pos + 1 < tokens.size()
            ? tokens.get(pos + 1)
            : tokens.get(tokens.size() - 1);
    }

    private Token advance ()
    {
        Token token = tokens.get(pos);
        if (token.kind != EOF) ++pos;
        return token;
    }

    private Token expect (TokenKind kind)
    {
        Token token = current();
        if (token.kind != kind)
            throw new SyntaxError(token,
                "expected " + kind.description + ", found " + token.kind.description);
        return advance();
    }

    // ---------------------------------------------------------------------------------------------

    private void descend (Token at) {
        if (++depth > maxDepth)
            throw nestingError(at);
    }

    private void ascend () {
        --depth;
    }

    private SyntaxError nestingError (Token at) {
        return new SyntaxError(at, "expression nested more than " + maxDepth + " levels deep");
    }
}
