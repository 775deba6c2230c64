package norswap.logiceval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns source text into a list of tokens terminated by a {@link TokenKind#EOF} token.
 *
 * <p>Whitespace separates tokens and is otherwise dropped. The scanner looks at most one
 * character ahead, and only to recognize {@code ->}.
 */
public final class LogicScanner
{
    // ---------------------------------------------------------------------------------------------

    private static final Map<String, TokenKind> WORDS = new HashMap<>();
    private static final Map<Character, TokenKind> SYMBOLS = new HashMap<>();

    static {
        WORDS.put("expr",  TokenKind.EXPR);
        WORDS.put("set",   TokenKind.SET);
        WORDS.put("table", TokenKind.TABLE);
        WORDS.put("eval",  TokenKind.EVAL);
        WORDS.put("infer", TokenKind.INFER);
        WORDS.put("xor",   TokenKind.XOR);

        SYMBOLS.put('&', TokenKind.AND);
        SYMBOLS.put('|', TokenKind.OR);
        SYMBOLS.put('!', TokenKind.NOT);
        SYMBOLS.put('^', TokenKind.XOR);
        SYMBOLS.put('(', TokenKind.LPAREN);
        SYMBOLS.put(')', TokenKind.RPAREN);
        SYMBOLS.put(';', TokenKind.SEMICOLON);
        SYMBOLS.put(':', TokenKind.COLON);
        SYMBOLS.put(',', TokenKind.COMMA);
        SYMBOLS.put('=', TokenKind.EQUALS);
    }

    // ---------------------------------------------------------------------------------------------

    private final String text;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    // ---------------------------------------------------------------------------------------------

    public LogicScanner (String text) {
        this.text = text;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Scans the whole text.
     *
     * @throws LexicalError on the first character that cannot start a token
     */
    public List<Token> scan ()
    {
        List<Token> tokens = new ArrayList<>();

        while (pos < text.length()) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            if (isLetter(c)) {
                tokens.add(word());
                continue;
            }

            if (c == '0' || c == '1') {
                tokens.add(token(TokenKind.BOOL, String.valueOf(c)));
                advance();
                continue;
            }

            if (c == '-') {
                if (pos + 1 < text.length() && text.charAt(pos + 1) == '>') {
                    tokens.add(token(TokenKind.IMPLIES, "->"));
                    advance();
                    advance();
                    continue;
                }
                throw new LexicalError(line, column, c);
            }

            TokenKind kind = SYMBOLS.get(c);
            if (kind == null)
                throw new LexicalError(line, column, c);

            tokens.add(token(kind, String.valueOf(c)));
            advance();
        }

        tokens.add(token(TokenKind.EOF, ""));
        return tokens;
    }

    // ---------------------------------------------------------------------------------------------

    private Token word ()
    {
        int startLine = line;
        int startColumn = column;
        int start = pos;

        while (pos < text.length() && isWordPart(text.charAt(pos)))
            advance();

        String value = text.substring(start, pos);
        TokenKind kind = WORDS.getOrDefault(value, TokenKind.ID);
        return new Token(kind, value, startLine, startColumn);
    }

    // ---------------------------------------------------------------------------------------------

    private Token token (TokenKind kind, String value) {
        return new Token(kind, value, line, column);
    }

    private void advance ()
    {
        if (text.charAt(pos) == '\n') {
            ++line;
            column = 1;
        } else {
            ++column;
        }
        ++pos;
    }

    // ---------------------------------------------------------------------------------------------

    private static boolean isLetter (char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
    }

    private static boolean isWordPart (char c) {
        return isLetter(c) || c >= '0' && c <= '9' || c == '_';
    }
}
