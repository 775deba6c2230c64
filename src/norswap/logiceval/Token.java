package norswap.logiceval;

public final class Token
{
    public final TokenKind kind;
    public final String text;
    public final int line;
    public final int column;

    public Token (TokenKind kind, String text, int line, int column) {
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public Position position () {
        return new Position(line, column);
    }

    @Override public String toString () {
        return kind + "('" + text + "') at " + line + ":" + column;
    }
}
