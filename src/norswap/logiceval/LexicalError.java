package norswap.logiceval;

public final class LexicalError extends LogicException
{
    public final int line;
    public final int column;
    public final char character;

    public LexicalError (int line, int column, char character) {
        super("unexpected character '" + character + "'");
        this.line = line;
        this.column = column;
        this.character = character;
    }

    @Override public String kind () {
        return "Lexical Error";
    }

    @Override public Position position () {
        return new Position(line, column);
    }
}
