package norswap.logiceval;

/**
 * Raised on the first token the parser cannot accept.
 */
public final class SyntaxError extends LogicException
{
    /** The offending token. */
    public final Token found;

    public SyntaxError (Token found, String detail) {
        super(detail);
        this.found = found;
    }

    public TokenKind foundKind () {
        return found.kind;
    }

    @Override public String kind () {
        return "Syntax Error";
    }

    @Override public Position position () {
        return found.position();
    }
}
