package norswap.logiceval;

public final class SemanticError extends LogicException
{
    /** The rule name the error is about. */
    public final String name;

    private final Position position;

    public SemanticError (String name, Position position, String detail) {
        super(detail);
        this.name = name;
        this.position = position;
    }

    @Override public String kind () {
        return "Semantic Error";
    }

    @Override public Position position () {
        return position;
    }
}
