package norswap.logiceval.ast;

public enum UnaryOperator
{
    NOT ("!", "NOT");

    public final String string;
    public final String code;

    UnaryOperator (String string, String code) {
        this.string = string;
        this.code = code;
    }
}
