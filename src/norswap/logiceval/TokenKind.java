package norswap.logiceval;

public enum TokenKind
{
    // keywords
    EXPR        ("'expr'"),
    SET         ("'set'"),
    TABLE       ("'table'"),
    EVAL        ("'eval'"),
    INFER       ("'infer'"),

    ID          ("identifier"),
    BOOL        ("boolean literal"),

    // operators
    AND         ("'&'"),
    OR          ("'|'"),
    NOT         ("'!'"),
    IMPLIES     ("'->'"),
    XOR         ("'xor'"),

    // delimiters
    LPAREN      ("'('"),
    RPAREN      ("')'"),
    SEMICOLON   ("';'"),
    COLON       ("':'"),
    COMMA       ("','"),
    EQUALS      ("'='"),

    EOF         ("end of input");

    public final String description;

    TokenKind (String description) {
        this.description = description;
    }
}
