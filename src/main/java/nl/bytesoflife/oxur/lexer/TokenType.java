package nl.bytesoflife.oxur.lexer;

public enum TokenType {
    LPAREN,
    RPAREN,
    SYMBOL,
    KEYWORD,
    STRING,
    NUMBER,
    NIL,
    EOF
}
