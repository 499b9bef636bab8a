package nl.bytesoflife.oxur.lexer;

/**
 * A single lexical token. For keywords the lexeme has the leading colon
 * stripped, for strings it holds the unescaped value.
 */
public record Token(TokenType type, String lexeme, Position position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "') at " + position;
    }
}
