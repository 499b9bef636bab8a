package nl.bytesoflife.oxur.lexer;

/**
 * Thrown by {@link SExpressionLexer} on the first lexical error. Tokenization
 * stops there; no partial token list is returned.
 */
public class LexException extends RuntimeException {

    public enum Kind {
        UNEXPECTED_EOF,
        UNEXPECTED_CHAR,
        UNTERMINATED_STRING,
        INVALID_ESCAPE
    }

    private final Kind kind;
    private final int codePoint;
    private final Position position;

    private LexException(Kind kind, String message, int codePoint, Position position) {
        super(message);
        this.kind = kind;
        this.codePoint = codePoint;
        this.position = position;
    }

    public static LexException unexpectedEof(Position position) {
        return new LexException(Kind.UNEXPECTED_EOF, "Unexpected end of input", -1, position);
    }

    public static LexException unexpectedChar(int codePoint, Position position) {
        return new LexException(Kind.UNEXPECTED_CHAR,
                "Unexpected character '" + Character.toString(codePoint) + "' at " + position, codePoint, position);
    }

    public static LexException unterminatedString(Position position) {
        return new LexException(Kind.UNTERMINATED_STRING,
                "Unterminated string at " + position, -1, position);
    }

    public static LexException invalidEscape(int codePoint, Position position) {
        return new LexException(Kind.INVALID_ESCAPE,
                "Invalid escape sequence '\\" + Character.toString(codePoint) + "' at " + position, codePoint, position);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The offending code point for UNEXPECTED_CHAR and INVALID_ESCAPE, otherwise -1.
     */
    public int getCodePoint() {
        return codePoint;
    }

    public Position getPosition() {
        return position;
    }
}
