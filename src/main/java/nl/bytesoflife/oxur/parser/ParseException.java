package nl.bytesoflife.oxur.parser;

import nl.bytesoflife.oxur.lexer.LexException;
import nl.bytesoflife.oxur.lexer.Position;

/**
 * Thrown when text cannot be read as an S-expression, or when an S-expression
 * does not have the shape a builder expects.
 */
public class ParseException extends RuntimeException {

    public enum Kind {
        EMPTY_INPUT,
        UNTERMINATED_LIST,
        UNEXPECTED_CLOSE_PAREN,
        EXPECTED,
        LEX_ERROR
    }

    private final Kind kind;
    private final String expected;
    private final String found;
    private final Position position;

    private ParseException(Kind kind, String message, String expected, String found,
                           Position position, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.expected = expected;
        this.found = found;
        this.position = position;
    }

    public static ParseException emptyInput() {
        return new ParseException(Kind.EMPTY_INPUT, "Empty input", null, null, null, null);
    }

    public static ParseException unterminatedList(Position position) {
        return new ParseException(Kind.UNTERMINATED_LIST,
                "Unterminated list at " + position, null, null, position, null);
    }

    public static ParseException unexpectedCloseParen(Position position) {
        return new ParseException(Kind.UNEXPECTED_CLOSE_PAREN,
                "Unexpected closing parenthesis at " + position, null, null, position, null);
    }

    public static ParseException expected(String expected, String found, Position position) {
        return new ParseException(Kind.EXPECTED,
                "Expected " + expected + ", found " + found + " at " + position,
                expected, found, position, null);
    }

    public static ParseException lexError(LexException cause) {
        return new ParseException(Kind.LEX_ERROR, "Lexer error: " + cause.getMessage(),
                null, null, cause.getPosition(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    /**
     * Where the problem was detected; null only for {@link Kind#EMPTY_INPUT}.
     */
    public Position getPosition() {
        return position;
    }
}
