package nl.bytesoflife.oxur.lexer;

/**
 * A location in source text: UTF-8 byte offset plus 1-based line and column.
 */
public record Position(int offset, int line, int column) {

    public static final Position START = new Position(0, 1, 1);

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
