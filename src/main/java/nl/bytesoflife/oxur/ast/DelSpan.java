package nl.bytesoflife.oxur.ast;

/**
 * Spans of the opening and closing delimiter of macro arguments.
 */
public record DelSpan(Span open, Span close) {

    public static final DelSpan DUMMY = new DelSpan(Span.DUMMY, Span.DUMMY);
}
