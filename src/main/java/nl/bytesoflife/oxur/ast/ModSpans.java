package nl.bytesoflife.oxur.ast;

public record ModSpans(Span innerSpan, Span injectUseSpan) {

    public static final ModSpans DUMMY = new ModSpans(Span.DUMMY, Span.DUMMY);

    public static ModSpans of(Span innerSpan) {
        return new ModSpans(innerSpan, Span.DUMMY);
    }
}
