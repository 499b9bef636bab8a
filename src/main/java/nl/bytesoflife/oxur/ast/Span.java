package nl.bytesoflife.oxur.ast;

/**
 * Byte range [lo, hi) in the original source plus a syntax context tag.
 */
public record Span(int lo, int hi, int ctxt) {

    /** Unknown location; the default whenever a node omits {@code :span}. */
    public static final Span DUMMY = new Span(0, 0, 0);

    public static Span of(int lo, int hi) {
        return new Span(lo, hi, 0);
    }

    public boolean isDummy() {
        return equals(DUMMY);
    }
}
