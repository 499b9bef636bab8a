package nl.bytesoflife.oxur.ast;

/**
 * Shape of a pattern. Only identifier bindings ({@code x}, {@code mut x}, {@code ref x @ sub}) exist so far.
 */
public sealed interface PatKind permits PatKind.IdentPat {

    /** {@code sub} is the pattern after {@code @}, or null. */
    record IdentPat(BindingMode bindingMode, Ident ident, Pat sub) implements PatKind {
    }
}
