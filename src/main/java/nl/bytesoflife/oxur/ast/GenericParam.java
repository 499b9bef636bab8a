package nl.bytesoflife.oxur.ast;

/**
 * A type parameter such as {@code T}. Bounds are expressed through the where clause.
 */
public record GenericParam(Ident ident, NodeId id, Span span) {
}
