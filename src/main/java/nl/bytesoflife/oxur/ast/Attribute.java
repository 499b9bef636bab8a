package nl.bytesoflife.oxur.ast;

/**
 * An attribute such as {@code #[inline]}; its arguments are kept as raw tokens.
 */
public record Attribute(AttrStyle style, Path path, TokenStream tokens, NodeId id, Span span) {
}
