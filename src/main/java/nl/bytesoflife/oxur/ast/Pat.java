package nl.bytesoflife.oxur.ast;

public record Pat(NodeId id, PatKind kind, Span span) {
}
