package nl.bytesoflife.oxur.ast;

public record Ty(NodeId id, TyKind kind, Span span) {
}
