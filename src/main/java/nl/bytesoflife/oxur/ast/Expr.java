package nl.bytesoflife.oxur.ast;

public record Expr(NodeId id, ExprKind kind, Span span) {
}
