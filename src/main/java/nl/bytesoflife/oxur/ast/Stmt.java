package nl.bytesoflife.oxur.ast;

public record Stmt(NodeId id, StmtKind kind, Span span) {
}
