package nl.bytesoflife.oxur.ast;

public record Lit(LitKind kind, Span span) implements ExprKind {
}
