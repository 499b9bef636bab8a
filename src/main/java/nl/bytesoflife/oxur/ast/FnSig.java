package nl.bytesoflife.oxur.ast;

public record FnSig(FnHeader header, FnDecl decl, Span span) {
}
