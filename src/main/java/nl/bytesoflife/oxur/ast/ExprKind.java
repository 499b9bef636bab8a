package nl.bytesoflife.oxur.ast;

/**
 * Expression forms. The builder currently produces {@link MacCall} only;
 * literals and paths are here for code that constructs trees directly.
 */
public sealed interface ExprKind permits MacCall, Lit, ExprKind.PathExpr {

    record PathExpr(Path path) implements ExprKind {
    }
}
