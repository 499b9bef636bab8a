package nl.bytesoflife.oxur.ast;

/**
 * Statement forms: a lone {@code ;}, an expression followed by {@code ;},
 * or a trailing expression without one.
 */
public sealed interface StmtKind permits StmtKind.Empty, StmtKind.Semi, StmtKind.ExprStmt {

    record Empty() implements StmtKind {
    }

    record Semi(Expr expr) implements StmtKind {
    }

    record ExprStmt(Expr expr) implements StmtKind {
    }
}
