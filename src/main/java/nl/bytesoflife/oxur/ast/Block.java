package nl.bytesoflife.oxur.ast;

import java.util.List;

public record Block(List<Stmt> stmts, NodeId id, BlockCheckMode rules, Span span) {

    public Block {
        stmts = List.copyOf(stmts);
    }

    public Block(List<Stmt> stmts, NodeId id, Span span) {
        this(stmts, id, BlockCheckMode.DEFAULT, span);
    }
}
