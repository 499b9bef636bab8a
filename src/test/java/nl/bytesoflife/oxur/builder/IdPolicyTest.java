package nl.bytesoflife.oxur.builder;

import nl.bytesoflife.oxur.ast.Block;
import nl.bytesoflife.oxur.ast.NodeId;
import nl.bytesoflife.oxur.parser.ParseException;
import nl.bytesoflife.oxur.parser.SExpressionParser;
import nl.bytesoflife.oxur.parser.SNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdPolicyTest {

    private final SExpressionParser parser = new SExpressionParser();

    private SNode sexp(String text) {
        return parser.parse(text);
    }

    private static AstBuilder builder(IdPolicy policy) {
        return new AstBuilder(new BuilderOptions().setIdPolicy(policy));
    }

    @Test
    void highWaterMarkIsDefault() {
        assertEquals(IdPolicy.HIGH_WATER_MARK, new BuilderOptions().getIdPolicy());
        assertFalse(new BuilderOptions().isStrictModifiers());
    }

    @Test
    void explicitIdRaisesNextGeneratedId() {
        AstBuilder builder = builder(IdPolicy.HIGH_WATER_MARK);
        Block block = builder.buildBlock(sexp("(Block :id 5)"));
        assertEquals(new NodeId(5), block.id());
        assertEquals(new NodeId(6), builder.nextId());
    }

    @Test
    void lowerExplicitIdLeavesCounterAlone() {
        AstBuilder builder = builder(IdPolicy.HIGH_WATER_MARK);
        builder.nextId();
        builder.nextId();
        builder.buildBlock(sexp("(Block :id 0)"));
        assertEquals(new NodeId(2), builder.nextId());
    }

    @Test
    void generatedIdsNeverCollideWithEarlierExplicitIds() {
        AstBuilder builder = builder(IdPolicy.HIGH_WATER_MARK);
        Block block = builder.buildBlock(sexp("(Block :stmts ((Stmt :kind (Empty) :id 3) (Stmt :kind (Empty))))"));
        assertEquals(new NodeId(3), block.stmts().get(0).id());
        assertEquals(new NodeId(4), block.stmts().get(1).id());
        assertEquals(new NodeId(5), block.id());
    }

    @Test
    void highestExplicitIdExhaustsGeneratedIds() {
        AstBuilder builder = builder(IdPolicy.HIGH_WATER_MARK);
        Block block = builder.buildBlock(sexp("(Block :stmts ((Stmt :kind (Empty) :id 2147483646)) :id 0)"));
        assertEquals(new NodeId(2147483646), block.stmts().get(0).id());

        ParseException e = assertThrows(ParseException.class, () -> builder.buildStmt(sexp("(Stmt :kind (Empty))")));
        assertEquals(ParseException.Kind.EXPECTED, e.getKind());
        assertEquals("a free node id for Stmt", e.getExpected());
        assertEquals("exhausted id space", e.getFound());
    }

    @Test
    void uncheckedKeepsCounting() {
        AstBuilder builder = builder(IdPolicy.UNCHECKED);
        builder.buildBlock(sexp("(Block :id 5)"));
        assertEquals(new NodeId(0), builder.nextId());
    }

    @Test
    void forbidMixingAcceptsAllExplicit() {
        AstBuilder builder = builder(IdPolicy.FORBID_MIXING);
        Block block = builder.buildBlock(sexp("(Block :stmts ((Stmt :kind (Empty) :id 0)) :id 1)"));
        assertEquals(new NodeId(1), block.id());
    }

    @Test
    void forbidMixingAcceptsAllGenerated() {
        AstBuilder builder = builder(IdPolicy.FORBID_MIXING);
        Block block = builder.buildBlock(sexp("(Block :stmts ((Stmt :kind (Empty))))"));
        assertEquals(new NodeId(1), block.id());
    }

    @Test
    void forbidMixingRejectsGeneratedAfterExplicit() {
        AstBuilder builder = builder(IdPolicy.FORBID_MIXING);
        builder.buildBlock(sexp("(Block :id 5)"));

        ParseException e = assertThrows(ParseException.class, () -> builder.buildBlock(sexp("(Block)")));
        assertEquals(":id field in Block (this builder uses explicit ids)", e.getExpected());
        assertThrows(IllegalStateException.class, builder::nextId);
    }

    @Test
    void forbidMixingRejectsExplicitAfterGenerated() {
        AstBuilder builder = builder(IdPolicy.FORBID_MIXING);
        builder.buildBlock(sexp("(Block)"));

        ParseException e = assertThrows(ParseException.class, () -> builder.buildBlock(sexp("(Block :id 3)")));
        assertEquals("no :id field (this builder generates ids)", e.getExpected());
        assertEquals(":id 3", e.getFound());
    }

    @Test
    void forbidMixingRejectsPlaceholderParamAfterExplicitIds() {
        AstBuilder builder = builder(IdPolicy.FORBID_MIXING);
        builder.buildBlock(sexp("(Block :id 0)"));
        ParseException e = assertThrows(ParseException.class, () -> builder.buildParam(sexp("(Param :id 1)")));
        assertEquals(":id field in Param (this builder uses explicit ids)", e.getExpected());
    }

    @Test
    void idMustBeNumber() {
        ParseException e = assertThrows(ParseException.class,
                () -> new AstBuilder().buildBlock(sexp("(Block :id five)")));
        assertEquals("number", e.getExpected());
    }

    @Test
    void nullPolicyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BuilderOptions().setIdPolicy(null));
    }
}
