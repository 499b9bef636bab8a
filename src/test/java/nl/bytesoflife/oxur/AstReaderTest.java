package nl.bytesoflife.oxur;

import nl.bytesoflife.oxur.ast.*;
import nl.bytesoflife.oxur.builder.BuilderOptions;
import nl.bytesoflife.oxur.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AstReaderTest {

    private final AstReader reader = new AstReader();

    private static InputStream fixture(String name) {
        InputStream is = AstReaderTest.class.getResourceAsStream("/fixtures/" + name);
        assertNotNull(is, "missing fixture " + name);
        return is;
    }

    private static String fixtureText(String name) throws IOException {
        try (InputStream is = fixture(name)) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void readHelloWorldCrate() throws IOException {
        Crate crate;
        try (InputStream is = fixture("hello_world.sexp")) {
            crate = reader.readCrate(is);
        }

        assertTrue(crate.attrs().isEmpty());
        assertFalse(crate.isPlaceholder());
        assertEquals(ModSpans.of(Span.of(0, 41)), crate.spans());
        assertEquals(1, crate.items().size());

        Item main = crate.items().get(0);
        assertEquals("main", main.ident().name());
        assertEquals(Span.of(3, 7), main.ident().span());
        assertEquals(Visibility.INHERITED, main.vis());
        assertEquals(Span.of(0, 41), main.span());

        Fn fn = assertInstanceOf(Fn.class, main.kind());
        assertEquals(Defaultness.FINAL, fn.defaultness());
        assertEquals(FnHeader.DEFAULT, fn.sig().header());
        assertEquals(Span.of(0, 9), fn.sig().span());
        assertTrue(fn.sig().decl().inputs().isEmpty());
        assertTrue(fn.generics().isEmpty());
        assertFalse(fn.generics().whereClause().hasWhereToken());

        Block body = fn.body();
        assertNotNull(body);
        assertEquals(Span.of(10, 41), body.span());
        assertEquals(1, body.stmts().size());

        Stmt stmt = body.stmts().get(0);
        assertEquals(Span.of(12, 39), stmt.span());
        Expr expr = ((StmtKind.Semi) stmt.kind()).expr();
        assertEquals(Span.of(12, 38), expr.span());

        MacCall call = (MacCall) expr.kind();
        assertEquals("println", call.path().toString());
        MacArgs.Delimited args = (MacArgs.Delimited) call.args();
        assertEquals(Delimiter.PAREN, args.delim());
        assertEquals(new DelSpan(Span.of(21, 22), Span.of(37, 38)), args.dspan());
        assertEquals(new TokenStream.Source("\"Hello, world!\""), args.tokens());
    }

    @Test
    void helloWorldIdsAreUniqueAndBottomUp() throws IOException {
        Crate crate = reader.readCrate(fixtureText("hello_world.sexp"));
        Item main = crate.items().get(0);
        Block body = ((Fn) main.kind()).body();
        Stmt stmt = body.stmts().get(0);
        Expr expr = ((StmtKind.Semi) stmt.kind()).expr();
        PathSegment segment = ((MacCall) expr.kind()).path().segments().get(0);

        assertEquals(new NodeId(0), segment.id());
        assertEquals(new NodeId(1), expr.id());
        assertEquals(new NodeId(2), stmt.id());
        assertEquals(new NodeId(3), body.id());
        assertEquals(new NodeId(4), main.id());
        assertEquals(new NodeId(5), crate.id());
    }

    @Test
    void eachReadStartsAFreshIdCounter() throws IOException {
        String text = fixtureText("hello_world.sexp");
        assertEquals(reader.readCrate(text).id(), reader.readCrate(text).id());
    }

    @Test
    void readFunctionDeclaration() throws IOException {
        Item item = reader.readItem(fixtureText("add.sexp"));
        assertEquals(Visibility.PUBLIC, item.vis());
        assertEquals("add", item.ident().name());

        Fn fn = (Fn) item.kind();
        assertFalse(fn.hasBody());
        assertEquals(Safety.UNSAFE, fn.sig().header().safety());
        assertEquals(Constness.NOT_CONST, fn.sig().header().constness());
        assertEquals(new Extern.Explicit("C"), fn.sig().header().ext());

        FnDecl decl = fn.sig().decl();
        assertEquals(2, decl.inputs().size());

        Param a = decl.inputs().get(0);
        PatKind.IdentPat aPat = (PatKind.IdentPat) a.pat().kind();
        assertEquals("a", aPat.ident().name());
        assertEquals(Mutability.MUT, aPat.bindingMode().mutability());

        Param b = decl.inputs().get(1);
        Path vec = ((TyKind.PathType) b.ty().kind()).path();
        assertEquals("Vec", vec.toString());
        GenericArgs args = vec.segments().get(0).args();
        assertNotNull(args);
        assertEquals("T", ((TyKind.PathType) args.args().get(0).kind()).path().toString());
        assertEquals(Mutability.NOT, ((PatKind.IdentPat) b.pat().kind()).bindingMode().mutability());

        FnRetTy.ExplicitReturn ret = assertInstanceOf(FnRetTy.ExplicitReturn.class, decl.output());
        assertEquals("i32", ((TyKind.PathType) ret.ty().kind()).path().toString());

        Generics generics = fn.generics();
        assertEquals("T", generics.params().get(0).ident().name());
        assertTrue(generics.whereClause().hasWhereToken());
        assertEquals("Clone", generics.whereClause().predicates().get(0).bounds().get(0).toString());

        assertEquals(new NodeId(16), item.id());
    }

    @Test
    void strictOptionsFlowThrough() {
        AstReader strict = new AstReader(new BuilderOptions().setStrictModifiers(true));
        String text = "(Item :ident (Ident :name \"f\") :kind (Fn :defaultness Eventually :sig (FnSig)))";
        assertEquals(Defaultness.FINAL, ((Fn) reader.readItem(text).kind()).defaultness());
        assertThrows(ParseException.class, () -> strict.readItem(text));
    }

    @Test
    void readStatementAndExpression() {
        Stmt stmt = reader.readStmt("(Stmt :kind (Empty))");
        assertEquals(new StmtKind.Empty(), stmt.kind());

        Expr expr = reader.readExpr("(Expr :kind (MacCall :path (Path :segments ((PathSegment :ident (Ident :name \"dbg\"))))))");
        assertEquals("dbg", ((MacCall) expr.kind()).path().toString());
    }

    @Test
    void syntaxErrorsSurfaceAsParseException() {
        ParseException e = assertThrows(ParseException.class, () -> reader.readCrate("(Crate :items ("));
        assertEquals(ParseException.Kind.UNTERMINATED_LIST, e.getKind());
    }
}
