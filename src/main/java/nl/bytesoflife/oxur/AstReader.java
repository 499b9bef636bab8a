package nl.bytesoflife.oxur;

import nl.bytesoflife.oxur.ast.Crate;
import nl.bytesoflife.oxur.ast.Expr;
import nl.bytesoflife.oxur.ast.Item;
import nl.bytesoflife.oxur.ast.Stmt;
import nl.bytesoflife.oxur.builder.AstBuilder;
import nl.bytesoflife.oxur.builder.BuilderOptions;
import nl.bytesoflife.oxur.parser.SExpressionParser;
import nl.bytesoflife.oxur.parser.SNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads typed AST nodes straight from S-expression text.
 * Each call parses with a new parser and builds with a new {@link AstBuilder},
 * so ids start at 0 for every input.
 */
public class AstReader {

    private final BuilderOptions options;

    public AstReader() {
        this(new BuilderOptions());
    }

    public AstReader(BuilderOptions options) {
        this.options = options;
    }

    public Crate readCrate(String text) {
        return newBuilder().buildCrate(parse(text));
    }

    public Crate readCrate(InputStream is) throws IOException {
        return readCrate(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }

    public Item readItem(String text) {
        return newBuilder().buildItem(parse(text));
    }

    public Stmt readStmt(String text) {
        return newBuilder().buildStmt(parse(text));
    }

    public Expr readExpr(String text) {
        return newBuilder().buildExpr(parse(text));
    }

    private SNode parse(String text) {
        return new SExpressionParser().parse(text);
    }

    private AstBuilder newBuilder() {
        return new AstBuilder(options);
    }
}
