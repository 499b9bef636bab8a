package nl.bytesoflife.oxur.builder;

import nl.bytesoflife.oxur.ast.*;
import nl.bytesoflife.oxur.lexer.Position;
import nl.bytesoflife.oxur.parser.ParseException;
import nl.bytesoflife.oxur.parser.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static nl.bytesoflife.oxur.builder.SExpressions.*;

/**
 * Builds typed AST nodes from S-expression trees.
 *
 * <p>Every node is written as a list whose first element is the node's tag, followed by
 * {@code :keyword value} pairs, for example
 * {@code (Ident :name "main" :span (Span :lo 3 :hi 7))}. Required fields that are missing,
 * a wrong tag, or an unrecognized variant abort the build with a {@link ParseException};
 * optional fields take their documented defaults (spans default to {@link Span#DUMMY}).
 *
 * <p>A builder owns one id counter shared by all {@code build*} calls made through it.
 * Instances are not thread-safe; use one builder per input.
 */
public class AstBuilder {

    private static final Logger log = LoggerFactory.getLogger(AstBuilder.class);

    private static final Ident PLACEHOLDER_TYPE = Ident.of("i32");
    private static final Ident PLACEHOLDER_PARAM = Ident.of("param");

    private final BuilderOptions options;
    private int nextId;
    private boolean sawExplicitId;
    private boolean sawGeneratedId;

    public AstBuilder() {
        this(new BuilderOptions());
    }

    public AstBuilder(BuilderOptions options) {
        this.options = options;
    }

    /**
     * Hands out the next generated id: 0, 1, 2, ... for a fresh builder.
     */
    public NodeId nextId() {
        if (options.getIdPolicy() == IdPolicy.FORBID_MIXING && sawExplicitId) {
            throw new IllegalStateException("Cannot generate ids after explicit :id values were used");
        }
        if (nextId == NodeId.DUMMY.value()) {
            throw new IllegalStateException("Node id space exhausted");
        }
        sawGeneratedId = true;
        return new NodeId(nextId++);
    }

    // --- Crate ---

    public Crate buildCrate(SNode node) {
        Kwargs kw = open(node, "Crate");

        List<Attribute> attrs = buildAttrs(kw);
        List<Item> items = buildEach(kw.require("items"), this::buildItem);
        ModSpans spans = kw.has("spans") ? buildModSpans(kw.get("spans")) : ModSpans.DUMMY;
        boolean placeholder = kw.has("is-placeholder") && expectBoolean(kw.get("is-placeholder"));
        NodeId id = resolveId(kw);

        log.debug("Built crate {} with {} items", id.value(), items.size());
        return new Crate(attrs, items, spans, id, placeholder);
    }

    public ModSpans buildModSpans(SNode node) {
        Kwargs kw = open(node, "ModSpans");
        return new ModSpans(span(kw, "inner-span"), span(kw, "inject-use-span"));
    }

    public Attribute buildAttribute(SNode node) {
        Kwargs kw = open(node, "Attribute");

        AttrStyle style = AttrStyle.OUTER;
        if (kw.has("style")) {
            SNode.SSymbol sym = expectSymbol(kw.get("style"));
            style = AttrStyle.fromTag(sym.value());
            if (style == null) {
                throw ParseException.expected("Outer or Inner", sym.value(), sym.position());
            }
        }
        Path path = buildPath(kw.require("path"));
        TokenStream tokens = kw.has("tokens") ? buildTokenStream(kw.get("tokens")) : TokenStream.EMPTY;
        Span span = span(kw, "span");
        return new Attribute(style, path, tokens, resolveId(kw), span);
    }

    // --- Items ---

    public Item buildItem(SNode node) {
        Kwargs kw = open(node, "Item");

        List<Attribute> attrs = buildAttrs(kw);
        Visibility vis = kw.has("vis") ? buildVisibility(kw.get("vis")) : Visibility.INHERITED;
        Ident ident = buildIdent(kw.require("ident"));
        ItemKind kind = buildItemKind(kw.require("kind"));
        Span span = span(kw, "span");
        NodeId id = resolveId(kw);

        return new Item(attrs, id, span, vis, ident, kind);
    }

    public Visibility buildVisibility(SNode node) {
        SNode.SSymbol tag = head(expectList(node), "Public or Inherited");
        Visibility vis = Visibility.fromTag(tag.value());
        if (vis == null) {
            throw ParseException.expected("Public or Inherited", tag.value(), tag.position());
        }
        return vis;
    }

    public Ident buildIdent(SNode node) {
        Kwargs kw = open(node, "Ident");
        String name = expectString(kw.require("name"));
        return new Ident(name, span(kw, "span"));
    }

    public ItemKind buildItemKind(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "Fn");
        if ("Fn".equals(tag.value())) {
            return buildFn(list);
        }
        throw ParseException.expected("Fn (the only supported item kind)", tag.value(), tag.position());
    }

    public Fn buildFn(SNode node) {
        Kwargs kw = open(node, "Fn");

        Defaultness defaultness = Defaultness.FINAL;
        if (kw.has("defaultness")) {
            SNode.SSymbol sym = expectSymbol(kw.get("defaultness"));
            defaultness = lenient(Defaultness.fromTag(sym.value()), Defaultness.FINAL, "Final or Default", sym);
        }
        FnSig sig = buildFnSig(kw.require("sig"));
        Generics generics = kw.has("generics") ? buildGenerics(kw.get("generics")) : Generics.empty();
        Block body = optional(kw, "body", this::buildBlock);

        return new Fn(defaultness, sig, generics, body);
    }

    public FnSig buildFnSig(SNode node) {
        Kwargs kw = open(node, "FnSig");
        FnHeader header = kw.has("header") ? buildFnHeader(kw.get("header")) : FnHeader.DEFAULT;
        FnDecl decl = kw.has("decl") ? buildFnDecl(kw.get("decl")) : FnDecl.empty();
        return new FnSig(header, decl, span(kw, "span"));
    }

    public FnHeader buildFnHeader(SNode node) {
        Kwargs kw = open(node, "FnHeader");

        Safety safety = Safety.DEFAULT;
        if (kw.has("safety")) {
            SNode.SSymbol sym = expectSymbol(kw.get("safety"));
            safety = lenient(Safety.fromTag(sym.value()), Safety.DEFAULT, "Default, Safe or Unsafe", sym);
        }
        Constness constness = Constness.NOT_CONST;
        if (kw.has("constness")) {
            SNode.SSymbol sym = expectSymbol(kw.get("constness"));
            constness = lenient(Constness.fromTag(sym.value()), Constness.NOT_CONST, "Const or NotConst", sym);
        }
        Extern ext = kw.has("ext") ? buildExtern(kw.get("ext")) : Extern.NONE;

        return new FnHeader(safety, constness, ext);
    }

    public Extern buildExtern(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "None or Explicit");
        switch (tag.value()) {
            case "None":
                Kwargs.of("None", list);
                return Extern.NONE;
            case "Explicit":
                Kwargs kw = Kwargs.of("Explicit", list);
                return new Extern.Explicit(expectString(kw.require("abi")));
            default:
                throw ParseException.expected("None or Explicit", tag.value(), tag.position());
        }
    }

    public FnDecl buildFnDecl(SNode node) {
        Kwargs kw = open(node, "FnDecl");
        List<Param> inputs = kw.has("inputs") ? buildEach(kw.get("inputs"), this::buildParam) : List.of();
        FnRetTy output = kw.has("output") ? buildFnRetTy(kw.get("output")) : new FnRetTy.DefaultReturn(Span.DUMMY);
        return new FnDecl(inputs, output);
    }

    /**
     * Builds a parameter. {@code :ty} and {@code :pat} may be omitted, in which case the
     * parameter gets an {@code i32} type and a {@code param} binding, so inputs that only
     * list how many parameters a function takes still build.
     */
    public Param buildParam(SNode node) {
        Kwargs kw = open(node, "Param");

        List<Attribute> attrs = buildAttrs(kw);
        Ty ty = kw.has("ty")
                ? buildTy(kw.get("ty"))
                : new Ty(generatedId(kw), new TyKind.PathType(Path.from(PLACEHOLDER_TYPE)), Span.DUMMY);
        Pat pat = kw.has("pat")
                ? buildPat(kw.get("pat"))
                : new Pat(generatedId(kw), new PatKind.IdentPat(BindingMode.BY_VALUE, PLACEHOLDER_PARAM, null), Span.DUMMY);
        boolean placeholder = kw.has("is-placeholder") && expectBoolean(kw.get("is-placeholder"));
        Span span = span(kw, "span");
        NodeId id = resolveId(kw);

        return new Param(attrs, ty, pat, id, span, placeholder);
    }

    public FnRetTy buildFnRetTy(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "Default or Ty");
        switch (tag.value()) {
            case "Default":
                Kwargs kw = Kwargs.of("Default", list);
                return new FnRetTy.DefaultReturn(span(kw, "span"));
            case "Ty":
                return new FnRetTy.ExplicitReturn(buildTy(list));
            default:
                throw ParseException.expected("Default or Ty", tag.value(), tag.position());
        }
    }

    // --- Types and patterns ---

    public Ty buildTy(SNode node) {
        Kwargs kw = open(node, "Ty");
        TyKind kind = buildTyKind(kw.require("kind"));
        Span span = span(kw, "span");
        return new Ty(resolveId(kw), kind, span);
    }

    private TyKind buildTyKind(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "Path");
        if ("Path".equals(tag.value())) {
            return new TyKind.PathType(buildPath(list));
        }
        throw ParseException.expected("Path (the only supported type kind)", tag.value(), tag.position());
    }

    public Pat buildPat(SNode node) {
        Kwargs kw = open(node, "Pat");
        PatKind kind = buildPatKind(kw.require("kind"));
        Span span = span(kw, "span");
        return new Pat(resolveId(kw), kind, span);
    }

    private PatKind buildPatKind(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "Ident");
        if (!"Ident".equals(tag.value())) {
            throw ParseException.expected("Ident (the only supported pattern kind)", tag.value(), tag.position());
        }
        Kwargs kw = Kwargs.of("Ident", list);

        boolean byRef = kw.has("by-ref") && expectBoolean(kw.get("by-ref"));
        Mutability mutability = Mutability.NOT;
        if (kw.has("mutability")) {
            SNode.SSymbol sym = expectSymbol(kw.get("mutability"));
            mutability = Mutability.fromTag(sym.value());
            if (mutability == null) {
                throw ParseException.expected("Mut or Not", sym.value(), sym.position());
            }
        }
        Ident ident = buildIdent(kw.require("ident"));
        Pat sub = optional(kw, "sub", this::buildPat);

        return new PatKind.IdentPat(new BindingMode(byRef, mutability), ident, sub);
    }

    // --- Generics ---

    public Generics buildGenerics(SNode node) {
        Kwargs kw = open(node, "Generics");
        List<GenericParam> params = kw.has("params") ? buildEach(kw.get("params"), this::buildGenericParam) : List.of();
        WhereClause where = kw.has("where-clause") ? buildWhereClause(kw.get("where-clause")) : WhereClause.empty();
        return new Generics(params, where, span(kw, "span"));
    }

    public GenericParam buildGenericParam(SNode node) {
        Kwargs kw = open(node, "GenericParam");
        Ident ident = buildIdent(kw.require("ident"));
        Span span = span(kw, "span");
        return new GenericParam(ident, resolveId(kw), span);
    }

    public WhereClause buildWhereClause(SNode node) {
        Kwargs kw = open(node, "WhereClause");
        boolean hasWhereToken = kw.has("has-where-token") && expectBoolean(kw.get("has-where-token"));
        List<WherePredicate> predicates = kw.has("predicates")
                ? buildEach(kw.get("predicates"), this::buildWherePredicate)
                : List.of();
        return new WhereClause(hasWhereToken, predicates, span(kw, "span"));
    }

    public WherePredicate buildWherePredicate(SNode node) {
        Kwargs kw = open(node, "WherePredicate");
        Ty boundedTy = buildTy(kw.require("bounded-ty"));
        List<Path> bounds = kw.has("bounds") ? buildEach(kw.get("bounds"), this::buildPath) : List.of();
        return new WherePredicate(boundedTy, bounds, span(kw, "span"));
    }

    // --- Blocks and statements ---

    public Block buildBlock(SNode node) {
        Kwargs kw = open(node, "Block");

        List<Stmt> stmts = kw.has("stmts") ? buildEach(kw.get("stmts"), this::buildStmt) : List.of();
        BlockCheckMode rules = BlockCheckMode.DEFAULT;
        if (kw.has("rules")) {
            SNode.SSymbol sym = expectSymbol(kw.get("rules"));
            rules = BlockCheckMode.fromTag(sym.value());
            if (rules == null) {
                throw ParseException.expected("Default or Unsafe", sym.value(), sym.position());
            }
        }
        Span span = span(kw, "span");
        NodeId id = resolveId(kw);

        return new Block(stmts, id, rules, span);
    }

    public Stmt buildStmt(SNode node) {
        Kwargs kw = open(node, "Stmt");
        StmtKind kind = buildStmtKind(kw.require("kind"));
        Span span = span(kw, "span");
        return new Stmt(resolveId(kw), kind, span);
    }

    private StmtKind buildStmtKind(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "Semi, Expr or Empty");
        switch (tag.value()) {
            case "Empty":
                Kwargs.of("Empty", list);
                return new StmtKind.Empty();
            case "Semi":
                return new StmtKind.Semi(buildExpr(stmtExpr(list)));
            case "Expr":
                return new StmtKind.ExprStmt(buildExpr(stmtExpr(list)));
            default:
                throw ParseException.expected("Semi, Expr or Empty", tag.value(), tag.position());
        }
    }

    /**
     * The expression of a {@code Semi}/{@code Expr} statement, written either as
     * {@code (Semi :expr E)} or positionally as {@code (Semi E)}.
     */
    private SNode stmtExpr(SNode.SList list) {
        if (list.size() == 2 && !(list.get(1) instanceof SNode.SKeyword)) {
            return list.get(1);
        }
        String tag = ((SNode.SSymbol) list.get(0)).value();
        return Kwargs.of(tag, list).require("expr");
    }

    // --- Expressions ---

    public Expr buildExpr(SNode node) {
        Kwargs kw = open(node, "Expr");
        ExprKind kind = buildExprKind(kw.require("kind"));
        Span span = span(kw, "span");
        return new Expr(resolveId(kw), kind, span);
    }

    private ExprKind buildExprKind(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "MacCall");
        if ("MacCall".equals(tag.value())) {
            return buildMacCall(list);
        }
        // Lit and Path exist in the model but are not read from input yet
        throw ParseException.expected("MacCall (the only supported expression kind)", tag.value(), tag.position());
    }

    public MacCall buildMacCall(SNode node) {
        Kwargs kw = open(node, "MacCall");
        Path path = buildPath(kw.require("path"));
        MacArgs args = kw.has("args") ? buildMacArgs(kw.get("args")) : MacArgs.EMPTY;
        return new MacCall(path, args);
    }

    public MacArgs buildMacArgs(SNode node) {
        SNode.SList list = expectList(node);
        SNode.SSymbol tag = head(list, "Empty, Delimited or Eq");
        switch (tag.value()) {
            case "Empty": {
                Kwargs.of("Empty", list);
                return MacArgs.EMPTY;
            }
            case "Delimited": {
                Kwargs kw = Kwargs.of("Delimited", list);
                DelSpan dspan = kw.has("dspan") ? buildDelSpan(kw.get("dspan")) : DelSpan.DUMMY;
                Delimiter delim = kw.has("delim") ? buildDelimiter(kw.get("delim")) : Delimiter.PAREN;
                TokenStream tokens = kw.has("tokens") ? buildTokenStream(kw.get("tokens")) : TokenStream.EMPTY;
                return new MacArgs.Delimited(dspan, delim, tokens);
            }
            case "Eq": {
                Kwargs kw = Kwargs.of("Eq", list);
                TokenStream tokens = kw.has("tokens") ? buildTokenStream(kw.get("tokens")) : TokenStream.EMPTY;
                return new MacArgs.Eq(span(kw, "eq-span"), tokens);
            }
            default:
                throw ParseException.expected("Empty, Delimited or Eq", tag.value(), tag.position());
        }
    }

    public DelSpan buildDelSpan(SNode node) {
        Kwargs kw = open(node, "DelSpan");
        return new DelSpan(span(kw, "open"), span(kw, "close"));
    }

    public Delimiter buildDelimiter(SNode node) {
        SNode.SSymbol sym = expectSymbol(node);
        Delimiter delim = Delimiter.fromTag(sym.value());
        if (delim == null) {
            throw ParseException.expected("Paren, Brace, Bracket or Invisible", sym.value(), sym.position());
        }
        return delim;
    }

    public TokenStream buildTokenStream(SNode node) {
        Kwargs kw = open(node, "TokenStream");
        return kw.has("source") ? new TokenStream.Source(expectString(kw.get("source"))) : TokenStream.EMPTY;
    }

    // --- Paths ---

    public Path buildPath(SNode node) {
        Kwargs kw = open(node, "Path");
        List<PathSegment> segments = kw.has("segments")
                ? buildEach(kw.get("segments"), this::buildPathSegment)
                : List.of();
        return new Path(span(kw, "span"), segments);
    }

    public PathSegment buildPathSegment(SNode node) {
        Kwargs kw = open(node, "PathSegment");
        Ident ident = buildIdent(kw.require("ident"));
        GenericArgs args = optional(kw, "args", this::buildGenericArgs);
        return new PathSegment(ident, resolveId(kw), args);
    }

    public GenericArgs buildGenericArgs(SNode node) {
        Kwargs kw = open(node, "GenericArgs");
        List<Ty> args = kw.has("args") ? buildEach(kw.get("args"), this::buildTy) : List.of();
        return new GenericArgs(args, span(kw, "span"));
    }

    // --- Spans and ids ---

    /**
     * Builds {@code (Span :lo L :hi H :ctxt C)}; missing parts are 0 and {@code ()} is {@link Span#DUMMY}.
     */
    public Span buildSpan(SNode node) {
        SNode.SList list = expectList(node);
        if (list.isEmpty()) {
            return Span.DUMMY;
        }
        Kwargs kw = open(list, "Span");
        int lo = kw.has("lo") ? expectIndex(kw.get("lo"), Integer.MAX_VALUE, "span offset") : 0;
        int hi = kw.has("hi") ? expectIndex(kw.get("hi"), Integer.MAX_VALUE, "span offset") : 0;
        int ctxt = kw.has("ctxt") ? expectIndex(kw.get("ctxt"), Integer.MAX_VALUE, "syntax context") : 0;
        return new Span(lo, hi, ctxt);
    }

    private Span span(Kwargs kw, String name) {
        return kw.has(name) ? buildSpan(kw.get(name)) : Span.DUMMY;
    }

    private NodeId resolveId(Kwargs kw) {
        if (!kw.has("id")) {
            return generatedId(kw);
        }

        SNode idNode = kw.get("id");
        int value = expectIndex(idNode, NodeId.DUMMY.value(), "node id");
        switch (options.getIdPolicy()) {
            case FORBID_MIXING -> {
                if (sawGeneratedId) {
                    throw ParseException.expected("no :id field (this builder generates ids)",
                            ":id " + value, idNode.position());
                }
            }
            case HIGH_WATER_MARK -> {
                if (value >= nextId) {
                    log.debug("Explicit id {} at {} moves next generated id from {} to {}",
                            value, idNode.position(), nextId, value + 1);
                    nextId = value + 1;
                }
            }
            case UNCHECKED -> {
            }
        }
        sawExplicitId = true;
        return new NodeId(value);
    }

    private NodeId generatedId(Kwargs kw) {
        if (options.getIdPolicy() == IdPolicy.FORBID_MIXING && sawExplicitId) {
            throw ParseException.expected(":id field in " + kw.tag() + " (this builder uses explicit ids)",
                    "missing field", kw.position());
        }
        if (nextId == NodeId.DUMMY.value()) {
            throw ParseException.expected("a free node id for " + kw.tag(), "exhausted id space", kw.position());
        }
        return nextId();
    }

    // --- Helpers ---

    private List<Attribute> buildAttrs(Kwargs kw) {
        return kw.has("attrs") ? buildEach(kw.get("attrs"), this::buildAttribute) : List.of();
    }

    private <T> List<T> buildEach(SNode node, Function<SNode, T> builder) {
        SNode.SList list = expectList(node);
        List<T> result = new ArrayList<>(list.size());
        for (SNode child : list.children()) {
            result.add(builder.apply(child));
        }
        return result;
    }

    /**
     * An Option-typed field: absent or {@code nil} gives null.
     */
    private <T> T optional(Kwargs kw, String name, Function<SNode, T> builder) {
        SNode value = kw.get(name);
        if (value == null || isNil(value)) {
            return null;
        }
        return builder.apply(value);
    }

    /**
     * Modifier symbols fall back to their default on an unknown tag unless strict modifiers are enabled.
     */
    private <E extends Enum<E>> E lenient(E parsed, E fallback, String expected, SNode.SSymbol sym) {
        if (parsed != null) {
            return parsed;
        }
        if (options.isStrictModifiers()) {
            throw ParseException.expected(expected, sym.value(), sym.position());
        }
        Position pos = sym.position();
        log.warn("Unrecognized modifier '{}' at {}, expected {}; using {}", sym.value(), pos, expected, fallback);
        return fallback;
    }
}
