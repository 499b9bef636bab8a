package nl.bytesoflife.oxur.cli;

import nl.bytesoflife.oxur.builder.AstBuilder;
import nl.bytesoflife.oxur.builder.BuilderOptions;
import nl.bytesoflife.oxur.builder.IdPolicy;
import nl.bytesoflife.oxur.lexer.LexException;
import nl.bytesoflife.oxur.parser.ParseException;
import nl.bytesoflife.oxur.parser.SExpressionParser;
import nl.bytesoflife.oxur.parser.SExpressionPrinter;
import nl.bytesoflife.oxur.parser.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Command-line front end: reads S-expression text from a file or stdin, pretty-prints it
 * and optionally builds it into a typed AST node.
 *
 * <pre>
 * usage: SExpressionTool [--indent N] [--all] [--build NODE] [--strict] [--id-policy POLICY] [FILE|-]
 * </pre>
 */
public class SExpressionTool {

    private static final Logger log = LoggerFactory.getLogger(SExpressionTool.class);

    static final String USAGE = "usage: SExpressionTool [--indent N] [--all] [--build NODE] [--strict] "
            + "[--id-policy high_water_mark|forbid_mixing|unchecked] [FILE|-]";

    private static final Map<String, BiFunction<AstBuilder, SNode, Object>> BUILDERS = Map.of(
            "crate", AstBuilder::buildCrate,
            "item", AstBuilder::buildItem,
            "fn", AstBuilder::buildFn,
            "block", AstBuilder::buildBlock,
            "stmt", AstBuilder::buildStmt,
            "expr", AstBuilder::buildExpr,
            "path", AstBuilder::buildPath,
            "ty", AstBuilder::buildTy
    );

    private int indent = 2;
    private boolean all;
    private String build;
    private String input;
    private final BuilderOptions options = new BuilderOptions();

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Runs the tool and returns the process exit code: 0 on success, 1 on a read or
     * build error, 2 on bad arguments.
     */
    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        SExpressionTool tool = new SExpressionTool();
        try {
            tool.parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        try {
            String text = tool.readInput(stdin);
            tool.process(text, out);
            return 0;
        } catch (IOException e) {
            log.error("Cannot read {}", tool.input, e);
            err.println("error: cannot read " + tool.input + ": " + e.getMessage());
            return 1;
        } catch (ParseException | LexException | IllegalStateException e) {
            log.debug("Processing failed", e);
            err.println("error: " + e.getMessage());
            return 1;
        }
    }

    private void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--indent" -> indent = parseIndent(value(args, ++i, arg));
                case "--all" -> all = true;
                case "--strict" -> options.setStrictModifiers(true);
                case "--build" -> {
                    build = value(args, ++i, arg).toLowerCase(Locale.ROOT);
                    if (!BUILDERS.containsKey(build)) {
                        throw new IllegalArgumentException("Unknown node type: " + build
                                + " (expected one of " + String.join(", ", BUILDERS.keySet().stream().sorted().toList()) + ")");
                    }
                }
                case "--id-policy" -> options.setIdPolicy(parseIdPolicy(value(args, ++i, arg)));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (input != null) {
                        throw new IllegalArgumentException("Only one input may be given");
                    }
                    input = arg;
                }
            }
        }
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parseIndent(String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                throw new IllegalArgumentException("Indent must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Indent must be a number: " + value);
        }
    }

    private static IdPolicy parseIdPolicy(String value) {
        try {
            return IdPolicy.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown id policy: " + value);
        }
    }

    private String readInput(InputStream stdin) throws IOException {
        if (input == null || input.equals("-")) {
            input = "<stdin>";
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input), StandardCharsets.UTF_8);
    }

    private void process(String text, PrintStream out) {
        SExpressionParser parser = new SExpressionParser();
        List<SNode> nodes = all ? parser.parseAll(text) : List.of(parser.parse(text));
        log.info("Read {} expression(s) from {}", nodes.size(), input);

        SExpressionPrinter printer = new SExpressionPrinter(indent);
        AstBuilder builder = build != null ? new AstBuilder(options) : null;
        for (SNode node : nodes) {
            out.println(printer.print(node));
            if (builder != null) {
                Object built = BUILDERS.get(build).apply(builder, node);
                out.println(built);
            }
        }
    }
}
