package nl.bytesoflife.oxur.ast;

/**
 * A macro invocation such as {@code println!("hi")}.
 */
public record MacCall(Path path, MacArgs args) implements ExprKind {
}
