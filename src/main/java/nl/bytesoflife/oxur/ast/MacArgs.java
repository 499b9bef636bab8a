package nl.bytesoflife.oxur.ast;

public sealed interface MacArgs permits MacArgs.Empty, MacArgs.Delimited, MacArgs.Eq {

    MacArgs EMPTY = new Empty();

    /** {@code foo!} with no arguments. */
    record Empty() implements MacArgs {
    }

    /** {@code foo!(...)}, {@code foo![...]} or {@code foo!{...}}. */
    record Delimited(DelSpan dspan, Delimiter delim, TokenStream tokens) implements MacArgs {
    }

    /** {@code #[attr = value]} style arguments. */
    record Eq(Span eqSpan, TokenStream tokens) implements MacArgs {
    }
}
