package nl.bytesoflife.oxur.ast;

/**
 * Unparsed tokens, kept as the source text they came from.
 */
public sealed interface TokenStream permits TokenStream.Empty, TokenStream.Source {

    TokenStream EMPTY = new Empty();

    record Empty() implements TokenStream {
    }

    record Source(String text) implements TokenStream {
    }
}
