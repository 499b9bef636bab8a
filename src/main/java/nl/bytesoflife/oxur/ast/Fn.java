package nl.bytesoflife.oxur.ast;

/**
 * A function item. {@code body} is null for a bodiless declaration.
 */
public record Fn(Defaultness defaultness, FnSig sig, Generics generics, Block body) implements ItemKind {

    public boolean hasBody() {
        return body != null;
    }
}
