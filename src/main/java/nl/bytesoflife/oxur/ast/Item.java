package nl.bytesoflife.oxur.ast;

import java.util.List;

/**
 * A top-level declaration.
 */
public record Item(List<Attribute> attrs, NodeId id, Span span, Visibility vis, Ident ident, ItemKind kind) {

    public Item {
        attrs = List.copyOf(attrs);
    }
}
