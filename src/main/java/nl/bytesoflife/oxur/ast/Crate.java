package nl.bytesoflife.oxur.ast;

import java.util.List;

/**
 * Root of the typed AST.
 */
public record Crate(List<Attribute> attrs, List<Item> items, ModSpans spans, NodeId id, boolean isPlaceholder) {

    public Crate {
        attrs = List.copyOf(attrs);
        items = List.copyOf(items);
    }

    public Crate(List<Item> items, ModSpans spans, NodeId id) {
        this(List.of(), items, spans, id, false);
    }
}
