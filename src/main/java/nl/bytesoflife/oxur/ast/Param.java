package nl.bytesoflife.oxur.ast;

import java.util.List;

public record Param(List<Attribute> attrs, Ty ty, Pat pat, NodeId id, Span span, boolean isPlaceholder) {

    public Param {
        attrs = List.copyOf(attrs);
    }
}
