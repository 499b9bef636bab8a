package nl.bytesoflife.oxur.ast;

import java.util.List;

public record Generics(List<GenericParam> params, WhereClause whereClause, Span span) {

    public Generics {
        params = List.copyOf(params);
    }

    public static Generics empty() {
        return new Generics(List.of(), WhereClause.empty(), Span.DUMMY);
    }

    public boolean isEmpty() {
        return params.isEmpty() && whereClause.predicates().isEmpty();
    }
}
