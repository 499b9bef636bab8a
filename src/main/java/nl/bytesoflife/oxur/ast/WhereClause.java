package nl.bytesoflife.oxur.ast;

import java.util.List;

public record WhereClause(boolean hasWhereToken, List<WherePredicate> predicates, Span span) {

    public WhereClause {
        predicates = List.copyOf(predicates);
    }

    public static WhereClause empty() {
        return new WhereClause(false, List.of(), Span.DUMMY);
    }
}
