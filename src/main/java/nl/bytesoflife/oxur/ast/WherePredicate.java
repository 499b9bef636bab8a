package nl.bytesoflife.oxur.ast;

import java.util.List;

/**
 * {@code boundedTy: Bound1 + Bound2}.
 */
public record WherePredicate(Ty boundedTy, List<Path> bounds, Span span) {

    public WherePredicate {
        bounds = List.copyOf(bounds);
    }
}
