package nl.bytesoflife.oxur.ast;

/**
 * One {@code ::}-separated segment of a path. {@code args} is null when the segment has no generic arguments.
 */
public record PathSegment(Ident ident, NodeId id, GenericArgs args) {

    public static PathSegment from(Ident ident) {
        return new PathSegment(ident, NodeId.DUMMY, null);
    }
}
