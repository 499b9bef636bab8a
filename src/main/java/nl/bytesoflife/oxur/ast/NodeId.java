package nl.bytesoflife.oxur.ast;

/**
 * Identifies an AST node within one builder's lifetime.
 */
public record NodeId(int value) {

    /** Placeholder for nodes synthesized outside a builder. */
    public static final NodeId DUMMY = new NodeId(Integer.MAX_VALUE);

    @Override
    public String toString() {
        return "NodeId(" + value + ")";
    }
}
