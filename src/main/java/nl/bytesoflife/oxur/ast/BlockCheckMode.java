package nl.bytesoflife.oxur.ast;

/**
 * Whether a block is an {@code unsafe} block.
 */
public enum BlockCheckMode {
    DEFAULT("Default"),
    UNSAFE("Unsafe");

    private final String tag;

    BlockCheckMode(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static BlockCheckMode fromTag(String tag) {
        for (BlockCheckMode mode : values()) {
            if (mode.tag.equals(tag)) return mode;
        }
        return null;
    }
}
