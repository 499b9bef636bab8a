package nl.bytesoflife.oxur.ast;

/**
 * {@code #[outer]} versus {@code #![inner]} attributes.
 */
public enum AttrStyle {
    OUTER("Outer"),
    INNER("Inner");

    private final String tag;

    AttrStyle(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static AttrStyle fromTag(String tag) {
        for (AttrStyle style : values()) {
            if (style.tag.equals(tag)) return style;
        }
        return null;
    }
}
