package nl.bytesoflife.oxur.ast;

public enum Visibility {
    PUBLIC("Public"),
    INHERITED("Inherited");

    private final String tag;

    Visibility(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Visibility fromTag(String tag) {
        for (Visibility vis : values()) {
            if (vis.tag.equals(tag)) return vis;
        }
        return null;
    }
}
