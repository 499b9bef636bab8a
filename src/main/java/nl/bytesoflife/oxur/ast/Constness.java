package nl.bytesoflife.oxur.ast;

public enum Constness {
    CONST("Const"),
    NOT_CONST("NotConst");

    private final String tag;

    Constness(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Constness fromTag(String tag) {
        for (Constness c : values()) {
            if (c.tag.equals(tag)) return c;
        }
        return null;
    }
}
