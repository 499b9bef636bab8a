package nl.bytesoflife.oxur.ast;

public enum Defaultness {
    FINAL("Final"),
    DEFAULT("Default");

    private final String tag;

    Defaultness(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Defaultness fromTag(String tag) {
        for (Defaultness d : values()) {
            if (d.tag.equals(tag)) return d;
        }
        return null;
    }
}
