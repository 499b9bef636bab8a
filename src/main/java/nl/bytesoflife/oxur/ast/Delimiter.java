package nl.bytesoflife.oxur.ast;

public enum Delimiter {
    PAREN("Paren"),
    BRACE("Brace"),
    BRACKET("Bracket"),
    INVISIBLE("Invisible");

    private final String tag;

    Delimiter(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Delimiter fromTag(String tag) {
        for (Delimiter d : values()) {
            if (d.tag.equals(tag)) return d;
        }
        return null;
    }
}
