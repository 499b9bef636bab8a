package nl.bytesoflife.oxur.ast;

public enum Mutability {
    MUT("Mut"),
    NOT("Not");

    private final String tag;

    Mutability(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Mutability fromTag(String tag) {
        for (Mutability m : values()) {
            if (m.tag.equals(tag)) return m;
        }
        return null;
    }
}
