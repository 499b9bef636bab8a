package nl.bytesoflife.oxur.ast;

public enum Safety {
    DEFAULT("Default"),
    SAFE("Safe"),
    UNSAFE("Unsafe");

    private final String tag;

    Safety(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Safety fromTag(String tag) {
        for (Safety s : values()) {
            if (s.tag.equals(tag)) return s;
        }
        return null;
    }
}
