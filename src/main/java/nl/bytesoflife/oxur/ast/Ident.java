package nl.bytesoflife.oxur.ast;

public record Ident(String name, Span span) {

    public static Ident of(String name) {
        return new Ident(name, Span.DUMMY);
    }

    @Override
    public String toString() {
        return name;
    }
}
