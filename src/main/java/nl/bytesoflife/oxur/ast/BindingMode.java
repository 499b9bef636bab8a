package nl.bytesoflife.oxur.ast;

public record BindingMode(boolean byRef, Mutability mutability) {

    public static final BindingMode BY_VALUE = new BindingMode(false, Mutability.NOT);
}
