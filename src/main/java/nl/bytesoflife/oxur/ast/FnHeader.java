package nl.bytesoflife.oxur.ast;

public record FnHeader(Safety safety, Constness constness, Extern ext) {

    public static final FnHeader DEFAULT = new FnHeader(Safety.DEFAULT, Constness.NOT_CONST, Extern.NONE);
}
