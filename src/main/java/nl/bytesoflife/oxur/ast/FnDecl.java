package nl.bytesoflife.oxur.ast;

import java.util.List;

/**
 * Parameters and return type of a function.
 */
public record FnDecl(List<Param> inputs, FnRetTy output) {

    public FnDecl {
        inputs = List.copyOf(inputs);
    }

    public static FnDecl empty() {
        return new FnDecl(List.of(), new FnRetTy.DefaultReturn(Span.DUMMY));
    }
}
