package nl.bytesoflife.oxur.ast;

/**
 * Return type of a function: implicit unit, or an explicit type.
 */
public sealed interface FnRetTy permits FnRetTy.DefaultReturn, FnRetTy.ExplicitReturn {

    /** No return type written; the span points where one could be inserted. */
    record DefaultReturn(Span span) implements FnRetTy {
    }

    record ExplicitReturn(Ty ty) implements FnRetTy {
    }
}
