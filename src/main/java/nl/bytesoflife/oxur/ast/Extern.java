package nl.bytesoflife.oxur.ast;

/**
 * ABI of a function header: none, or an explicit ABI string such as "C".
 */
public sealed interface Extern permits Extern.None, Extern.Explicit {

    Extern NONE = new None();

    record None() implements Extern {
    }

    record Explicit(String abi) implements Extern {
    }
}
