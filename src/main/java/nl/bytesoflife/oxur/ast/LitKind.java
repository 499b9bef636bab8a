package nl.bytesoflife.oxur.ast;

import java.math.BigInteger;

public sealed interface LitKind permits LitKind.Str, LitKind.Int {

    record Str(String value) implements LitKind {
    }

    record Int(BigInteger value) implements LitKind {
    }
}
