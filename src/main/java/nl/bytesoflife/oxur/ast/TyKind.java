package nl.bytesoflife.oxur.ast;

/**
 * Shape of a type. Only path types ({@code i32}, {@code std::string::String}) exist so far.
 */
public sealed interface TyKind permits TyKind.PathType {

    record PathType(Path path) implements TyKind {
    }
}
