package nl.bytesoflife.oxur.ast;

import java.util.List;

/**
 * Angle-bracketed type arguments of a path segment, e.g. {@code Vec<i32>}.
 */
public record GenericArgs(List<Ty> args, Span span) {

    public GenericArgs {
        args = List.copyOf(args);
    }
}
