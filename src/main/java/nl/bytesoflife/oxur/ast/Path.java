package nl.bytesoflife.oxur.ast;

import java.util.List;
import java.util.stream.Collectors;

public record Path(Span span, List<PathSegment> segments) {

    public Path {
        segments = List.copyOf(segments);
    }

    public static Path from(Ident ident) {
        return new Path(ident.span(), List.of(PathSegment.from(ident)));
    }

    @Override
    public String toString() {
        return segments.stream().map(s -> s.ident().name()).collect(Collectors.joining("::"));
    }
}
