package ai.envlens.lsp;

import ai.envlens.analyzer.Occurrence;
import ai.envlens.analyzer.SourcePosition;
import ai.envlens.analyzer.SourceRange;
import java.net.URI;
import java.nio.file.Path;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/** Conversions between lsp4j wire types and the analyzer's coordinates. */
public final class LspConversions {

    private LspConversions() {}

    public static SourcePosition toSourcePosition(Position position) {
        return new SourcePosition(Math.max(0, position.getLine()), Math.max(0, position.getCharacter()));
    }

    public static Position toPosition(SourcePosition position) {
        return new Position(position.line(), position.character());
    }

    public static Range toRange(SourceRange range) {
        return new Range(toPosition(range.start()), toPosition(range.end()));
    }

    public static SourceRange toSourceRange(Range range) {
        return new SourceRange(toSourcePosition(range.getStart()), toSourcePosition(range.getEnd()));
    }

    public static Location toLocation(Occurrence occurrence) {
        return new Location(occurrence.uri().toString(), toRange(occurrence.range()));
    }

    /**
     * Parses a client URI. {@code file:} URIs are normalized through {@link Path} so they compare equal to the URIs
     * the workspace index produces from disk.
     */
    public static URI toUri(String uri) {
        var parsed = URI.create(uri);
        if ("file".equalsIgnoreCase(parsed.getScheme())) {
            try {
                return Path.of(parsed).toAbsolutePath().normalize().toUri();
            } catch (IllegalArgumentException e) {
                return parsed;
            }
        }
        return parsed;
    }
}
