package ai.envlens.analyzer.document;

import ai.envlens.analyzer.LanguageProfile;
import ai.envlens.analyzer.LineIndex;
import java.net.URI;
import org.jetbrains.annotations.Nullable;

/**
 * One analyzed version of an open document. Snapshots are never mutated; a change publishes a new one.
 *
 * @param profile {@code null} when no language profile is registered for the document
 */
public record DocumentSnapshot(
        URI uri,
        String languageId,
        int version,
        LineIndex lineIndex,
        @Nullable LanguageProfile profile,
        SymbolTable symbols) {

    public String text() {
        return lineIndex.text();
    }

    public boolean isSupported() {
        return profile != null;
    }
}
