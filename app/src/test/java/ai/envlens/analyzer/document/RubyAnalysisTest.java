package ai.envlens.analyzer.document;

import static ai.envlens.testutil.TestWorkspace.at;
import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.analyzer.lang.RubyProfile;
import java.net.URI;
import org.junit.jupiter.api.Test;

class RubyAnalysisTest {

    @Test
    void envIndexFetchWithDefaultAndParameter() {
        var text = """
                host = ENV["DB_HOST"]
                port = ENV.fetch("PORT", "3000")
                puts host
                def other(host)
                  puts host
                end
                """;
        var table = new DocumentAnalyzer().analyze(URI.create("file:///work/app.rb"), new RubyProfile(),
                new LineIndex(text));

        var read = table.referenceAt(at(0, 14)).orElseThrow();
        assertEquals(SourceKind.DIRECT_REFERENCE, read.kind());
        assertEquals("DB_HOST", read.canonicalName());

        var port = table.referenceAt(at(1, 19)).orElseThrow();
        assertEquals("PORT", port.canonicalName());
        assertEquals("3000", port.defaultValue());

        var usage = table.referenceAt(at(2, 6)).orElseThrow();
        assertEquals(SourceKind.LOCAL_USAGE, usage.kind());
        assertEquals("DB_HOST", usage.canonicalName());

        assertTrue(table.referenceAt(at(4, 8)).isEmpty());
    }
}
