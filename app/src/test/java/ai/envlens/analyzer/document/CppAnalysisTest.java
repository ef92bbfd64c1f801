package ai.envlens.analyzer.document;

import static ai.envlens.testutil.TestWorkspace.at;
import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.analyzer.lang.CppProfile;
import java.net.URI;
import org.junit.jupiter.api.Test;

class CppAnalysisTest {

    @Test
    void getenvIntoPointerAndParameter() {
        var text = """
                #include <cstdlib>
                void run() {
                    const char *host = std::getenv("DB_HOST");
                    connect(host);
                }
                void other(const char *host) {
                    connect(host);
                }
                """;
        var table = new DocumentAnalyzer().analyze(URI.create("file:///work/main.cpp"), new CppProfile(),
                new LineIndex(text));

        var read = table.referenceAt(at(2, 38)).orElseThrow();
        assertEquals(SourceKind.DIRECT_REFERENCE, read.kind());
        assertEquals("DB_HOST", read.canonicalName());

        assertEquals(SourceKind.LOCAL_BINDING, table.referenceAt(at(2, 17)).orElseThrow().kind());
        assertEquals("DB_HOST", table.referenceAt(at(3, 13)).orElseThrow().canonicalName());
        assertTrue(table.referenceAt(at(6, 13)).isEmpty());
    }
}
