package ai.envlens.analyzer.document;

import static ai.envlens.testutil.TestWorkspace.at;
import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.analyzer.lang.RustProfile;
import java.net.URI;
import org.junit.jupiter.api.Test;

class RustAnalysisTest {

    @Test
    void envVarMacroAndParameter() {
        var text = """
                use std::env;
                fn run() {
                    let host = env::var("DB_HOST");
                    connect(host);
                    let flag = env!("FLAG");
                }
                fn other(host: String) {
                    connect(host);
                }
                """;
        var table = new DocumentAnalyzer().analyze(URI.create("file:///work/main.rs"), new RustProfile(),
                new LineIndex(text));

        var read = table.referenceAt(at(2, 27)).orElseThrow();
        assertEquals(SourceKind.DIRECT_REFERENCE, read.kind());
        assertEquals("DB_HOST", read.canonicalName());

        assertEquals(SourceKind.LOCAL_BINDING, table.referenceAt(at(2, 9)).orElseThrow().kind());
        assertEquals("DB_HOST", table.referenceAt(at(3, 13)).orElseThrow().canonicalName());
        assertEquals("FLAG", table.referenceAt(at(4, 22)).orElseThrow().canonicalName());
        assertTrue(table.referenceAt(at(7, 13)).isEmpty());
    }
}
