package ai.envlens.analyzer.document;

import static ai.envlens.testutil.TestWorkspace.at;
import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.analyzer.lang.PhpProfile;
import java.net.URI;
import org.junit.jupiter.api.Test;

class PhpAnalysisTest {

    @Test
    void getenvSuperglobalAndParameter() {
        var text = """
                <?php
                $host = getenv('DB_HOST');
                $port = $_ENV['PORT'];
                echo $host;
                function other($host) {
                    echo $host;
                }
                """;
        var table = new DocumentAnalyzer().analyze(URI.create("file:///work/index.php"), new PhpProfile(),
                new LineIndex(text));

        var read = table.referenceAt(at(1, 18)).orElseThrow();
        assertEquals(SourceKind.DIRECT_REFERENCE, read.kind());
        assertEquals("DB_HOST", read.canonicalName());

        assertEquals("PORT", table.referenceAt(at(2, 16)).orElseThrow().canonicalName());

        var usage = table.referenceAt(at(3, 7)).orElseThrow();
        assertEquals(SourceKind.LOCAL_USAGE, usage.kind());
        assertEquals("DB_HOST", usage.canonicalName());

        assertTrue(table.referenceAt(at(5, 11)).isEmpty());
    }
}
