package ai.envlens.analyzer.workspace;

import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.analyzer.IndexingConfig;
import ai.envlens.analyzer.LanguageRegistry;
import ai.envlens.analyzer.document.DocumentAnalyzer;
import ai.envlens.concurrent.CancellationToken;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceIndexerTest {
    @TempDir
    Path root;

    private WorkspaceIndex index;
    private WorkspaceIndexer indexer;

    @BeforeEach
    void setUp() {
        index = new WorkspaceIndex();
        indexer = new WorkspaceIndexer(LanguageRegistry.withDefaults(), new DocumentAnalyzer(), index, uri -> false);
    }

    private void write(String relative, String content) throws IOException {
        var file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private IndexingConfig config(long maxBytes) {
        return new IndexingConfig(root, Set.of("node_modules"), maxBytes, 2);
    }

    @Test
    void indexesSupportedFilesAndSkipsTheRest() throws IOException {
        write("src/a.js", "export const a = process.env.A;\n");
        write("src/b.rb", "b = ENV[\"B\"]\n");
        write("README.md", "process.env.NOT_CODE");
        write("node_modules/x/index.js", "process.env.X;\n");

        var summary = indexer.indexWorkspace(config(1024 * 1024), CancellationToken.create());

        assertEquals(2, summary.attempted());
        assertEquals(2, summary.indexed());
        assertEquals(0, summary.failed());
        assertEquals(2, index.size());
        var a = index.get(root.resolve("src/a.js").toUri()).orElseThrow();
        assertTrue(a.occurrences().containsKey("A"));
        assertTrue(a.exports().namedExports().containsKey("a"));
        assertTrue(index.get(root.resolve("src/b.rb").toUri()).orElseThrow().occurrences().containsKey("B"));
    }

    @Test
    void oversizedFilesAreSkipped() throws IOException {
        write("big.js", "const big = process.env.BIG;\n" + "//".repeat(200) + "\n");
        write("small.js", "const s = process.env.SMALL;\n");
        var summary = indexer.indexWorkspace(config(100), CancellationToken.create());
        assertEquals(1, summary.indexed());
        assertTrue(index.get(root.resolve("big.js").toUri()).isEmpty());
    }

    @Test
    void cancelledScanIndexesNothing() throws IOException {
        for (int i = 0; i < 20; i++) {
            write("f" + i + ".js", "process.env.V" + i + ";\n");
        }
        var token = CancellationToken.create();
        token.cancel();
        var summary = indexer.indexWorkspace(config(1024 * 1024), token);
        assertTrue(summary.cancelled());
        assertEquals(0, summary.attempted());
        assertEquals(0, index.size());
    }

    @Test
    void skippedFilesAreLeftAlone() throws IOException {
        write("open.js", "process.env.OPEN;\n");
        write("closed.js", "process.env.CLOSED;\n");
        var open = root.resolve("open.js").toUri();
        var skipping = new WorkspaceIndexer(LanguageRegistry.withDefaults(), new DocumentAnalyzer(), index,
                open::equals);
        skipping.indexWorkspace(config(1024 * 1024), CancellationToken.create());
        assertTrue(index.get(open).isEmpty());
        assertEquals(1, index.size());
    }

    @Test
    void reindexAndRemoveSingleFiles() throws IOException {
        write("one.js", "process.env.FIRST;\n");
        var file = root.resolve("one.js");
        assertTrue(indexer.indexFile(file, 1024));
        assertTrue(index.get(file.toUri()).orElseThrow().occurrences().containsKey("FIRST"));

        write("one.js", "process.env.SECOND;\n");
        assertTrue(indexer.indexFile(file, 1024));
        var occurrences = index.get(file.toUri()).orElseThrow().occurrences();
        assertFalse(occurrences.containsKey("FIRST"));
        assertTrue(occurrences.containsKey("SECOND"));

        indexer.remove(file.toUri());
        assertTrue(index.get(file.toUri()).isEmpty());
    }
}
