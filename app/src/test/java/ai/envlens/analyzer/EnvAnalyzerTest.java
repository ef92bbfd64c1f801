package ai.envlens.analyzer;

import static ai.envlens.testutil.TestWorkspace.at;
import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.testutil.TestWorkspace;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvAnalyzerTest {
    @TempDir
    Path tempDir;

    private TestWorkspace workspace;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(tempDir);
    }

    @AfterEach
    void tearDown() {
        workspace.close();
    }

    @Test
    void propertyOfImportedEnvironmentObject() {
        workspace.open("a.ts", "typescript", "export const e = process.env;\n");
        var b = workspace.open("b.ts", "typescript", "import { e } from './a';\nconsole.log(e.DEBUG);\n");

        var resolution = workspace.analyzer().resolve(b, at(1, 15)).orElseThrow();
        assertEquals("DEBUG", resolution.canonicalName());
        assertEquals(SourceKind.CROSS_MODULE_IMPORT, resolution.sourceKind());
    }

    @Test
    void importedVariableResolvesFromTheIndex() throws Exception {
        workspace.write("config/index.js", "export const dbUrl = process.env.DATABASE_URL;\n");
        workspace.write("node_modules/lib/index.js", "export const x = process.env.IGNORED;\n");
        var summary = workspace.analyzer().indexWorkspace(workspace.indexingConfig());
        assertEquals(1, summary.indexed());
        assertFalse(summary.cancelled());

        var app = workspace.open("app.js", "javascript", "import { dbUrl } from './config';\nconnect(dbUrl);\n");
        var resolution = workspace.analyzer().resolve(app, at(1, 9)).orElseThrow();
        assertEquals("DATABASE_URL", resolution.canonicalName());
        assertEquals(SourceKind.CROSS_MODULE_IMPORT, resolution.sourceKind());
    }

    @Test
    void reExportsAndWildcardsAreFollowed() throws Exception {
        workspace.write("env.js", "export const token = process.env.TOKEN;\nexport const env = process.env;\n");
        workspace.write("barrel.js", "export * from './env';\n");
        workspace.write("named.js", "export { token as apiToken } from './barrel';\n");
        workspace.analyzer().indexWorkspace(workspace.indexingConfig());

        var app = workspace.open("app.js", "javascript", """
                import { apiToken } from './named';
                import { env } from './barrel';
                use(apiToken, env.REGION);
                """);
        assertEquals("TOKEN", workspace.analyzer().resolve(app, at(2, 5)).orElseThrow().canonicalName());
        assertEquals("REGION", workspace.analyzer().resolve(app, at(2, 19)).orElseThrow().canonicalName());
    }

    @Test
    void exportedChainsShareTheImportersDepthBudget() {
        var source = new StringBuilder("const a0 = process.env.X;\n");
        for (int i = 1; i <= 10; i++) {
            source.append("const a").append(i).append(" = a").append(i - 1).append(";\n");
        }
        source.append("export { a9, a10 };\nexport const out = a10;\n");
        var lib = workspace.open("lib.js", "javascript", source.toString());

        var exports = workspace.analyzer().exportsOf(lib).orElseThrow().namedExports();
        assertEquals(new ExportResolution.EnvVar("X", 9), exports.get("a9").resolution());
        assertEquals(new ExportResolution.EnvVar("X", 10), exports.get("a10").resolution());
        assertFalse(exports.get("out").resolution().isEnvRelated());

        var app = workspace.open("app.js", "javascript", "import { a9, a10, out } from './lib';\nuse(a9, a10, out);\n");
        assertEquals("X", workspace.analyzer().resolve(app, at(1, 4)).orElseThrow().canonicalName());
        assertTrue(workspace.analyzer().resolve(app, at(1, 8)).isEmpty());
        assertTrue(workspace.analyzer().resolve(app, at(1, 13)).isEmpty());
    }

    @Test
    void unindexedModuleHasNoDefinition() {
        var app = workspace.open("app.js", "javascript", "import { v } from './missing';\nuse(v);\n");
        assertTrue(workspace.analyzer().resolve(app, at(1, 4)).isEmpty());
    }

    @Test
    void moduleResolutionStaysInsideTheWorkspace() {
        var app = workspace.write("src/app.ts", "");
        workspace.write("src/util.ts", "");
        var found = workspace.analyzer().resolveModuleSpecifier("./util", app, "typescript").orElseThrow();
        assertEquals(workspace.uri("src/util.ts"), found);
        assertTrue(workspace.analyzer().resolveModuleSpecifier("../../etc/passwd", app, "typescript").isEmpty());
    }

    @Test
    void referencesSpanOpenDocumentsAndTheIndex() throws Exception {
        workspace.write("worker.js", "const q = process.env.QUEUE;\n");
        workspace.analyzer().indexWorkspace(workspace.indexingConfig());
        var app = workspace.open("app.js", "javascript", "const { QUEUE } = process.env;\nstart(QUEUE);\n");

        var occurrences = workspace.analyzer().referencesTo("QUEUE");
        assertEquals(3, occurrences.size(), occurrences.toString());
        assertEquals(2, occurrences.stream().filter(o -> o.uri().equals(app)).count());
        assertTrue(workspace.analyzer().allVariableNames().contains("QUEUE"));
    }

    @Test
    void openDocumentTakesPrecedenceOverDisk() throws Exception {
        var lib = workspace.write("lib.js", "export const v = process.env.ON_DISK;\n");
        workspace.analyzer().indexWorkspace(workspace.indexingConfig());
        workspace.analyzer().open(lib, "javascript", 2, "export const v = process.env.IN_EDITOR;\n");

        var app = workspace.open("app.js", "javascript", "import { v } from './lib';\nuse(v);\n");
        assertEquals("IN_EDITOR", workspace.analyzer().resolve(app, at(1, 4)).orElseThrow().canonicalName());

        workspace.analyzer().close(lib).get(5, TimeUnit.SECONDS);
        assertEquals("ON_DISK", workspace.analyzer().resolve(app, at(1, 4)).orElseThrow().canonicalName());
    }

    @Test
    void changeUpdatesExportsSeenByImporters() throws Exception {
        var lib = workspace.open("lib.js", "javascript", "export const v = process.env.OLD;\n");
        var app = workspace.open("app.js", "javascript", "import { v } from './lib';\nuse(v);\n");
        assertTrue(workspace.analyzer().change(lib, 2, "export const v = process.env.NEW;\n").get(5, TimeUnit.SECONDS));
        assertEquals("NEW", workspace.analyzer().resolve(app, at(1, 4)).orElseThrow().canonicalName());
    }

    @Test
    void workspaceFileEvents() throws Exception {
        var app = workspace.open("app.js", "javascript", "import { v } from './late';\nuse(v);\n");
        assertTrue(workspace.analyzer().resolve(app, at(1, 4)).isEmpty());

        var late = workspace.write("late.js", "export const v = process.env.LATE;\n");
        workspace.analyzer().onWorkspaceFileCreated(late).get(5, TimeUnit.SECONDS);
        assertEquals("LATE", workspace.analyzer().resolve(app, at(1, 4)).orElseThrow().canonicalName());

        Files.delete(Path.of(late));
        workspace.analyzer().onWorkspaceFileDeleted(late).get(5, TimeUnit.SECONDS);
        assertTrue(workspace.analyzer().resolve(app, at(1, 4)).isEmpty());
    }

    @Test
    void fileEventsApplyInArrivalOrder() throws Exception {
        var app = workspace.open("app.js", "javascript", "import { v } from './brief';\nuse(v);\n");
        var brief = workspace.write("brief.js", "export const v = process.env.BRIEF;\n");

        var created = workspace.analyzer().onWorkspaceFileCreated(brief);
        var deleted = workspace.analyzer().onWorkspaceFileDeleted(brief);
        deleted.get(5, TimeUnit.SECONDS);

        assertTrue(created.isDone(), "the create ran first");
        assertTrue(workspace.analyzer().resolve(app, at(1, 4)).isEmpty(), "and the delete after it");
    }

    @Test
    void backgroundIndexingCompletes() throws Exception {
        workspace.write("a.py", "import os\nA = os.environ[\"A\"]\n");
        workspace.write("b.go", "package main\nimport \"os\"\nvar b = os.Getenv(\"B\")\n");
        var handle = workspace.analyzer().startBackgroundIndexing();
        var summary = handle.future().get(30, TimeUnit.SECONDS);
        assertEquals(2, summary.indexed());
        assertEquals(Set.of("A", "B"), workspace.analyzer().allVariableNames());
    }
}
