package ai.envlens.analyzer.document;

import static ai.envlens.testutil.TestWorkspace.at;
import static org.junit.jupiter.api.Assertions.*;

import ai.envlens.analyzer.ExportResolution;
import ai.envlens.analyzer.LineIndex;
import ai.envlens.analyzer.Reference;
import ai.envlens.analyzer.SourceKind;
import ai.envlens.analyzer.lang.JavascriptProfile;
import ai.envlens.analyzer.lang.TypescriptProfile;
import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class JavascriptAnalysisTest {
    private static final URI URI_JS = URI.create("file:///work/app.js");

    private final DocumentAnalyzer analyzer = new DocumentAnalyzer();

    private SymbolTable analyzeJs(String text) {
        return analyzer.analyze(URI_JS, new JavascriptProfile(), new LineIndex(text));
    }

    private static Reference referenceAt(SymbolTable table, int line, int character) {
        return table.referenceAt(at(line, character))
                .orElseThrow(() -> new AssertionError("no reference at " + line + ":" + character));
    }

    @Test
    void directReadAndItsLocalBinding() {
        var table = analyzeJs("""
                const port = process.env.PORT;
                console.log(port);
                """);

        var direct = referenceAt(table, 0, 26);
        assertEquals("PORT", direct.token());
        assertEquals("PORT", direct.canonicalName());
        assertEquals(SourceKind.DIRECT_REFERENCE, direct.kind());
        assertEquals(at(0, 25), direct.range().start());
        assertEquals(at(0, 29), direct.range().end());

        var binding = referenceAt(table, 0, 7);
        assertEquals(SourceKind.LOCAL_BINDING, binding.kind());
        assertEquals("PORT", binding.canonicalName());

        var usage = referenceAt(table, 1, 13);
        assertEquals(SourceKind.LOCAL_USAGE, usage.kind());
        assertEquals("port", usage.token());
        assertEquals("PORT", usage.canonicalName());
    }

    @Test
    void positionJustPastATokenIsOutsideIt() {
        var table = analyzeJs("const a = process.env.DB_URL;\n");
        assertEquals("DB_URL", referenceAt(table, 0, 27).canonicalName());
        assertTrue(table.referenceAt(at(0, 28)).isEmpty(), "the semicolon is not part of DB_URL");
    }

    @Test
    void parametersShadowOuterBindings() {
        var table = analyzeJs("""
                const x = process.env.A;
                function f(x) { return x; }
                const g = (x) => x;
                const h = x => x;
                function k(y = x) { return y; }
                use(x);
                """);
        assertTrue(table.referenceAt(at(1, 11)).isEmpty(), "the parameter itself");
        assertTrue(table.referenceAt(at(1, 23)).isEmpty(), "reads the parameter");
        assertTrue(table.referenceAt(at(2, 17)).isEmpty());
        assertTrue(table.referenceAt(at(3, 15)).isEmpty());
        assertEquals("A", referenceAt(table, 4, 15).canonicalName(), "a default value reads the outer x");
        assertEquals("A", referenceAt(table, 5, 4).canonicalName());
    }

    @Test
    void subscriptWithFallbackCapturesTheDefault() {
        var table = analyzeJs("const host = process.env[\"DB_HOST\"] || \"localhost\";\n");
        var ref = referenceAt(table, 0, 27);
        assertEquals("DB_HOST", ref.canonicalName());
        assertEquals(SourceKind.DIRECT_REFERENCE, ref.kind());
        assertEquals("localhost", ref.defaultValue());
        assertEquals(at(0, 26), ref.range().start(), "range covers the name without quotes");

        var binding = referenceAt(table, 0, 7);
        assertEquals("DB_HOST", binding.canonicalName());
        assertEquals("localhost", binding.defaultValue());
    }

    @Test
    void propertyReadThroughEnvironmentAlias() {
        var table = analyzeJs("""
                const env = process.env;
                const url = env.DATABASE_URL;
                """);
        var ref = referenceAt(table, 1, 18);
        assertEquals(SourceKind.ENV_OBJECT_ALIAS, ref.kind());
        assertEquals("DATABASE_URL", ref.canonicalName());
        assertEquals("env", ref.via());

        var url = referenceAt(table, 1, 7);
        assertEquals(SourceKind.LOCAL_BINDING, url.kind());
        assertEquals("DATABASE_URL", url.canonicalName());

        assertTrue(table.referenceAt(at(0, 7)).isEmpty(), "the alias itself is not a variable");
    }

    @Test
    void destructuringRenamesAndDefaults() {
        var table = analyzeJs("""
                const { API_KEY: key, REGION = "eu" } = process.env;
                send(key, REGION);
                """);

        var key = referenceAt(table, 0, 9);
        assertEquals(SourceKind.DIRECT_REFERENCE, key.kind());
        assertEquals("API_KEY", key.canonicalName());

        var renamed = referenceAt(table, 0, 18);
        assertEquals(SourceKind.LOCAL_BINDING, renamed.kind());
        assertEquals("API_KEY", renamed.canonicalName());

        var region = referenceAt(table, 0, 23);
        assertEquals(SourceKind.DIRECT_REFERENCE, region.kind());
        assertEquals("eu", region.defaultValue());

        var keyUsage = referenceAt(table, 1, 6);
        assertEquals(SourceKind.LOCAL_USAGE, keyUsage.kind());
        assertEquals("API_KEY", keyUsage.canonicalName());

        var regionUsage = referenceAt(table, 1, 11);
        assertEquals("REGION", regionUsage.canonicalName());
        assertEquals("eu", regionUsage.defaultValue());
    }

    @Test
    void chainsResolveUpToTheHopLimitAndNoFurther() {
        var source = "const a0 = process.env.DEEP;\n"
                + IntStream.rangeClosed(1, 11)
                        .mapToObj(i -> "const a" + i + " = a" + (i - 1) + ";\n")
                        .collect(Collectors.joining())
                + "use(a10, a11);\n";
        var table = analyzeJs(source);

        var tenHops = referenceAt(table, 12, 5);
        assertEquals("a10", tenHops.token());
        assertEquals("DEEP", tenHops.canonicalName());

        assertTrue(table.referenceAt(at(12, 10)).isEmpty(), "eleven hops exceed the limit");
    }

    @Test
    void bindingsDoNotLeakIntoSiblingFunctions() {
        var table = analyzeJs("""
                function a() {
                  const key = process.env.A_KEY;
                  return key;
                }
                function b() {
                  return key;
                }
                """);
        assertEquals("A_KEY", referenceAt(table, 2, 10).canonicalName());
        assertTrue(table.referenceAt(at(5, 10)).isEmpty());
    }

    @Test
    void innerDeclarationShadowsOuterEnvBinding() {
        var table = analyzeJs("""
                const host = process.env.HOST;
                function f() {
                  const host = "localhost";
                  return host;
                }
                log(host);
                """);
        assertTrue(table.referenceAt(at(3, 10)).isEmpty(), "shadowed by a plain string");
        var outer = referenceAt(table, 5, 5);
        assertEquals(SourceKind.LOCAL_USAGE, outer.kind());
        assertEquals("HOST", outer.canonicalName());
    }

    @Test
    void declarationCannotSeeItself() {
        var table = analyzeJs("""
                let cfg = process.env;
                function g() {
                  const cfg = cfg.MODE;
                }
                """);
        // the inner cfg is declared at the end of its own declarator, so cfg.MODE still sees the outer alias
        var mode = referenceAt(table, 2, 18);
        assertEquals("MODE", mode.canonicalName());
        assertEquals(SourceKind.ENV_OBJECT_ALIAS, mode.kind());
    }

    @Test
    void typescriptWrappersAreLookedThrough() {
        var text = "const token = (process.env.TOKEN as string);\nexport const t = token!;\n";
        var table = analyzer.analyze(URI.create("file:///work/app.ts"), new TypescriptProfile(), new LineIndex(text));
        assertEquals("TOKEN", referenceAt(table, 0, 7).canonicalName());
        assertEquals("TOKEN", referenceAt(table, 1, 13).canonicalName());
    }

    @Test
    void typescriptParametersShadowOuterBindings() {
        var text = """
                const key = process.env.API_KEY;
                function sign(key: string): string { return key; }
                const f = (key?: string) => key;
                use(key);
                """;
        var table = analyzer.analyze(URI.create("file:///work/app.ts"), new TypescriptProfile(), new LineIndex(text));
        assertTrue(table.referenceAt(at(1, 45)).isEmpty());
        assertTrue(table.referenceAt(at(2, 29)).isEmpty());
        assertEquals("API_KEY", referenceAt(table, 3, 5).canonicalName());
    }

    @Test
    void exportsAreClassified() {
        var table = analyzeJs("""
                export const e = process.env;
                export const port = process.env.PORT;
                const secret = "x";
                export { secret };
                export { token as apiToken } from './tokens';
                export * from './more';
                """);
        var exports = table.exports();
        assertInstanceOf(ExportResolution.EnvObject.class,
                exports.namedExports().get("e").resolution());
        assertEquals(new ExportResolution.EnvVar("PORT"),
                exports.namedExports().get("port").resolution());
        assertFalse(exports.namedExports().get("secret").resolution().isEnvRelated());
        var reexport = exports.namedExports().get("apiToken");
        assertNotNull(reexport);
        assertEquals(new ExportResolution.ReExport("./tokens", "token", null), reexport.resolution());
        assertEquals(List.of("./more"), exports.wildcardReexports());
    }

    @Test
    void malformedSourceNeverThrows() {
        var table = analyzeJs("const = process.env.[[[ )))\n\0");
        assertNotNull(table);
        assertTrue(table.references().stream().allMatch(r -> r.range() != null));
    }
}
