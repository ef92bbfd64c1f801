package ai.envlens.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * @param exportedName name importers use ({@code "default"} for the default export)
 * @param localName name of the binding inside the exporting file, when it differs
 */
public record ModuleExport(
        String exportedName,
        @Nullable String localName,
        ExportResolution resolution,
        SourceRange declarationRange,
        boolean isDefault) {
}
