package com.eainde.knowledge.scan;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Extension to format-tag mapping shared by the scanner and the extractor.
 */
public final class DocumentFormats {

    public static final String JSON = "json";
    public static final String YAML = "yaml";

    private static final Map<String, String> FORMATS_BY_EXTENSION = Map.ofEntries(
            Map.entry("json", JSON),
            Map.entry("yaml", YAML),
            Map.entry("yml", YAML),
            Map.entry("js", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("py", "python"),
            Map.entry("java", "java"),
            Map.entry("cpp", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("rs", "rust"),
            Map.entry("go", "go"),
            Map.entry("rb", "ruby"),
            Map.entry("md", "markdown"),
            Map.entry("txt", "text")
    );

    private static final Set<String> STRUCTURED = Set.of(JSON, YAML);

    private DocumentFormats() {
    }

    /** Unknown extensions map to themselves. */
    public static String formatOf(String extension) {
        String ext = extension.toLowerCase(Locale.ROOT);
        return FORMATS_BY_EXTENSION.getOrDefault(ext, ext);
    }

    public static boolean isStructured(String format) {
        return format != null && STRUCTURED.contains(format);
    }

    /** Returns the lower-cased extension of a file name, or "" when it has none. */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) return "";
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
