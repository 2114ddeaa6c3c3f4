package com.eainde.knowledge.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Walks a directory tree and returns the documents the extractor should read.
 *
 * <h3>Selection rules:</h3>
 * <ul>
 *   <li>directories whose name is in the exclusion set are not descended into</li>
 *   <li>files must carry an allow-listed extension</li>
 *   <li>file size must lie within {@code [minSizeBytes, maxSizeBytes]}</li>
 * </ul>
 *
 * <p>Entries that cannot be inspected are logged and counted, never fatal.
 * The returned list is sorted by path so that two runs over the same tree
 * produce facts in the same order.</p>
 *
 * <pre>
 * FileCorpusScanner scanner = FileCorpusScanner.builder()
 *         .extensions(Set.of("md", "json"))
 *         .minSizeBytes(50)
 *         .build();
 * ScanResult result = scanner.scan(Path.of("docs"));
 * </pre>
 *
 * <p>This class is pure logic with no Spring dependencies.</p>
 */
public class FileCorpusScanner {

    private static final Logger log = LoggerFactory.getLogger(FileCorpusScanner.class);

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(
            "md", "txt", "js", "ts", "json", "yaml", "yml", "py", "java", "rs", "go", "rb", "c", "cpp");

    public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Set.of(
            "node_modules", ".git", "target", "build", "dist", ".idea");

    private final Set<String> extensions;
    private final Set<String> excludedDirectories;
    private final long minSizeBytes;
    private final long maxSizeBytes;

    private FileCorpusScanner(Builder builder) {
        this.extensions = builder.extensions.stream()
                .map(e -> e.startsWith(".") ? e.substring(1) : e)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.excludedDirectories = Set.copyOf(builder.excludedDirectories);
        this.minSizeBytes = builder.minSizeBytes;
        this.maxSizeBytes = builder.maxSizeBytes;

        if (minSizeBytes < 0 || maxSizeBytes < minSizeBytes) {
            throw new IllegalArgumentException(
                    "size bounds must satisfy 0 <= min (" + minSizeBytes + ") <= max (" + maxSizeBytes + ")");
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Scans the tree under {@code root}.
     *
     * @param root directory to walk
     * @return accepted documents plus unreadable/skipped counts; empty if the root is not a directory
     */
    public ScanResult scan(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            log.warn("Scan root {} is not a readable directory, nothing to scan", root);
            return ScanResult.empty();
        }

        Path start = root.toAbsolutePath().normalize();
        CorpusVisitor visitor = new CorpusVisitor(start);
        try {
            Files.walkFileTree(start, visitor);
        } catch (IOException e) {
            // walkFileTree only rethrows what the visitor rethrows; the visitor never does
            log.warn("Scan of {} stopped early: {}", start, e.getMessage(), e);
            visitor.unreadable++;
        }

        visitor.documents.sort(Comparator.comparing(Document::path));
        log.info("Scanned {}: {} documents accepted, {} skipped, {} unreadable",
                start, visitor.documents.size(), visitor.skipped, visitor.unreadable);
        return new ScanResult(List.copyOf(visitor.documents), visitor.unreadable, visitor.skipped);
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private boolean withinSizeBounds(long size) {
        return size >= minSizeBytes && size <= maxSizeBytes;
    }

    private final class CorpusVisitor extends SimpleFileVisitor<Path> {

        private final Path start;
        private final List<Document> documents = new ArrayList<>();
        private int unreadable;
        private int skipped;

        private CorpusVisitor(Path start) {
            this.start = start;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(start) && dir.getFileName() != null
                    && excludedDirectories.contains(dir.getFileName().toString())) {
                log.debug("Skipping excluded directory {}", dir);
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            String extension = DocumentFormats.extensionOf(file.getFileName().toString());
            if (!extensions.contains(extension) || !withinSizeBounds(attrs.size())) {
                skipped++;
                return FileVisitResult.CONTINUE;
            }
            if (!Files.isReadable(file)) {
                log.warn("Skipping unreadable document {}", file);
                unreadable++;
                return FileVisitResult.CONTINUE;
            }
            documents.add(new Document(
                    file,
                    attrs.size(),
                    attrs.lastModifiedTime().toInstant(),
                    DocumentFormats.formatOf(extension),
                    extension));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
            unreadable++;
            return FileVisitResult.CONTINUE;
        }
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<String> extensions = DEFAULT_EXTENSIONS;
        private Set<String> excludedDirectories = DEFAULT_EXCLUDED_DIRECTORIES;
        private long minSizeBytes = 50;
        private long maxSizeBytes = 20_000_000;

        public Builder extensions(Set<String> extensions) {
            this.extensions = extensions;
            return this;
        }

        public Builder excludedDirectories(Set<String> excludedDirectories) {
            this.excludedDirectories = excludedDirectories;
            return this;
        }

        public Builder minSizeBytes(long minSizeBytes) {
            this.minSizeBytes = minSizeBytes;
            return this;
        }

        public Builder maxSizeBytes(long maxSizeBytes) {
            this.maxSizeBytes = maxSizeBytes;
            return this;
        }

        public FileCorpusScanner build() {
            return new FileCorpusScanner(this);
        }
    }
}
