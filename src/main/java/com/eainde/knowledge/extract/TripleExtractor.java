package com.eainde.knowledge.extract;

import com.eainde.knowledge.catalog.CategoryPatternCatalog;
import com.eainde.knowledge.catalog.PatternCategory;
import com.eainde.knowledge.exception.DocumentReadException;
import com.eainde.knowledge.exception.MalformedStructuredInputException;
import com.eainde.knowledge.model.Fact;
import com.eainde.knowledge.oracle.ValidationOracle;
import com.eainde.knowledge.oracle.ValidationRecord;
import com.eainde.knowledge.scan.Document;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;

/**
 * Turns documents into raw facts by running every category matcher over the content.
 *
 * <h3>Per match occurrence:</h3>
 * <ul>
 *   <li>subject = category label ("CoreCS System")</li>
 *   <li>object = the matched lexeme, whitespace-collapsed and lower-cased</li>
 *   <li>if the oracle corroborates the lexeme for that category: predicate
 *       {@value #IMPLEMENTS_VALIDATED}, confidence {@value #VALIDATED_CONFIDENCE};
 *       otherwise {@value #IMPLEMENTS}, {@value #DEFAULT_CONFIDENCE}</li>
 * </ul>
 *
 * <p>JSON and YAML documents additionally go through the {@link StructuralFactExtractor}.
 * If they fail to parse, the failure is recorded and only raw-text matching runs.</p>
 *
 * <p>{@link #extractAll(List, Executor)} runs one task per document; each task
 * builds its own fact list and the lists are concatenated in document order
 * once every task has finished.</p>
 */
public class TripleExtractor {

    private static final Logger log = LoggerFactory.getLogger(TripleExtractor.class);

    public static final String IMPLEMENTS = "implements";
    public static final String IMPLEMENTS_VALIDATED = "implements_validated";
    public static final double DEFAULT_CONFIDENCE = 0.8;
    public static final double VALIDATED_CONFIDENCE = 0.95;

    private final CategoryPatternCatalog catalog;
    private final ValidationOracle oracle;
    private final StructuredContentParser parser;
    private final StructuralFactExtractor structuralExtractor;

    public TripleExtractor(CategoryPatternCatalog catalog,
                           ValidationOracle oracle,
                           StructuredContentParser parser,
                           StructuralFactExtractor structuralExtractor) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.structuralExtractor = Objects.requireNonNull(structuralExtractor, "structuralExtractor");
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Extracts every document on {@code executor} and concatenates the results in input order.
     */
    public ExtractionResult extractAll(List<Document> documents, Executor executor) {
        List<CompletableFuture<DocumentExtraction>> tasks = new ArrayList<>(documents.size());
        for (Document document : documents) {
            tasks.add(CompletableFuture.supplyAsync(() -> extract(document), executor));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        List<DocumentExtraction> extractions = tasks.stream()
                .map(CompletableFuture::join)
                .toList();
        ExtractionResult result = ExtractionResult.aggregate(extractions);
        log.info("Extracted {} raw facts from {} documents ({} unreadable, {} malformed)",
                result.facts().size(), result.documentsProcessed(),
                result.unreadableDocuments(), result.malformedDocuments());
        return result;
    }

    /**
     * Reads and extracts one document. Read failures are logged and reported
     * through {@link DocumentExtraction#unreadable()}, never thrown.
     */
    public DocumentExtraction extract(Document document) {
        String content;
        try {
            content = read(document);
        } catch (DocumentReadException e) {
            log.warn("Skipping document: {}", e.getMessage());
            return DocumentExtraction.unreadable(document);
        }
        return extract(document, content);
    }

    /**
     * Extracts facts from already-loaded content.
     */
    public DocumentExtraction extract(Document document, String content) {
        List<Fact> facts = new ArrayList<>();
        boolean malformed = false;

        if (document.isStructured()) {
            try {
                JsonNode root = parser.parse(document.originId(), document.format(), content);
                facts.addAll(structuralExtractor.extract(root, document));
            } catch (MalformedStructuredInputException e) {
                log.warn("{}; falling back to raw-text extraction", e.getMessage());
                malformed = true;
            }
        }

        facts.addAll(matchCategories(document, content));
        log.debug("Document {} produced {} facts", document.path(), facts.size());
        return new DocumentExtraction(document, List.copyOf(facts), false, malformed);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    List<Fact> matchCategories(Document document, String content) {
        List<Fact> facts = new ArrayList<>();
        for (PatternCategory category : catalog.categories()) {
            ValidationRecord validation = oracle.lookup(category.getId());
            Matcher matcher = category.matcher(content);
            while (matcher.find()) {
                String lexeme = Fact.normalizeTerm(matcher.group());
                boolean validated = validation != null && validation.corroborates(lexeme);
                facts.add(categoryFact(category, lexeme, validated, document));
            }
        }
        return facts;
    }

    private static Fact categoryFact(PatternCategory category, String lexeme,
                                     boolean validated, Document document) {
        TreeSet<String> origins = new TreeSet<>();
        origins.add(document.originId());
        return new Fact(
                category.getLabel(),
                validated ? IMPLEMENTS_VALIDATED : IMPLEMENTS,
                lexeme,
                validated ? VALIDATED_CONFIDENCE : DEFAULT_CONFIDENCE,
                category.getId(),
                origins,
                document.format(),
                category.getProgressionRank(),
                category.getDependencies(),
                validated,
                category.isExternallyValidated(),
                0.0, 0, 0,
                document.lastModified());
    }

    private static String read(Document document) {
        try {
            return new String(Files.readAllBytes(document.path()), StandardCharsets.UTF_8);
        } catch (IOException | SecurityException e) {
            throw new DocumentReadException(document.path(), e);
        }
    }
}
