package com.eainde.knowledge.pipeline;

import com.eainde.knowledge.catalog.CategoryCatalogLoader;
import com.eainde.knowledge.catalog.CategoryPatternCatalog;
import com.eainde.knowledge.derive.KnowledgeDeriver;
import com.eainde.knowledge.extract.StructuralFactExtractor;
import com.eainde.knowledge.extract.StructuredContentParser;
import com.eainde.knowledge.extract.TripleExtractor;
import com.eainde.knowledge.fitness.FitnessScorer;
import com.eainde.knowledge.fitness.ScoringTable;
import com.eainde.knowledge.fitness.ScoringTableLoader;
import com.eainde.knowledge.fitness.SurvivalFilter;
import com.eainde.knowledge.graph.ConnectionGraphBuilder;
import com.eainde.knowledge.merge.KnowledgeCollectionNormalizer;
import com.eainde.knowledge.merge.KnowledgeHasher;
import com.eainde.knowledge.merge.KnowledgeMerger;
import com.eainde.knowledge.oracle.ChatModelValidationOracle;
import com.eainde.knowledge.oracle.StaticValidationOracle;
import com.eainde.knowledge.oracle.ValidationOracle;
import com.eainde.knowledge.scan.FileCorpusScanner;
import com.eainde.knowledge.stats.AggregateStatisticsComputer;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wires the pipeline stages from {@code knowledge.*} properties.
 *
 * <p>The category catalog is loaded and validated while the context starts,
 * so an invalid catalog stops the application before any document is scanned.</p>
 */
@Log4j2
@Configuration
public class KnowledgePipelineConfig {

    static final String ORACLE_MODE_STATIC = "static";
    static final String ORACLE_MODE_CHAT_MODEL = "chat-model";

    private final ResourceLoader resourceLoader;

    @Value("${knowledge.source-id:knowledge-pipeline}")
    private String sourceId;

    // ── Scan config ─────────────────────────────────────────────────────
    @Value("${knowledge.scan.root:.}")
    private String scanRoot;

    @Value("${knowledge.scan.extensions:md,txt,js,ts,json,yaml,yml,py,java,rs,go,rb,c,cpp}")
    private String extensions;

    @Value("${knowledge.scan.excluded-directories:node_modules,.git,target,build,dist,.idea}")
    private String excludedDirectories;

    @Value("${knowledge.scan.min-size-bytes:50}")
    private long minSizeBytes;

    @Value("${knowledge.scan.max-size-bytes:20000000}")
    private long maxSizeBytes;

    // ── Extraction config ───────────────────────────────────────────────
    @Value("${knowledge.extraction.workers:0}")
    private int workers;

    @Value("${knowledge.extraction.structure-max-depth:4}")
    private int structureMaxDepth;

    // ── Tables ──────────────────────────────────────────────────────────
    @Value("${knowledge.catalog.location:classpath:categories.yml}")
    private String catalogLocation;

    @Value("${knowledge.scoring.location:classpath:scoring-table.yml}")
    private String scoringLocation;

    @Value("${knowledge.oracle.mode:static}")
    private String oracleMode;

    @Value("${knowledge.oracle.location:classpath:validation-oracle.yml}")
    private String oracleLocation;

    // ── Filter / derive / merge / statistics ────────────────────────────
    @Value("${knowledge.survival.generations:1}")
    private int generations;

    @Value("${knowledge.derive.cross-reference-limit:20}")
    private int crossReferenceLimit;

    @Value("${knowledge.merge.prior-collections:}")
    private String priorCollections;

    @Value("${knowledge.merge.coherence-scale:0.809017}")
    private double mergeCoherenceScale;

    @Value("${knowledge.statistics.coherence-scale:0.85}")
    private double statisticsCoherenceScale;

    @Value("${knowledge.output.path:knowledge-base.json}")
    private String outputPath;

    public KnowledgePipelineConfig(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    // =========================================================================
    //  Tables
    // =========================================================================

    @Bean
    public CategoryPatternCatalog categoryPatternCatalog() {
        try (InputStream in = open(catalogLocation)) {
            return new CategoryCatalogLoader().load(in, catalogLocation);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open category catalog " + catalogLocation, e);
        }
    }

    @Bean
    public ScoringTable scoringTable() {
        try (InputStream in = open(scoringLocation)) {
            return ScoringTableLoader.load(in, scoringLocation);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open scoring table " + scoringLocation, e);
        }
    }

    @Bean
    public ValidationOracle validationOracle(ObjectProvider<ChatModel> chatModel, ObjectMapper objectMapper) {
        if (ORACLE_MODE_CHAT_MODEL.equalsIgnoreCase(oracleMode)) {
            ChatModel model = chatModel.getIfAvailable();
            if (model == null) {
                throw new IllegalStateException("knowledge.oracle.mode=chat-model requires a ChatModel bean");
            }
            log.info("Validation oracle: chat model {}", model.getClass().getSimpleName());
            return new ChatModelValidationOracle(model, objectMapper);
        }
        if (!ORACLE_MODE_STATIC.equalsIgnoreCase(oracleMode)) {
            throw new IllegalStateException("Unknown knowledge.oracle.mode '" + oracleMode + "'");
        }
        try (InputStream in = open(oracleLocation)) {
            return StaticValidationOracle.fromYaml(in, oracleLocation);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open validation oracle table " + oracleLocation, e);
        }
    }

    // =========================================================================
    //  Stages
    // =========================================================================

    @Bean
    public FileCorpusScanner fileCorpusScanner() {
        return FileCorpusScanner.builder()
                .extensions(csv(extensions))
                .excludedDirectories(csv(excludedDirectories))
                .minSizeBytes(minSizeBytes)
                .maxSizeBytes(maxSizeBytes)
                .build();
    }

    @Bean
    public TripleExtractor tripleExtractor(CategoryPatternCatalog catalog,
                                           ValidationOracle oracle,
                                           ObjectMapper objectMapper) {
        return new TripleExtractor(catalog, oracle,
                new StructuredContentParser(objectMapper),
                new StructuralFactExtractor(structureMaxDepth));
    }

    @Bean
    public SurvivalFilter survivalFilter(ScoringTable scoringTable) {
        return new SurvivalFilter(new FitnessScorer(scoringTable), new ConnectionGraphBuilder(), generations);
    }

    @Bean
    public KnowledgeDeriver knowledgeDeriver() {
        return new KnowledgeDeriver(crossReferenceLimit);
    }

    @Bean
    public KnowledgeMerger knowledgeMerger(ObjectMapper objectMapper) {
        return new KnowledgeMerger(new KnowledgeCollectionNormalizer(), new KnowledgeHasher(),
                objectMapper, mergeCoherenceScale);
    }

    @Bean
    public AggregateStatisticsComputer aggregateStatisticsComputer() {
        return new AggregateStatisticsComputer(statisticsCoherenceScale);
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        List<Path> priors = csv(priorCollections).stream().map(Path::of).toList();
        return new PipelineSettings(sourceId, Path.of(scanRoot), priors,
                outputPath.isBlank() ? null : Path.of(outputPath), workers);
    }

    @Bean
    public KnowledgePipeline knowledgePipeline(FileCorpusScanner scanner,
                                               TripleExtractor extractor,
                                               SurvivalFilter survivalFilter,
                                               KnowledgeDeriver deriver,
                                               KnowledgeMerger merger,
                                               AggregateStatisticsComputer statisticsComputer,
                                               ObjectMapper objectMapper) {
        return new KnowledgePipeline(scanner, extractor, survivalFilter, deriver, merger,
                statisticsComputer, objectMapper);
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private InputStream open(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IOException("Resource not found: " + location);
        }
        return resource.getInputStream();
    }

    static Set<String> csv(String value) {
        if (value == null || value.isBlank()) return Set.of();
        Set<String> out = new LinkedHashSet<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(out::add);
        return out;
    }
}
