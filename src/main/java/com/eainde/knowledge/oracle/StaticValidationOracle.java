package com.eainde.knowledge.oracle;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Oracle backed by a fixed table. Several entries for the same category are
 * folded into one record.
 */
public class StaticValidationOracle implements ValidationOracle {

    private static final Logger log = LoggerFactory.getLogger(StaticValidationOracle.class);

    private final Map<String, ValidationRecord> records;

    public StaticValidationOracle(Collection<ValidationRecord> entries) {
        Map<String, ValidationRecord> byCategory = new LinkedHashMap<>();
        for (ValidationRecord entry : entries) {
            byCategory.merge(entry.categoryId(), entry, ValidationRecord::combine);
        }
        this.records = Map.copyOf(byCategory);
    }

    /**
     * Loads the table from YAML:
     * <pre>
     * entries:
     *   - categoryId: physics
     *     relevance: 0.97
     *     concepts: [quantum mechanics, superposition]
     * </pre>
     */
    public static StaticValidationOracle fromYaml(InputStream in, String description) {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            OracleTable table = yamlMapper.readValue(in, OracleTable.class);
            List<ValidationRecord> entries = table == null || table.entries() == null
                    ? List.of()
                    : table.entries().stream()
                            .map(e -> ValidationRecord.of(e.categoryId(),
                                    e.concepts() == null ? List.of() : e.concepts(), e.relevance()))
                            .toList();
            StaticValidationOracle oracle = new StaticValidationOracle(entries);
            log.info("Validation oracle table {} loaded: {} categories", description, oracle.records.size());
            return oracle;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read validation oracle table " + description, e);
        }
    }

    @Override
    public ValidationRecord lookup(String categoryId) {
        ValidationRecord record = records.get(categoryId);
        return record != null ? record : ValidationRecord.empty(categoryId);
    }

    record OracleTable(@JsonProperty("entries") List<OracleEntry> entries) {}

    record OracleEntry(
            @JsonProperty("categoryId") String categoryId,
            @JsonProperty("relevance")  double relevance,
            @JsonProperty("summary")    String summary,
            @JsonProperty("concepts")   List<String> concepts
    ) {}
}
