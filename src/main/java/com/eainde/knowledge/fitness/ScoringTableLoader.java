package com.eainde.knowledge.fitness;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a {@link ScoringTable} from YAML. Keys the document leaves out keep
 * their {@link ScoringTable#neutral()} values, nested {@code selection} keys included.
 */
@Slf4j
public final class ScoringTableLoader {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ScoringTableLoader() {
    }

    public static ScoringTable load(InputStream in, String description) {
        try {
            JsonNode overrides = YAML.readTree(in);
            if (overrides == null || !overrides.isObject()) {
                log.warn("Scoring table {} is empty, using neutral multipliers", description);
                return ScoringTable.neutral();
            }
            ObjectNode merged = YAML.valueToTree(ScoringTable.neutral());
            overlay(merged, (ObjectNode) overrides);
            ScoringTable table = YAML.treeToValue(merged, ScoringTable.class);
            log.info("Scoring table {} loaded: {} category multipliers, {} format multipliers, threshold {}",
                    description, table.categoryMultipliers().size(), table.formatMultipliers().size(),
                    table.selection().survivalThreshold());
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read scoring table " + description, e);
        }
    }

    private static void overlay(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                overlay((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    /** The table shipped on the classpath. */
    public static ScoringTable loadDefault() {
        try (InputStream in = ScoringTableLoader.class.getResourceAsStream("/scoring-table.yml")) {
            if (in == null) {
                throw new IllegalStateException("scoring-table.yml not found on classpath");
            }
            return load(in, "classpath:scoring-table.yml");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close scoring table stream", e);
        }
    }
}
