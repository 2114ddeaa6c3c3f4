package com.eainde.knowledge.extract;

import com.eainde.knowledge.exception.MalformedStructuredInputException;
import com.eainde.knowledge.scan.DocumentFormats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Parses JSON and YAML document content into a Jackson tree.
 */
public class StructuredContentParser {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public StructuredContentParser(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * @throws MalformedStructuredInputException if the content does not parse, or the format is not structured
     */
    public JsonNode parse(String origin, String format, String content) {
        ObjectMapper mapper = switch (format) {
            case DocumentFormats.JSON -> jsonMapper;
            case DocumentFormats.YAML -> yamlMapper;
            default -> throw new MalformedStructuredInputException(origin, format,
                    new IllegalArgumentException("format is not structured"));
        };
        try {
            JsonNode root = mapper.readTree(content);
            if (root == null || root.isMissingNode()) {
                throw new MalformedStructuredInputException(origin, format,
                        new IllegalArgumentException("document is empty"));
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedStructuredInputException(origin, format, e);
        }
    }
}
