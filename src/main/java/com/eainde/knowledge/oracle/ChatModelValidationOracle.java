package com.eainde.knowledge.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Oracle that asks a chat model for the concepts that corroborate a category.
 *
 * <p>Each category is asked once per oracle instance and the answer is kept,
 * so repeated lookups during a run return the same record. A failed call or an
 * unparseable answer is logged and treated as "no corroboration" for that
 * category; it never fails the extraction.</p>
 *
 * <p>Expected model output:</p>
 * <pre>
 * {"concepts": ["quantum mechanics", "superposition"], "relevance": 0.9}
 * </pre>
 */
@Slf4j
public class ChatModelValidationOracle implements ValidationOracle {

    static final String SYSTEM_INSTRUCTION = """
            You validate technical vocabulary. For the knowledge category named by the user,
            list well-established concepts that a reference source would associate with it.
            Respond with JSON only, no prose and no code fences:
            {"concepts": ["<lower-case concept>", ...], "relevance": <number between 0 and 1>}
            """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Map<String, ValidationRecord> answers = new ConcurrentHashMap<>();

    public ChatModelValidationOracle(ChatModel chatModel, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public ValidationRecord lookup(String categoryId) {
        return answers.computeIfAbsent(categoryId, this::ask);
    }

    private ValidationRecord ask(String categoryId) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(
                        SystemMessage.from(SYSTEM_INSTRUCTION),
                        UserMessage.from("Category: " + categoryId)))
                .build();
        try {
            ChatResponse response = chatModel.chat(request);
            String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
            ValidationRecord record = parse(categoryId, text);
            log.info("Oracle answered for category {}: {} concepts, relevance {}",
                    categoryId, record.concepts().size(), record.relevance());
            return record;
        } catch (RuntimeException e) {
            log.warn("Oracle call for category {} failed, treating as uncorroborated", categoryId, e);
            return ValidationRecord.empty(categoryId);
        }
    }

    ValidationRecord parse(String categoryId, String text) {
        if (text == null || text.isBlank()) {
            log.warn("Oracle returned an empty answer for category {}", categoryId);
            return ValidationRecord.empty(categoryId);
        }
        try {
            JsonNode root = objectMapper.readTree(stripCodeFence(text));
            List<String> concepts = new ArrayList<>();
            JsonNode conceptsNode = root.path("concepts");
            if (conceptsNode.isArray()) {
                conceptsNode.forEach(c -> {
                    if (c.isTextual()) concepts.add(c.asText());
                });
            }
            double relevance = Math.max(0.0, Math.min(1.0, root.path("relevance").asDouble(0.0)));
            return ValidationRecord.of(categoryId, concepts, relevance);
        } catch (JsonProcessingException e) {
            log.warn("Oracle answer for category {} is not valid JSON: {}", categoryId, e.getOriginalMessage());
            return ValidationRecord.empty(categoryId);
        }
    }

    private static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (!trimmed.startsWith("```")) return trimmed;
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) return trimmed;
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
