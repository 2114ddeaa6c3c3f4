package com.eainde.knowledge.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeHasherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final KnowledgeHasher hasher = new KnowledgeHasher();

    private ObjectNode node(String json) throws JsonProcessingException {
        return (ObjectNode) mapper.readTree(json);
    }

    @Test
    @DisplayName("triples hash the normalised subject|predicate|object")
    void tripleHash() throws JsonProcessingException {
        KnowledgeItem item = hasher.keyed("triples", node("""
                {"subject": "CoreCS System", "predicate": "implements", "object": "Algorithm", "confidence": 0.8}
                """));

        assertThat(item.identityKey()).isEqualTo("corecs system|implements|algorithm");
        assertThat(item.hash()).isEqualTo(DigestUtils.md5Hex("corecs system|implements|algorithm"));
        assertThat(item.hash()).isEqualTo(KnowledgeHasher.factHash("CoreCS System", "implements", "Algorithm"));
    }

    @Test
    @DisplayName("patterns and concepts hash their normalised text")
    void patternAndConcept() throws JsonProcessingException {
        assertThat(hasher.keyed("patterns", node("{\"pattern\": \" Golden  Ratio\", \"categoryId\": \"a\"}")).hash())
                .isEqualTo(hasher.keyed("patterns", node("{\"pattern\": \"golden ratio\", \"categoryId\": \"b\"}")).hash());
        assertThat(hasher.keyed("crossReferences", node("{\"concept\": \"DNA\"}")).identityKey())
                .isEqualTo("dna");
    }

    @Test
    @DisplayName("other items hash canonical content without merged fields")
    void canonicalContent() throws JsonProcessingException {
        KnowledgeItem a = hasher.keyed("progressionChains",
                node("{\"toRank\": 2, \"fromRank\": 1, \"confidence\": 0.3, \"origins\": [\"x\"]}"));
        KnowledgeItem b = hasher.keyed("progressionChains",
                node("{\"fromRank\": 1, \"toRank\": 2, \"confidence\": 0.9, \"origins\": [\"y\"], \"id\": \"old\"}"));
        KnowledgeItem c = hasher.keyed("progressionChains", node("{\"fromRank\": 2, \"toRank\": 3}"));

        assertThat(a.hash()).isEqualTo(b.hash());
        assertThat(a.hash()).isNotEqualTo(c.hash());
        assertThat(a.identityKey()).isEqualTo("{\"fromRank\":1,\"toRank\":2}");
    }

    @Test
    @DisplayName("incomplete triples fall through to the next rule")
    void incompleteTriple() throws JsonProcessingException {
        KnowledgeItem item = hasher.keyed("triples", node("{\"subject\": \"S\", \"object\": \" \", \"pattern\": \"P\"}"));

        assertThat(item.identityKey()).isEqualTo("p");
    }
}
