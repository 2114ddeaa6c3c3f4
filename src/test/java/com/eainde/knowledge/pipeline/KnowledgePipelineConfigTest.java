package com.eainde.knowledge.pipeline;

import com.eainde.knowledge.catalog.CatalogValidationException;
import com.eainde.knowledge.catalog.CategoryPatternCatalog;
import com.eainde.knowledge.oracle.ChatModelValidationOracle;
import com.eainde.knowledge.oracle.StaticValidationOracle;
import com.eainde.knowledge.oracle.ValidationOracle;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class KnowledgePipelineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(KnowledgePipelineConfig.class);

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should wire the pipeline from the bundled tables")
        void wiresPipeline() {
            contextRunner.run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(KnowledgePipeline.class);
                assertThat(context.getBean(CategoryPatternCatalog.class).size()).isEqualTo(19);
                assertThat(context.getBean(ValidationOracle.class)).isInstanceOf(StaticValidationOracle.class);
                assertThat(context).doesNotHaveBean(KnowledgePipelineRunner.class);
            });
        }

        @Test
        @DisplayName("should build settings from properties")
        void settings() {
            contextRunner
                    .withPropertyValues(
                            "knowledge.source-id=nightly",
                            "knowledge.scan.root=/data/corpus",
                            "knowledge.merge.prior-collections= a.json, ,b.json ",
                            "knowledge.output.path=",
                            "knowledge.extraction.workers=3")
                    .run(context -> {
                        PipelineSettings settings = context.getBean(PipelineSettings.class);
                        assertThat(settings.sourceId()).isEqualTo("nightly");
                        assertThat(settings.scanRoot()).isEqualTo(Path.of("/data/corpus"));
                        assertThat(settings.priorFiles()).containsExactly(Path.of("a.json"), Path.of("b.json"));
                        assertThat(settings.outputPath()).isNull();
                        assertThat(settings.effectiveWorkers()).isEqualTo(3);
                    });
        }
    }

    @Nested
    @DisplayName("Startup validation")
    class StartupValidation {

        @Test
        @DisplayName("should refuse to start with an inconsistent category catalog")
        void invalidCatalog() {
            contextRunner
                    .withPropertyValues("knowledge.catalog.location=classpath:catalogs/dangling.yml")
                    .run(context -> {
                        assertThat(context).hasFailed();
                        assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(CatalogValidationException.class);
                    });
        }

        @Test
        @DisplayName("should refuse to start when a table resource is missing")
        void missingResource() {
            contextRunner
                    .withPropertyValues("knowledge.scoring.location=classpath:no-such-table.yml")
                    .run(context -> assertThat(context).hasFailed());
        }

        @Test
        @DisplayName("should require a ChatModel bean in chat-model oracle mode")
        void chatModelModeWithoutModel() {
            contextRunner
                    .withPropertyValues("knowledge.oracle.mode=chat-model")
                    .run(context -> {
                        assertThat(context).hasFailed();
                        assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(IllegalStateException.class);
                    });
        }

        @Test
        @DisplayName("should reject an unknown oracle mode")
        void unknownMode() {
            contextRunner
                    .withPropertyValues("knowledge.oracle.mode=crystal-ball")
                    .run(context -> assertThat(context).hasFailed());
        }
    }

    @Test
    @DisplayName("should consult the chat model when one is configured")
    void chatModelOracle() {
        contextRunner
                .withBean(ChatModel.class, () -> mock(ChatModel.class))
                .withPropertyValues("knowledge.oracle.mode=chat-model")
                .run(context -> assertThat(context.getBean(ValidationOracle.class))
                        .isInstanceOf(ChatModelValidationOracle.class));
    }

    @Test
    @DisplayName("should split comma separated properties, dropping blanks")
    void csv() {
        assertThat(KnowledgePipelineConfig.csv(" md, txt,,json ")).containsExactly("md", "txt", "json");
        assertThat(KnowledgePipelineConfig.csv("  ")).isEmpty();
    }
}
