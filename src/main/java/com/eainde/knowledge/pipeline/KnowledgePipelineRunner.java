package com.eainde.knowledge.pipeline;

import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch on startup when {@code knowledge.run-on-startup=true}.
 *
 * <p>Option arguments override the configured settings:
 * {@code --root=<dir>}, {@code --output=<file>} and {@code --prior=<file>} (repeatable).</p>
 */
@Log4j2
@Component
@ConditionalOnProperty(name = "knowledge.run-on-startup", havingValue = "true")
public class KnowledgePipelineRunner implements ApplicationRunner {

    private final KnowledgePipeline pipeline;
    private final PipelineSettings settings;

    public KnowledgePipelineRunner(KnowledgePipeline pipeline, PipelineSettings settings) {
        this.pipeline = pipeline;
        this.settings = settings;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineSettings effective = settings;
        if (args.containsOption("root")) {
            effective = effective.withScanRoot(Path.of(single(args, "root")));
        }
        if (args.containsOption("output")) {
            effective = effective.withOutputPath(Path.of(single(args, "output")));
        }
        if (args.containsOption("prior")) {
            effective = effective.withPriorFiles(args.getOptionValues("prior").stream().map(Path::of).toList());
        }

        KnowledgeBaseDocument document = pipeline.run(effective);
        log.info("Run {} produced {} surviving facts from {} documents",
                document.metadata().runId(), document.metadata().survivingFacts(),
                document.metadata().documentsScanned());
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        String last = values == null || values.isEmpty() ? null : values.get(values.size() - 1);
        if (last == null || last.isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires a value");
        }
        return last;
    }
}
