package com.eainde.knowledge.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Run-level settings resolved from configuration.
 *
 * @param sourceId       identifier written into the output metadata and used as fallback origin
 * @param scanRoot       directory to scan
 * @param priorFiles     previously persisted knowledge files to merge with
 * @param outputPath     where the knowledge base is written, null to skip writing
 * @param workers        extraction worker count, 0 or less means one per available processor
 */
public record PipelineSettings(
        String sourceId,
        Path scanRoot,
        List<Path> priorFiles,
        Path outputPath,
        int workers
) {

    public PipelineSettings {
        priorFiles = priorFiles == null ? List.of() : List.copyOf(priorFiles);
    }

    public int effectiveWorkers() {
        return workers > 0 ? workers : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public PipelineSettings withScanRoot(Path root) {
        return new PipelineSettings(sourceId, root, priorFiles, outputPath, workers);
    }

    public PipelineSettings withOutputPath(Path path) {
        return new PipelineSettings(sourceId, scanRoot, priorFiles, path, workers);
    }

    public PipelineSettings withPriorFiles(List<Path> files) {
        return new PipelineSettings(sourceId, scanRoot, files, outputPath, workers);
    }
}
