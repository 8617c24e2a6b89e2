package im.arun.normaindex.service;

import im.arun.normaindex.model.BatchSummary;
import im.arun.normaindex.model.ExtractionResult;
import im.arun.normaindex.output.NormaOutputWriter;
import im.arun.normaindex.util.JsonLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Processes documents one after another. A failing document is logged and counted;
 * it never stops the batch.
 */
public class BatchProcessor {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private final NormaExtractionService extractionService;
    private final JsonLogger runLog;

    public BatchProcessor(NormaExtractionService extractionService, JsonLogger runLog) {
        this.extractionService = extractionService;
        this.runLog = runLog;
    }

    public BatchSummary processAll(List<Path> pdfs, Path outputDir) {
        NormaOutputWriter writer = new NormaOutputWriter(outputDir);
        List<String> processed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        logger.info("Found {} PDF file(s)", pdfs.size());
        for (Path pdf : pdfs) {
            String fileName = pdf.getFileName().toString();
            try {
                Optional<ExtractionResult> result = extractionService.process(pdf);
                if (result.isEmpty()) {
                    skipped.add(fileName);
                    runLog.warn(fileName, "No extractable text, document skipped");
                    continue;
                }

                ExtractionResult extraction = result.get();
                writer.write(extraction);
                processed.add(fileName);
                runLog.info(fileName, String.format("Extracted %d sections, %d tables, %d figures",
                    extraction.getRecord().getSections().size(),
                    extraction.getRecord().getTables().size(),
                    extraction.getRecord().getFigures().size()));
            } catch (Exception e) {
                logger.error("Error processing {}", fileName, e);
                runLog.error(fileName, e.getClass().getSimpleName() + ": " + e.getMessage());
                failed.add(fileName);
            }
        }

        BatchSummary summary = new BatchSummary(processed, skipped, failed);
        logger.info("Processing complete: {} processed, {} skipped, {} failed",
            processed.size(), skipped.size(), failed.size());
        runLog.info("Batch finished", Map.of(
            "processed", processed.size(),
            "skipped", skipped.size(),
            "failed", List.copyOf(failed)));
        return summary;
    }
}
