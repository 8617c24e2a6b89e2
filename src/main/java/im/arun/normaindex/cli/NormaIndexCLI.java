package im.arun.normaindex.cli;

import im.arun.normaindex.config.ConfigLoader;
import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.BatchSummary;
import im.arun.normaindex.service.BatchProcessor;
import im.arun.normaindex.service.NormaExtractionService;
import im.arun.normaindex.util.JsonLogger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command-line interface for norma-index using Picocli.
 */
@Command(
    name = "norma-index",
    description = "Extract sections, tables and figures from UNE standard PDFs into JSON",
    mixinStandardHelpOptions = true,
    version = "norma-index 1.0"
)
public class NormaIndexCLI implements Callable<Integer> {

    @Option(names = {"--pdf-dir"}, description = "Directory containing the PDF files", defaultValue = "pdfs")
    private String pdfDir;

    @Option(names = {"--archivo"}, description = "Single PDF file to process (inside --pdf-dir)")
    private String archivo;

    @Option(names = {"--output"}, description = "Output directory", defaultValue = "output")
    private String outputDir;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--no-figures"}, description = "Skip figure extraction")
    private boolean noFigures;

    @Option(names = {"--dpi"}, description = "Figure rendering resolution")
    private Float dpi;

    @Option(names = {"--max-figures"}, description = "Maximum figures per document")
    private Integer maxFigures;

    @Option(names = {"--log-dir"}, description = "Directory for the JSON run log", defaultValue = "logs")
    private String logDir;

    @Override
    public Integer call() throws Exception {
        Path pdfDirectory = Paths.get(pdfDir);
        if (!Files.isDirectory(pdfDirectory)) {
            System.err.println("Error: PDF directory does not exist: " + pdfDirectory);
            return 1;
        }

        List<Path> pdfs;
        if (archivo != null) {
            Path pdf = pdfDirectory.resolve(archivo);
            if (!Files.exists(pdf)) {
                System.err.println("Error: file not found: " + pdf);
                return 1;
            }
            pdfs = List.of(pdf);
        } else {
            pdfs = listPdfs(pdfDirectory);
        }

        if (pdfs.isEmpty()) {
            System.err.println("Error: no PDF files found in " + pdfDirectory);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (noFigures) {
            overrides.put("figures.enabled", false);
        }
        if (dpi != null) {
            overrides.put("figures.renderDpi", dpi);
        }
        if (maxFigures != null) {
            overrides.put("figures.maxPerDocument", maxFigures);
        }
        ExtractorConfig config = new ConfigLoader(configPath).load(overrides);

        System.out.println("norma-index - UNE standard extractor");
        System.out.println("=".repeat(50));
        System.out.println("PDFs: " + pdfs.size() + " in " + pdfDirectory);
        System.out.println("Output: " + outputDir);
        System.out.println();

        JsonLogger runLog = new JsonLogger(Paths.get(logDir), "norma-index");
        BatchProcessor processor = new BatchProcessor(new NormaExtractionService(config), runLog);
        BatchSummary summary = processor.processAll(pdfs, Paths.get(outputDir));

        System.out.printf("%nProcessed %d of %d document(s), %d skipped, %d failed%n",
            summary.getProcessed().size(), summary.total(), summary.getSkipped().size(), summary.getFailed().size());
        if (!summary.getFailed().isEmpty()) {
            System.out.println("Failed: " + String.join(", ", summary.getFailed()));
        }
        System.out.println("Run log: " + runLog.getLogPath());
        return 0;
    }

    private static List<Path> listPdfs(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NormaIndexCLI()).execute(args);
        System.exit(exitCode);
    }
}
