package im.arun.normaindex.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.normaindex.model.DocumentRecord;
import im.arun.normaindex.model.ExtractionResult;
import im.arun.normaindex.model.Figure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the artifacts of one document under the output directory:
 * <pre>
 * normas/&lt;base&gt;.json
 * tablas/&lt;base&gt;_tablas.json      (only when the document has tables)
 * figuras/&lt;base&gt;/&lt;id&gt;.png
 * </pre>
 */
public class NormaOutputWriter {
    private static final Logger logger = LoggerFactory.getLogger(NormaOutputWriter.class);
    static final String NORMAS_DIR = "normas";
    static final String TABLAS_DIR = "tablas";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public NormaOutputWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return every file written, record first
     */
    public List<Path> write(ExtractionResult result) throws IOException {
        DocumentRecord record = result.getRecord();
        String baseName = result.getBaseName();
        List<Path> written = new ArrayList<>();

        // Figures first so a record never points at a missing image
        for (Figure figure : record.getFigures()) {
            byte[] image = result.getFigureImages().get(figure.getId());
            if (image == null) {
                logger.warn("No image data for figure {}, skipping file", figure.getId());
                continue;
            }
            Path target = outputDir.resolve(figure.getFile());
            Files.createDirectories(target.getParent());
            Files.write(target, image);
            written.add(target);
        }

        Path recordPath = outputDir.resolve(NORMAS_DIR).resolve(baseName + ".json");
        writeJson(recordPath, record);
        written.add(0, recordPath);
        logger.info("  Saved: {}", recordPath);

        if (!record.getTables().isEmpty()) {
            Path tablesPath = outputDir.resolve(TABLAS_DIR).resolve(baseName + "_tablas.json");
            writeJson(tablesPath, record.toTableExport());
            written.add(1, tablesPath);
            logger.info("  Saved: {}", tablesPath);
        }

        return written;
    }

    private void writeJson(Path target, Object value) throws IOException {
        Files.createDirectories(target.getParent());
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            objectMapper.writeValue(writer, value);
        }
    }
}
