package im.arun.normaindex.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates per-run events and rewrites them as a JSON array after every entry,
 * so the file is complete even when the run is interrupted.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger(Path logDir, String runName) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("%s_%s.json", sanitize(runName), timestamp);

        try {
            Files.createDirectories(logDir);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", logDir, e);
        }

        this.logPath = logDir.resolve(logFileName);
    }

    private String sanitize(String runName) {
        if (runName == null || runName.isBlank()) {
            return "run";
        }
        return runName.replaceAll("[/\\\\]", "-");
    }

    public void info(String document, String message) {
        log("INFO", document, message);
    }

    public void warn(String document, String message) {
        log("WARNING", document, message);
    }

    public void error(String document, String message) {
        log("ERROR", document, message);
    }

    /**
     * Attach a free-form entry, e.g. a batch summary.
     */
    public void info(String message, Map<String, Object> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", "INFO");
        entry.put("message", message);
        entry.putAll(details);
        append(entry);
    }

    private void log(String level, String document, String message) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        if (document != null) {
            entry.put("document", document);
        }
        entry.put("message", message);
        append(entry);
    }

    private void append(Map<String, Object> entry) {
        logData.add(entry);
        writeToFile();
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public List<Map<String, Object>> getEntries() {
        return List.copyOf(logData);
    }

    public Path getLogPath() {
        return logPath;
    }
}
