package im.arun.normaindex.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLoggerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteEntriesAsJsonArray() throws IOException {
        JsonLogger logger = new JsonLogger(tempDir.resolve("logs"), "norma-index");

        logger.info("a.pdf", "Extracted 3 sections");
        logger.warn("b.pdf", "No extractable text");
        logger.info("Batch finished", Map.of("processed", 1));

        JsonNode log = new ObjectMapper().readTree(logger.getLogPath().toFile());
        assertThat(log.isArray()).isTrue();
        assertThat(log).hasSize(3);
        assertThat(log.get(0).get("level").asText()).isEqualTo("INFO");
        assertThat(log.get(0).get("document").asText()).isEqualTo("a.pdf");
        assertThat(log.get(1).get("level").asText()).isEqualTo("WARNING");
        assertThat(log.get(2).get("processed").asInt()).isEqualTo(1);
    }

    @Test
    void shouldNameLogFileAfterRun() {
        JsonLogger logger = new JsonLogger(tempDir, "lote/nocturno");

        assertThat(logger.getLogPath().getParent()).isEqualTo(tempDir);
        assertThat(logger.getLogPath().getFileName().toString())
            .startsWith("lote-nocturno_")
            .endsWith(".json");
    }
}
