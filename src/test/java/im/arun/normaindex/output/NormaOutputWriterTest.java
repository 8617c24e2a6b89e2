package im.arun.normaindex.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.normaindex.model.BoundingBox;
import im.arun.normaindex.model.DocumentRecord;
import im.arun.normaindex.model.ExtractedTable;
import im.arun.normaindex.model.ExtractionResult;
import im.arun.normaindex.model.Figure;
import im.arun.normaindex.model.NearbySection;
import im.arun.normaindex.model.Section;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NormaOutputWriterTest {

    @TempDir
    Path outputDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldWriteRecordTablesAndFigures() throws IOException {
        Section section = new Section("1", "OBJETO Y CAMPO DE APLICACIÓN", "Esta norma especifica requisitos.");
        Figure figure = new Figure("fig_p7_1", "figuras/une_23007-14/fig_p7_1.png", 7,
            new BoundingBox(100, 100, 400, 250), NearbySection.estimatedFrom(section), "png", 4);
        ExtractedTable table = new ExtractedTable("tabla_p6_1", 6, List.of("Tipo", "Valor"), List.of(List.of("A", "1")));
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};

        List<Path> written = new NormaOutputWriter(outputDir).write(new ExtractionResult(
            record(List.of(section), List.of(table), List.of(figure)), Map.of("fig_p7_1", png), "une_23007-14"));

        Path recordPath = outputDir.resolve("normas/une_23007-14.json");
        Path tablesPath = outputDir.resolve("tablas/une_23007-14_tablas.json");
        Path figurePath = outputDir.resolve("figuras/une_23007-14/fig_p7_1.png");
        assertThat(written).containsExactly(recordPath, tablesPath, figurePath);
        assertThat(Files.readAllBytes(figurePath)).isEqualTo(png);

        JsonNode json = mapper.readTree(Files.readString(recordPath, StandardCharsets.UTF_8));
        assertThat(json.get("norma").asText()).isEqualTo("UNE23007-14:2014");
        assertThat(json.get("paginas_totales").asInt()).isEqualTo(12);
        assertThat(json.get("secciones").get(0).get("titulo").asText()).isEqualTo("OBJETO Y CAMPO DE APLICACIÓN");
        JsonNode figureJson = json.get("figuras").get(0);
        assertThat(figureJson.get("archivo").asText()).isEqualTo("figuras/une_23007-14/fig_p7_1.png");
        assertThat(figureJson.get("bbox").get("width").asDouble()).isEqualTo(300.0);
        assertThat(figureJson.get("bbox").has("x0")).isFalse();
        assertThat(figureJson.get("seccion_cercana").get("estimada").asBoolean()).isTrue();
        assertThat(figureJson.get("tamano_bytes").asLong()).isEqualTo(4);

        JsonNode tables = mapper.readTree(tablesPath.toFile());
        assertThat(tables.fieldNames()).toIterable().containsExactly("norma", "tablas");
        assertThat(tables.get("tablas").get(0).get("cabecera").get(1).asText()).isEqualTo("Valor");
    }

    @Test
    void shouldSkipTablesFile_whenThereAreNoTables() throws IOException {
        new NormaOutputWriter(outputDir).write(new ExtractionResult(
            record(List.of(), List.of(), List.of()), Map.of(), "vacia"));

        assertThat(outputDir.resolve("normas/vacia.json")).exists();
        assertThat(outputDir.resolve("tablas/vacia_tablas.json")).doesNotExist();
    }

    @Test
    void shouldOmitNearbySection_whenNotEstimated() throws IOException {
        Figure figure = new Figure("fig_p6_1", "figuras/doc/fig_p6_1.png", 6,
            new BoundingBox(0, 0, 100, 100), null, "png", 1);

        new NormaOutputWriter(outputDir).write(new ExtractionResult(
            record(List.of(), List.of(), List.of(figure)), Map.of("fig_p6_1", new byte[]{1}), "doc"));

        JsonNode json = mapper.readTree(outputDir.resolve("normas/doc.json").toFile());
        assertThat(json.get("figuras").get(0).has("seccion_cercana")).isFalse();
    }

    private static DocumentRecord record(List<Section> sections, List<ExtractedTable> tables, List<Figure> figures) {
        return DocumentRecord.builder()
            .code("UNE23007-14:2014")
            .title("Sistemas de detección y de alarma de incendios")
            .sourceFilename("UNE 23007-14.pdf")
            .extractedAt("2024-05-01T10:15:30")
            .totalPages(12)
            .sections(sections)
            .tables(tables)
            .figures(figures)
            .build();
    }
}
