package im.arun.normaindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured result for one norma.
 */
@Value
@Builder
@JsonPropertyOrder({"norma", "titulo", "archivo_origen", "fecha_extraccion", "paginas_totales",
    "secciones", "tablas", "figuras"})
public class DocumentRecord {

    /** Standard code, or the file stem when no code was found. */
    @JsonProperty("norma")
    String code;

    @JsonProperty("titulo")
    String title;

    @JsonProperty("archivo_origen")
    String sourceFilename;

    @JsonProperty("fecha_extraccion")
    String extractedAt;

    @JsonProperty("paginas_totales")
    int totalPages;

    @JsonProperty("secciones")
    List<Section> sections;

    @JsonProperty("tablas")
    List<ExtractedTable> tables;

    @JsonProperty("figuras")
    List<Figure> figures;

    /**
     * The reduced artifact for consumers that only need tables.
     */
    public TableExport toTableExport() {
        return new TableExport(code, tables);
    }
}
