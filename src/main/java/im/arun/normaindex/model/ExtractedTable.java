package im.arun.normaindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * A table grid that survived cleaning: first row as header, the rest as data.
 */
@Value
@JsonPropertyOrder({"id", "pagina", "cabecera", "datos"})
public class ExtractedTable {

    @JsonProperty("id")
    String id;

    @JsonProperty("pagina")
    int page;

    @JsonProperty("cabecera")
    List<String> header;

    @JsonProperty("datos")
    List<List<String>> rows;
}
