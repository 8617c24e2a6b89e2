package im.arun.normaindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

@Value
@JsonPropertyOrder({"norma", "tablas"})
public class TableExport {

    @JsonProperty("norma")
    String code;

    @JsonProperty("tablas")
    List<ExtractedTable> tables;
}
