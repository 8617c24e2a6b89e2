package im.arun.normaindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * A numbered section or annex of a norma with its cleaned prose.
 */
@Value
@JsonPropertyOrder({"numero", "titulo", "contenido"})
public class Section {

    /** Canonical heading label, e.g. "1", "6.5.2", "A.1", "C.0". */
    @JsonProperty("numero")
    String number;

    @JsonProperty("titulo")
    String title;

    @JsonProperty("contenido")
    String content;
}
