package im.arun.normaindex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * A rendered figure region with its placement on the page.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "archivo", "pagina", "bbox", "seccion_cercana", "formato", "tamano_bytes"})
public class Figure {

    @JsonProperty("id")
    String id;

    /** Path of the image file relative to the output directory. */
    @JsonProperty("archivo")
    String file;

    @JsonProperty("pagina")
    int page;

    @JsonProperty("bbox")
    BoundingBox bbox;

    @JsonProperty("seccion_cercana")
    NearbySection nearbySection;

    @JsonProperty("formato")
    String format;

    @JsonProperty("tamano_bytes")
    long byteSize;
}
