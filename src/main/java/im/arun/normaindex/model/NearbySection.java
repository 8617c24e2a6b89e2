package im.arun.normaindex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Section a figure probably belongs to. Derived from the page position only, never from layout,
 * so it is always flagged as an estimate.
 */
@Value
@JsonPropertyOrder({"numero", "titulo", "estimada"})
public class NearbySection {

    @JsonProperty("numero")
    String number;

    @JsonProperty("titulo")
    String title;

    @JsonProperty("estimada")
    public boolean isEstimated() {
        return true;
    }

    public static NearbySection estimatedFrom(Section section) {
        return new NearbySection(section.getNumber(), section.getTitle());
    }
}
