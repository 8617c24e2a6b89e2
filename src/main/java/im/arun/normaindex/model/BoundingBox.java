package im.arun.normaindex.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Axis-aligned box in page coordinates (PDF points, origin at the top-left corner).
 */
@Value
@JsonPropertyOrder({"x", "y", "width", "height"})
public class BoundingBox {
    @JsonIgnore
    double x0;
    @JsonIgnore
    double top;
    @JsonIgnore
    double x1;
    @JsonIgnore
    double bottom;

    public static BoundingBox ofSize(double x, double y, double width, double height) {
        return new BoundingBox(x, y, x + width, y + height);
    }

    @JsonProperty("x")
    public double getX() {
        return x0;
    }

    @JsonProperty("y")
    public double getY() {
        return top;
    }

    @JsonProperty("width")
    public double getWidth() {
        return x1 - x0;
    }

    @JsonProperty("height")
    public double getHeight() {
        return bottom - top;
    }

    /**
     * Smallest box containing both boxes.
     */
    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
            Math.min(x0, other.x0),
            Math.min(top, other.top),
            Math.max(x1, other.x1),
            Math.max(bottom, other.bottom));
    }

    public BoundingBox expand(double margin) {
        return new BoundingBox(x0 - margin, top - margin, x1 + margin, bottom + margin);
    }

    /**
     * True when the boxes share any point on both axes. Touching edges count.
     */
    public boolean overlaps(BoundingBox other) {
        return !(x1 < other.x0 || other.x1 < x0 || bottom < other.top || other.bottom < top);
    }

    /**
     * Adjacency used for figure tiles: this box grown by {@code tolerance} overlaps the other.
     */
    public boolean isAdjacentTo(BoundingBox other, double tolerance) {
        return expand(tolerance).overlaps(other);
    }
}
