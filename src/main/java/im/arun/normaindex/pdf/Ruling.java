package im.arun.normaindex.pdf;

import lombok.Value;

/**
 * A horizontal or vertical line segment drawn on a page, in top-left page coordinates.
 * For a horizontal ruling {@code position} is its y and the span runs along x; for a vertical
 * ruling the other way round.
 */
@Value
public class Ruling {
    boolean horizontal;
    double position;
    double start;
    double end;

    public static Ruling horizontal(double y, double x0, double x1) {
        return new Ruling(true, y, Math.min(x0, x1), Math.max(x0, x1));
    }

    public static Ruling vertical(double x, double top, double bottom) {
        return new Ruling(false, x, Math.min(top, bottom), Math.max(top, bottom));
    }

    public double length() {
        return end - start;
    }

    public Ruling withPosition(double newPosition) {
        return new Ruling(horizontal, newPosition, start, end);
    }

    public Ruling withSpan(double newStart, double newEnd) {
        return new Ruling(horizontal, position, newStart, newEnd);
    }

    /**
     * True when this ruling and a perpendicular one cross, allowing {@code tolerance} of slack.
     */
    public boolean intersects(Ruling other, double tolerance) {
        if (horizontal == other.horizontal) {
            return false;
        }
        return other.position >= start - tolerance && other.position <= end + tolerance
            && position >= other.start - tolerance && position <= other.end + tolerance;
    }

    /**
     * True when the ruling covers the given coordinate along its span.
     */
    public boolean covers(double coordinate, double tolerance) {
        return coordinate >= start - tolerance && coordinate <= end + tolerance;
    }
}
