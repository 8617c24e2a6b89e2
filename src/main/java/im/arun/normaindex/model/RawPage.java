package im.arun.normaindex.model;

import lombok.Value;

import java.util.List;

/**
 * Raw extraction output for one page, before any cleaning.
 */
@Value
public class RawPage {
    /** 1-based page number. */
    int pageNumber;
    /** Extracted text, null when the page has none. */
    String text;
    /** Table grids as rows of cells; cells may be null. */
    List<List<List<String>>> tables;
    List<BoundingBox> imagePlacements;
}
