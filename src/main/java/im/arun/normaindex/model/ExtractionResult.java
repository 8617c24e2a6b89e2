package im.arun.normaindex.model;

import lombok.Value;

import java.util.Map;

/**
 * Record for one document plus the rendered figure images, keyed by figure id.
 */
@Value
public class ExtractionResult {
    DocumentRecord record;
    Map<String, byte[]> figureImages;
    /** File-system friendly name used for every output artifact of the document. */
    String baseName;
}
