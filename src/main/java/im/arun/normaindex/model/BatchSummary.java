package im.arun.normaindex.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a batch run, by source file name.
 */
@Value
public class BatchSummary {
    List<String> processed;
    List<String> skipped;
    List<String> failed;

    public int total() {
        return processed.size() + skipped.size() + failed.size();
    }
}
