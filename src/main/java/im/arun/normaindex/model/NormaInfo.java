package im.arun.normaindex.model;

import lombok.Value;

/**
 * Code and title read from the first pages of a norma. Both are empty strings when not found.
 */
@Value
public class NormaInfo {
    String code;
    String title;

    public boolean hasCode() {
        return !code.isEmpty();
    }
}
