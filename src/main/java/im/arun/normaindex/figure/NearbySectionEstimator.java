package im.arun.normaindex.figure;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.NearbySection;
import im.arun.normaindex.model.Section;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Guesses which section a figure belongs to from its page number alone.
 * <p>
 * The page's relative position in the body (after the leading cover/TOC pages) is mapped onto
 * the top-level sections. This is a coarse proxy, not a layout-derived mapping, and results are
 * always marked as estimates.
 */
public class NearbySectionEstimator {
    private static final Pattern TOP_LEVEL = Pattern.compile("\\d+");
    private static final int FALLBACK_SECTIONS = 10;

    private final int leadingPages;

    public NearbySectionEstimator(ExtractorConfig.FigureSettings settings) {
        this(settings.getLeadingPagesSkipped());
    }

    public NearbySectionEstimator(int leadingPages) {
        this.leadingPages = leadingPages;
    }

    /**
     * @param page       1-based page of the figure
     * @param totalPages page count of the document
     * @param sections   sections in document order
     * @return the estimate, or null when the document has no sections
     */
    public NearbySection estimate(int page, int totalPages, List<Section> sections) {
        if (sections == null || sections.isEmpty()) {
            return null;
        }

        if (page <= leadingPages) {
            Section introduction = sections.stream()
                .filter(s -> "0".equals(s.getNumber()))
                .findFirst()
                .orElse(sections.get(0));
            return NearbySection.estimatedFrom(introduction);
        }

        List<Section> eligible = sections.stream()
            .filter(s -> TOP_LEVEL.matcher(s.getNumber()).matches())
            .collect(Collectors.toList());
        if (eligible.isEmpty()) {
            eligible = sections.subList(0, Math.min(FALLBACK_SECTIONS, sections.size()));
        }

        int bodyPages = totalPages - leadingPages;
        double position = bodyPages > 0 ? (double) (page - leadingPages) / bodyPages : 0.0;
        int index = (int) (position * eligible.size());
        index = Math.max(0, Math.min(index, eligible.size() - 1));
        return NearbySection.estimatedFrom(eligible.get(index));
    }
}
