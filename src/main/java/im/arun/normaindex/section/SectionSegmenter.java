package im.arun.normaindex.section;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.Section;
import im.arun.normaindex.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits normalised document text into sections, in order of appearance.
 * <p>
 * Walks the lines once. A recognised heading closes the open section and opens the next one;
 * any other line is body content of the open section, or preamble (dropped) before the first
 * heading. A heading whose (number, title prefix) key was already accepted, typically a table
 * of contents entry seen again as the real heading, is treated as body text.
 */
public class SectionSegmenter {
    private static final Logger logger = LoggerFactory.getLogger(SectionSegmenter.class);

    private final HeadingMatcher headingMatcher;
    private final TextNormalizer normalizer;
    private final TrailingSectionTrimmer trimmer;
    private final int duplicateKeyTitleLength;

    public SectionSegmenter(ExtractorConfig config, TextNormalizer normalizer) {
        this(new HeadingMatcher(config.getSections()),
            normalizer,
            new TrailingSectionTrimmer(config.getSections()),
            config.getSections().getDuplicateKeyTitleLength());
    }

    public SectionSegmenter(HeadingMatcher headingMatcher,
                            TextNormalizer normalizer,
                            TrailingSectionTrimmer trimmer,
                            int duplicateKeyTitleLength) {
        this.headingMatcher = headingMatcher;
        this.normalizer = normalizer;
        this.trimmer = trimmer;
        this.duplicateKeyTitleLength = duplicateKeyTitleLength;
    }

    public List<Section> segment(String cleanText) {
        List<Section> sections = new ArrayList<>();
        if (cleanText == null || cleanText.isEmpty()) {
            return sections;
        }

        Set<String> seenHeadings = new HashSet<>();
        SectionAccumulator current = null;

        for (String line : cleanText.split("\n", -1)) {
            Optional<HeadingMatcher.Heading> heading = acceptHeading(line.strip(), seenHeadings);
            if (heading.isPresent()) {
                if (current != null) {
                    sections.add(current.close(normalizer, trimmer));
                }
                current = new SectionAccumulator(heading.get().getNumber(), heading.get().getTitle());
            } else if (current != null) {
                current.append(line);
            }
        }

        if (current != null) {
            sections.add(current.close(normalizer, trimmer));
        }

        logger.debug("Segmented {} sections", sections.size());
        return sections;
    }

    private Optional<HeadingMatcher.Heading> acceptHeading(String line, Set<String> seenHeadings) {
        if (line.isEmpty()) {
            return Optional.empty();
        }

        Optional<HeadingMatcher.Heading> annex = headingMatcher.matchCompleteAnnex(line);
        if (annex.isPresent()) {
            return seenHeadings.add(duplicateKey(annex.get())) ? annex : Optional.empty();
        }

        for (HeadingMatcher.Heading candidate : headingMatcher.matchNumbered(line)) {
            if (seenHeadings.add(duplicateKey(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private String duplicateKey(HeadingMatcher.Heading heading) {
        String title = heading.getTitle();
        return heading.getNumber() + "_" + title.substring(0, Math.min(duplicateKeyTitleLength, title.length()));
    }
}
