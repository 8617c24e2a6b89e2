package im.arun.normaindex.section;

import im.arun.normaindex.model.Section;
import im.arun.normaindex.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * The open section of a segmentation run: heading plus the body lines seen so far.
 * Closing it produces the finished, immutable {@link Section}.
 */
class SectionAccumulator {
    private final String number;
    private final String title;
    private final List<String> lines = new ArrayList<>();

    SectionAccumulator(String number, String title) {
        this.number = number;
        this.title = title;
    }

    void append(String line) {
        lines.add(line);
    }

    String number() {
        return number;
    }

    int lineCount() {
        return lines.size();
    }

    Section close(TextNormalizer normalizer, TrailingSectionTrimmer trimmer) {
        String content = normalizer.normalize(String.join("\n", lines));
        return new Section(number, title, trimmer.trim(content, number));
    }
}
