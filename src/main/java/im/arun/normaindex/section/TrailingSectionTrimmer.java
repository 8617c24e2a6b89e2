package im.arun.normaindex.section;

import im.arun.normaindex.config.ExtractorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cuts lines that belong to the following heading but were laid out at the bottom of the
 * current section's page area.
 * <p>
 * Only the last lines of the buffer are inspected, and a candidate counts only when it sits in
 * the tail of the content; earlier matches are treated as in-body references.
 */
public class TrailingSectionTrimmer {
    private static final Logger logger = LoggerFactory.getLogger(TrailingSectionTrimmer.class);

    private static final List<Pattern> NEXT_HEADING = List.of(
        Pattern.compile("^ANEXO\\s+[A-Z]\\s*\\("),
        Pattern.compile("^NOTA\\s+En la numeraci"),
        Pattern.compile("^\\d{1,2}\\s+[A-ZÁÉÍÓÚÑ][A-ZÁÉÍÓÚÑ\\s]+$"),
        Pattern.compile("^[A-Z]\\.\\d+\\s+[A-Z]")
    );

    private final int windowLines;
    private final double tailRatio;

    public TrailingSectionTrimmer(ExtractorConfig.SectionSettings settings) {
        this(settings.getTrimWindowLines(), settings.getTrimTailRatio());
    }

    public TrailingSectionTrimmer(int windowLines, double tailRatio) {
        this.windowLines = windowLines;
        this.tailRatio = tailRatio;
    }

    public String trim(String content, String sectionNumber) {
        if (content == null || content.isEmpty()) {
            return "";
        }

        String[] lines = content.split("\n", -1);
        int cut = lines.length;
        int floor = Math.max(0, lines.length - windowLines);
        for (int i = lines.length - 1; i >= floor; i--) {
            if (i > lines.length * tailRatio && looksLikeHeading(lines[i].strip())) {
                cut = i;
                break;
            }
        }

        if (cut == lines.length) {
            return content.strip();
        }
        logger.debug("Section {}: dropped {} trailing lines starting at '{}'",
            sectionNumber, lines.length - cut, lines[cut].strip());
        return String.join("\n", Arrays.copyOfRange(lines, 0, cut)).strip();
    }

    private static boolean looksLikeHeading(String line) {
        for (Pattern pattern : NEXT_HEADING) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }
}
