package im.arun.normaindex.text;

import im.arun.normaindex.config.ExtractorConfig;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Strips running headers, footers, licence boilerplate, page numbers and TOC lines from
 * extracted page text, then repairs hyphenated line wraps.
 * <p>
 * Noise removal runs before hyphen joining so removed boilerplate can never trigger a join.
 * The pass is repeated until the text stops changing, which keeps the result stable under
 * a second normalisation (a join can create a line that is itself noise).
 */
public class TextNormalizer {
    private static final int FLAGS = Pattern.MULTILINE | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern HYPHENATED_WRAP = Pattern.compile("(?<=\\p{L})-[ \\t]*\\n[ \\t]*(?=\\p{L})");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");

    private final List<Pattern> noisePatterns;

    /**
     * Configured noise patterns plus the bare annex caption rule, which keeps the captions of
     * the configured complete annexes since those lines open a section.
     */
    public TextNormalizer(ExtractorConfig config) {
        this(config.getText().getNoisePatterns(), config.getSections().getCompleteAnnexTitles().keySet());
    }

    public TextNormalizer(List<String> noisePatterns, Collection<String> completeAnnexLetters) {
        this(withAnnexCaptionRule(noisePatterns, completeAnnexLetters));
    }

    public TextNormalizer(List<String> noisePatterns) {
        this.noisePatterns = noisePatterns.stream()
            .map(p -> Pattern.compile(p, FLAGS))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Regex for a standalone "ANEXO X (Normativo)" line whose letter is not one of the given ones.
     */
    private static String annexCaptionPattern(Collection<String> keptLetters) {
        if (keptLetters.isEmpty()) {
            return "^ANEXO\\s+[A-Z]\\s*\\([^)]+\\)\\s*$";
        }
        String kept = keptLetters.stream()
            .map(letter -> Pattern.quote(letter.strip()))
            .collect(Collectors.joining("|"));
        return "^ANEXO\\s+(?!(?:" + kept + ")\\s*\\()[A-Z]\\s*\\([^)]+\\)\\s*$";
    }

    private static List<String> withAnnexCaptionRule(List<String> noisePatterns, Collection<String> keptLetters) {
        List<String> patterns = new ArrayList<>(noisePatterns);
        patterns.add(annexCaptionPattern(keptLetters));
        return patterns;
    }

    /**
     * Clean raw text. Total: null and empty input both yield an empty string.
     */
    public String normalize(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return "";
        }

        String current = LINE_BREAKS.matcher(rawText).replaceAll("\n");
        while (true) {
            String next = singlePass(current);
            // Every step only deletes characters, so this converges
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
    }

    private String singlePass(String text) {
        for (Pattern pattern : noisePatterns) {
            text = pattern.matcher(text).replaceAll("");
        }
        text = HYPHENATED_WRAP.matcher(text).replaceAll("");
        text = BLANK_RUN.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}
