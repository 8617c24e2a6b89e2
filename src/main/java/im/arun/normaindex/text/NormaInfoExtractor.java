package im.arun.normaindex.text;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.NormaInfo;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads the standard code ("UNE 23007-14:2014", "UNE-EN 54-2") and the descriptive title from
 * the opening text of a norma.
 */
public class NormaInfoExtractor {
    private static final Pattern CODE = Pattern.compile(
        "(UNE(?:-EN)?[\\s-]*\\d+(?:[:-]\\d+)*(?::\\d{4})?)", Pattern.CASE_INSENSITIVE);

    private final Pattern titlePattern;
    private final int searchWindow;

    public NormaInfoExtractor(ExtractorConfig.TextSettings settings) {
        this(settings.getTitlePrefixes(), settings.getCodeSearchWindow());
    }

    public NormaInfoExtractor(List<String> titlePrefixes, int searchWindow) {
        String alternatives = titlePrefixes.stream()
            .map(prefix -> Pattern.quote(prefix) + "[^\\n]+")
            .collect(Collectors.joining("|"));
        this.titlePattern = alternatives.isEmpty()
            ? null
            : Pattern.compile("(?:" + alternatives + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.searchWindow = searchWindow;
    }

    public NormaInfo extract(String cleanText) {
        if (cleanText == null || cleanText.isEmpty()) {
            return new NormaInfo("", "");
        }
        String head = cleanText.substring(0, Math.min(searchWindow, cleanText.length()));

        Matcher codeMatcher = CODE.matcher(head);
        if (!codeMatcher.find()) {
            return new NormaInfo("", "");
        }
        String code = codeMatcher.group(1).strip().toUpperCase(Locale.ROOT).replace(" ", "");

        String title = "";
        if (titlePattern != null) {
            Matcher titleMatcher = titlePattern.matcher(head);
            if (titleMatcher.find()) {
                title = titleMatcher.group().strip();
            }
        }
        return new NormaInfo(code, title);
    }
}
