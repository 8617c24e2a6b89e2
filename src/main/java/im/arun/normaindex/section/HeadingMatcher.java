package im.arun.normaindex.section;

import im.arun.normaindex.config.ExtractorConfig;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises section headings of UNE documents.
 * <p>
 * Grammars, in priority order:
 * <ul>
 *   <li>complete annex: "ANEXO C (Informativo)", alone or followed by text, for annexes without
 *   numbered subsections</li>
 *   <li>main section: "0 INTRODUCCIÓN", "13 FUNCIONAMIENTO DEL SISTEMA"</li>
 *   <li>subsection: "1.1 Generalidades", "6.5.2 Detectores de humo"</li>
 *   <li>annex subsection: "A.1 Objeto", "B.2.1 Ensayo de fuego"</li>
 * </ul>
 * Captured titles go through a false-positive filter (excluded leading words, minimum letters).
 * Duplicate suppression is left to the caller since it is per-document state.
 */
public class HeadingMatcher {

    public enum Kind { COMPLETE_ANNEX, MAIN_SECTION, SUBSECTION, ANNEX_SUBSECTION }

    @Value
    public static class Heading {
        String number;
        String title;
        Kind kind;
    }

    private static final Pattern COMPLETE_ANNEX = Pattern.compile(
        "^ANEXO\\s+([A-Z])\\s*\\((?:NORMATIVO|INFORMATIVO)\\)(?:\\s+\\S.*)?$",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern MAIN_SECTION = Pattern.compile(
        "^(\\d{1,2})\\s+([A-ZÁÉÍÓÚÑÜ][A-ZÁÉÍÓÚÑÜ\\s,]+)$");
    private static final Pattern SUBSECTION = Pattern.compile(
        "^(\\d{1,2}(?:\\.\\d{1,2}){1,3})\\s+([A-ZÁÉÍÓÚÑÜa-záéíóúñü][^\\n]{3,80})$");
    private static final Pattern ANNEX_SUBSECTION = Pattern.compile(
        "^([A-D]\\.\\d{1,2}(?:\\.\\d{1,2})?)\\s+([A-ZÁÉÍÓÚÑÜa-záéíóúñü][^\\n]{3,80})$");

    private final List<String> excludedWords;
    private final int minTitleLetters;
    private final Map<String, String> completeAnnexTitles;

    public HeadingMatcher(ExtractorConfig.SectionSettings settings) {
        this(settings.getExcludedTitleWords(), settings.getMinTitleLetters(), settings.getCompleteAnnexTitles());
    }

    public HeadingMatcher(List<String> excludedWords, int minTitleLetters, Map<String, String> completeAnnexTitles) {
        List<String> lowered = new ArrayList<>();
        for (String word : excludedWords) {
            lowered.add(word.toLowerCase(Locale.ROOT));
        }
        this.excludedWords = List.copyOf(lowered);
        this.minTitleLetters = minTitleLetters;
        Map<String, String> annexes = new TreeMap<>();
        completeAnnexTitles.forEach((letter, title) -> annexes.put(letter.toUpperCase(Locale.ROOT), title));
        this.completeAnnexTitles = Map.copyOf(annexes);
    }

    /**
     * Complete-annex heading on this line, numbered {@code <letter>.0} and titled from the
     * configured annex table. Only letters present in that table qualify.
     */
    public Optional<Heading> matchCompleteAnnex(String line) {
        Matcher matcher = COMPLETE_ANNEX.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String letter = matcher.group(1).toUpperCase(Locale.ROOT);
        String title = completeAnnexTitles.get(letter);
        if (title == null) {
            return Optional.empty();
        }
        return Optional.of(new Heading(letter + ".0", title, Kind.COMPLETE_ANNEX));
    }

    /**
     * Numbered headings on this line whose titles pass validation, in grammar priority order.
     */
    public List<Heading> matchNumbered(String line) {
        List<Heading> headings = new ArrayList<>(1);
        addIfValid(headings, MAIN_SECTION.matcher(line), Kind.MAIN_SECTION);
        addIfValid(headings, SUBSECTION.matcher(line), Kind.SUBSECTION);
        addIfValid(headings, ANNEX_SUBSECTION.matcher(line), Kind.ANNEX_SUBSECTION);
        return headings;
    }

    private void addIfValid(List<Heading> headings, Matcher matcher, Kind kind) {
        if (!matcher.matches()) {
            return;
        }
        String title = matcher.group(2).strip();
        if (isValidTitle(title)) {
            headings.add(new Heading(matcher.group(1), title, kind));
        }
    }

    /**
     * A title is rejected when it starts with an excluded word ("Tabla 3", "NOTA 1", "UNE 23007")
     * or has fewer than the minimum number of letters.
     */
    public boolean isValidTitle(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        for (String word : excludedWords) {
            if (startsWithWord(lower, word)) {
                return false;
            }
        }

        int letters = 0;
        for (int i = 0; i < title.length(); i++) {
            if (Character.isLetter(title.charAt(i))) {
                letters++;
            }
        }
        return letters >= minTitleLetters;
    }

    private static boolean startsWithWord(String text, String word) {
        if (!text.startsWith(word)) {
            return false;
        }
        return text.length() == word.length() || !Character.isLetter(text.charAt(word.length()));
    }
}
