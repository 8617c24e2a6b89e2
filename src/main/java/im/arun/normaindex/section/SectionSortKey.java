package im.arun.normaindex.section;

import lombok.Value;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sort key of a section label: (prefix, major, minor, patch).
 * Numeric sections have prefix 0; annexes A-D follow with 1 + letter rank.
 */
@Value
public class SectionSortKey implements Comparable<SectionSortKey> {
    private static final Pattern LABEL = Pattern.compile("([A-Z])?\\.?(\\d+)?\\.?(\\d+)?\\.?(\\d+)?");
    private static final Comparator<SectionSortKey> ORDER = Comparator
        .comparingInt(SectionSortKey::getPrefix)
        .thenComparingInt(SectionSortKey::getMajor)
        .thenComparingInt(SectionSortKey::getMinor)
        .thenComparingInt(SectionSortKey::getPatch);

    /** Key for labels that cannot be parsed; sorts after everything else. */
    public static final SectionSortKey UNPARSEABLE = new SectionSortKey(999, 999, 999, 999);

    int prefix;
    int major;
    int minor;
    int patch;

    public static SectionSortKey of(String label) {
        if (label == null) {
            return UNPARSEABLE;
        }
        Matcher matcher = LABEL.matcher(label.strip().toUpperCase(Locale.ROOT));
        if (!matcher.lookingAt() || (matcher.group(1) == null && matcher.group(2) == null)) {
            return UNPARSEABLE;
        }

        String letter = matcher.group(1);
        int prefix = letter == null ? 0 : letter.charAt(0) - 'A' + 1;
        return new SectionSortKey(prefix, toInt(matcher.group(2)), toInt(matcher.group(3)), toInt(matcher.group(4)));
    }

    private static int toInt(String group) {
        if (group == null) {
            return 0;
        }
        try {
            return Integer.parseInt(group);
        } catch (NumberFormatException e) {
            // Absurdly long digit runs
            return 999;
        }
    }

    @Override
    public int compareTo(SectionSortKey other) {
        return ORDER.compare(this, other);
    }
}
