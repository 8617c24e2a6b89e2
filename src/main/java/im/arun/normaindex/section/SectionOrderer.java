package im.arun.normaindex.section;

import im.arun.normaindex.model.Section;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Puts sections in canonical document order: numeric sections first, then annexes A, B, C, D.
 * Sections with equal keys keep their relative order.
 */
public class SectionOrderer {

    public List<Section> order(List<Section> sections) {
        List<Section> ordered = new ArrayList<>(sections);
        // List.sort is stable
        ordered.sort(Comparator.comparing(section -> SectionSortKey.of(section.getNumber())));
        return ordered;
    }
}
