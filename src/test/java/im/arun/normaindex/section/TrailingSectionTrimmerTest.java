package im.arun.normaindex.section;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TrailingSectionTrimmerTest {

    private final TrailingSectionTrimmer trimmer = new TrailingSectionTrimmer(20, 0.8);

    @Test
    void shouldCutNextHeadingAtTheTail() {
        List<String> lines = bodyLines(9);
        lines.add("2 CAMPO DE APLICACIÓN");

        String trimmed = trimmer.trim(String.join("\n", lines), "1");

        assertThat(trimmed).isEqualTo(String.join("\n", bodyLines(9)));
    }

    @Test
    void shouldCutEverythingFromTheMatchedLine() {
        List<String> lines = bodyLines(18);
        lines.add("ANEXO B (Informativo)");
        lines.add("Texto del anexo");

        String trimmed = trimmer.trim(String.join("\n", lines), "9");

        assertThat(trimmed).isEqualTo(String.join("\n", bodyLines(18)));
    }

    @Test
    void shouldKeepHeadingLikeLineOutsideTheTail() {
        List<String> lines = bodyLines(3);
        lines.add("2 CAMPO DE APLICACIÓN");
        lines.addAll(bodyLines(6));
        String content = String.join("\n", lines);

        assertThat(trimmer.trim(content, "1")).isEqualTo(content);
    }

    @Test
    void shouldOnlyInspectTheLastLinesOfTheWindow() {
        TrailingSectionTrimmer narrow = new TrailingSectionTrimmer(2, 0.5);
        List<String> lines = bodyLines(7);
        lines.add("NOTA En la numeración de los apartados");
        lines.addAll(bodyLines(2));
        String content = String.join("\n", lines);

        assertThat(narrow.trim(content, "3")).isEqualTo(content);
    }

    @Test
    void shouldRecogniseAnnexSubsectionAndNumberingNote() {
        List<String> annex = bodyLines(9);
        annex.add("A.2 Métodos de ensayo");
        List<String> note = bodyLines(9);
        note.add("NOTA En la numeración de este anexo");

        assertThat(trimmer.trim(String.join("\n", annex), "A.1")).doesNotContain("A.2");
        assertThat(trimmer.trim(String.join("\n", note), "4")).doesNotContain("NOTA");
    }

    @Test
    void shouldReturnEmpty_forEmptyContent() {
        assertThat(trimmer.trim("", "1")).isEmpty();
        assertThat(trimmer.trim(null, "1")).isEmpty();
    }

    private static List<String> bodyLines(int count) {
        List<String> lines = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lines.add("Línea de contenido " + i + ".");
        }
        return lines;
    }
}
