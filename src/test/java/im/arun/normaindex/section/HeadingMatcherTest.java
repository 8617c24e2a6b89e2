package im.arun.normaindex.section;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.section.HeadingMatcher.Heading;
import im.arun.normaindex.section.HeadingMatcher.Kind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeadingMatcherTest {

    private final HeadingMatcher matcher = new HeadingMatcher(new ExtractorConfig.SectionSettings());

    @Test
    void shouldMatchMainSection() {
        assertThat(matcher.matchNumbered("0 INTRODUCCIÓN"))
            .containsExactly(new Heading("0", "INTRODUCCIÓN", Kind.MAIN_SECTION));
        assertThat(matcher.matchNumbered("13 FUNCIONAMIENTO DEL SISTEMA"))
            .extracting(Heading::getNumber)
            .containsExactly("13");
    }

    @Test
    void shouldMatchSubsectionsUpToThreeDotLevels() {
        assertThat(matcher.matchNumbered("1.1 Generalidades"))
            .containsExactly(new Heading("1.1", "Generalidades", Kind.SUBSECTION));
        assertThat(matcher.matchNumbered("6.5.2.1 Detectores de humo"))
            .extracting(Heading::getNumber)
            .containsExactly("6.5.2.1");
        assertThat(matcher.matchNumbered("6.5.2.1.3 Demasiado profundo")).isEmpty();
    }

    @Test
    void shouldMatchAnnexSubsection() {
        assertThat(matcher.matchNumbered("A.1 Objeto"))
            .containsExactly(new Heading("A.1", "Objeto", Kind.ANNEX_SUBSECTION));
        assertThat(matcher.matchNumbered("B.2.1 Ensayo de fuego"))
            .extracting(Heading::getNumber)
            .containsExactly("B.2.1");
        assertThat(matcher.matchNumbered("E.1 Fuera de rango")).isEmpty();
    }

    @Test
    void shouldRejectTitlesStartingWithExcludedWords() {
        assertThat(matcher.matchNumbered("3 TABLA DE EJEMPLO")).isEmpty();
        assertThat(matcher.matchNumbered("1.2 Nota sobre la instalación")).isEmpty();
        assertThat(matcher.matchNumbered("2.1 UNE 23007 parte 2")).isEmpty();
    }

    @Test
    void shouldMatchExcludedWordOnlyAsWholeWord() {
        assertThat(matcher.isValidTitle("ENSAYOS")).isTrue();
        assertThat(matcher.isValidTitle("Notación")).isTrue();
        assertThat(matcher.isValidTitle("EN 54")).isFalse();
    }

    @Test
    void shouldRejectTitlesWithTooFewLetters() {
        assertThat(matcher.isValidTitle("AB")).isFalse();
        assertThat(matcher.isValidTitle("A 1 2 3")).isFalse();
        assertThat(matcher.isValidTitle("ABC")).isTrue();
    }

    @Test
    void shouldMatchConfiguredCompleteAnnex() {
        assertThat(matcher.matchCompleteAnnex("ANEXO C (Informativo) FALSAS ALARMAS"))
            .contains(new Heading("C.0", "Falsas alarmas", Kind.COMPLETE_ANNEX));
        assertThat(matcher.matchCompleteAnnex("ANEXO D (Normativo)"))
            .contains(new Heading("D.0", "Requisitos específicos", Kind.COMPLETE_ANNEX));
    }

    @Test
    void shouldIgnoreAnnexesOutsideTheConfiguredTable() {
        assertThat(matcher.matchCompleteAnnex("ANEXO A (Normativo) Objeto")).isEmpty();
        assertThat(matcher.matchCompleteAnnex("ANEXO C")).isEmpty();
        assertThat(matcher.matchCompleteAnnex("Ver ANEXO C (Informativo)")).isEmpty();
    }
}
