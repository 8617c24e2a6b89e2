package im.arun.normaindex.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Extraction settings. Defaults target the UNE document family; a config.yaml on the
 * classpath or passed with --config overrides them.
 */
@Data
public class ExtractorConfig {
    private TextSettings text = new TextSettings();
    private SectionSettings sections = new SectionSettings();
    private TableSettings tables = new TableSettings();
    private FigureSettings figures = new FigureSettings();

    @Data
    public static class TextSettings {
        /** Applied in order, multi-line and case-insensitive. */
        private List<String> noisePatterns = new ArrayList<>(List.of(
            // Licence and acquisition notices, on one line, wrapped, then the line remainder
            "Este documento ha sido adquirido por[^\\n]*\\d{4}\\.",
            "Este documento ha sido adquirido por[^\\n]*?AENOR\\.?",
            "(?s)Este documento ha sido adquirido por.{0,300}?\\d{4}\\.",
            "Este documento ha sido adquirido por[^\\n]*",
            "Para poder utilizarlo en un sistema de red[^\\n]*?AENOR\\.?",
            "(?s)Para poder utilizarlo en un sistema de red.{0,300}?AENOR\\.?",
            "Para poder utilizarlo en un sistema de red[^\\n]*",
            "© AENOR \\d{4}[^\\n]*",
            "G.nova,?\\s*6[^\\n]*",
            "Reproducción prohibida[^\\n]*",
            // Running headers and footers: "- 13 - UNE 23007-14:2014", "UNE 23007-14:2014 - 5 -"
            "-\\s*\\d+\\s*-\\s*UNE[^\\n]*",
            "^UNE\\s*\\d+[-:]?\\d*[-:]?\\d*\\s*-\\s*\\d+\\s*-\\s*$",
            "^UNE[\\s-]+\\d+[^\\n]*-\\s*\\d+\\s*-\\s*$",
            "^-\\s*\\d+\\s*-\\s*$",
            "^\\d+\\s*$",
            // Table of contents lines
            "^[^\\n]*\\.{3,}\\s*\\d+\\s*$",
            // Annex titles repeated inside body text. Bare "ANEXO X (...)" captions are added by
            // the normaliser itself, sparing the complete annexes that open a section.
            "^REQUISITOS ESPECÍFICOS\\s*$",
            "^FALSAS ALARMAS\\s*$"
        ));
        private List<String> titlePrefixes = new ArrayList<>(List.of("Sistemas de", "Componentes"));
        private int codeSearchWindow = 3000;
    }

    @Data
    public static class SectionSettings {
        private List<String> excludedTitleWords = new ArrayList<>(List.of(
            "pagina", "paginas", "página", "páginas",
            "tabla", "tablas", "figure", "figura", "figuras",
            "nota", "notas", "ejemplo", "ejemplos",
            "aenor", "une", "iso", "en",
            "reproduccion", "reproducción", "prohibida",
            "este documento", "adquirido", "licencia"
        ));
        private int minTitleLetters = 3;
        private int duplicateKeyTitleLength = 20;
        /** Annexes without numbered subsections, keyed by annex letter. */
        private Map<String, String> completeAnnexTitles = new TreeMap<>(Map.of(
            "C", "Falsas alarmas",
            "D", "Requisitos específicos"
        ));
        private int trimWindowLines = 20;
        private double trimTailRatio = 0.8;
    }

    @Data
    public static class TableSettings {
        private String verticalStrategy = "lines";
        private String horizontalStrategy = "lines";
        private double snapTolerance = 5;
        private double joinTolerance = 5;
        private double intersectionTolerance = 3;
        private double maxEmptyCellRatio = 0.7;
        private int minRows = 2;
    }

    @Data
    public static class FigureSettings {
        private boolean enabled = true;
        private double minWidth = 50;
        private double minHeight = 50;
        private double adjacencyTolerance = 5;
        private int maxPerDocument = 50;
        private float renderDpi = 150f;
        private int leadingPagesSkipped = 5;
        private double bannerMinWidth = 500;
        private double bannerMaxHeight = 200;
        private double bannerMinAspect = 4;
        private String format = "png";
    }
}
