package im.arun.normaindex.service;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.figure.FigureGrouper;
import im.arun.normaindex.figure.NearbySectionEstimator;
import im.arun.normaindex.model.BoundingBox;
import im.arun.normaindex.model.DocumentRecord;
import im.arun.normaindex.model.ExtractedTable;
import im.arun.normaindex.model.ExtractionResult;
import im.arun.normaindex.model.Figure;
import im.arun.normaindex.model.NormaInfo;
import im.arun.normaindex.model.RawPage;
import im.arun.normaindex.model.Section;
import im.arun.normaindex.pdf.PageSource;
import im.arun.normaindex.pdf.PdfBoxPageSource;
import im.arun.normaindex.section.SectionOrderer;
import im.arun.normaindex.section.SectionSegmenter;
import im.arun.normaindex.table.TableCleaner;
import im.arun.normaindex.text.NormaInfoExtractor;
import im.arun.normaindex.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the extraction pipeline over one norma: text cleanup, sections, tables and figures,
 * assembled into a {@link DocumentRecord}.
 * <p>
 * One instance serves a whole run; the only state carried between documents is the
 * "rendering unavailable" warning, which is reported once.
 */
public class NormaExtractionService {
    private static final Logger logger = LoggerFactory.getLogger(NormaExtractionService.class);
    static final String FIGURES_DIR = "figuras";

    /** Opens a {@link PageSource} for a file; swapped out in tests. */
    @FunctionalInterface
    public interface PageSourceOpener {
        PageSource open(Path pdfPath) throws IOException;
    }

    private final ExtractorConfig config;
    private final TextNormalizer normalizer;
    private final NormaInfoExtractor infoExtractor;
    private final SectionSegmenter segmenter;
    private final SectionOrderer orderer;
    private final TableCleaner tableCleaner;
    private final FigureGrouper figureGrouper;
    private final NearbySectionEstimator sectionEstimator;
    private final PageSourceOpener opener;
    private final Clock clock;

    private boolean renderingWarningIssued;

    public NormaExtractionService(ExtractorConfig config) {
        this(config, PdfBoxPageSource::open, Clock.systemDefaultZone());
    }

    public NormaExtractionService(ExtractorConfig config, PageSourceOpener opener, Clock clock) {
        this.config = config;
        this.normalizer = new TextNormalizer(config);
        this.infoExtractor = new NormaInfoExtractor(config.getText());
        this.segmenter = new SectionSegmenter(config, normalizer);
        this.orderer = new SectionOrderer();
        this.tableCleaner = new TableCleaner(config.getTables());
        this.figureGrouper = new FigureGrouper(config.getFigures());
        this.sectionEstimator = new NearbySectionEstimator(config.getFigures());
        this.opener = opener;
        this.clock = clock;
    }

    /**
     * Process one PDF file.
     *
     * @return the result, or empty when the document carries no extractable text
     * @throws NormaExtractionException when the file cannot be opened or read
     */
    public Optional<ExtractionResult> process(Path pdfPath) {
        String fileName = pdfPath.getFileName().toString();
        logger.info("Processing: {}", fileName);

        try (PageSource source = opener.open(pdfPath)) {
            return assemble(source, fileName);
        } catch (IOException e) {
            throw new NormaExtractionException(fileName, "Failed to read " + fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Assemble the record for an already opened document.
     */
    public Optional<ExtractionResult> assemble(PageSource source, String fileName) throws IOException {
        int totalPages = source.pageCount();
        List<RawPage> pages = new ArrayList<>(totalPages);
        for (int page = 1; page <= totalPages; page++) {
            pages.add(source.readPage(page, config.getTables()));
        }

        String text = normalizer.normalize(joinPageTexts(pages));
        if (text.isEmpty()) {
            logger.warn("No text could be extracted from {}, skipping", fileName);
            return Optional.empty();
        }

        NormaInfo info = infoExtractor.extract(text);
        List<Section> sections = orderer.order(segmenter.segment(text));
        logger.info("  Sections detected: {}", sections.size());
        if (logger.isDebugEnabled() && !sections.isEmpty()) {
            sections.stream().limit(5).forEach(s ->
                logger.debug("    {} {}", s.getNumber(), abbreviate(s.getTitle(), 30)));
        }

        List<ExtractedTable> tables = new ArrayList<>();
        for (RawPage page : pages) {
            tables.addAll(tableCleaner.cleanPage(page.getTables(), page.getPageNumber()));
        }
        logger.info("  Tables extracted: {}", tables.size());

        String baseName = baseName(fileName);
        Map<String, byte[]> images = new LinkedHashMap<>();
        List<Figure> figures = extractFigures(source, pages, sections, baseName, images, fileName);
        logger.info("  Figures extracted: {}", figures.size());

        DocumentRecord record = DocumentRecord.builder()
            .code(info.hasCode() ? info.getCode() : stem(fileName))
            .title(info.getTitle())
            .sourceFilename(fileName)
            .extractedAt(LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
            .totalPages(totalPages)
            .sections(sections)
            .tables(tables)
            .figures(figures)
            .build();

        return Optional.of(new ExtractionResult(record, images, baseName));
    }

    private List<Figure> extractFigures(PageSource source, List<RawPage> pages, List<Section> sections,
                                        String baseName, Map<String, byte[]> images, String fileName) {
        ExtractorConfig.FigureSettings settings = config.getFigures();
        List<Figure> figures = new ArrayList<>();
        if (!settings.isEnabled()) {
            return figures;
        }
        if (!source.canRender()) {
            if (!renderingWarningIssued) {
                logger.warn("Figure rendering is not available, figure extraction disabled for this run");
                renderingWarningIssued = true;
            }
            return figures;
        }

        int totalPages = pages.size();
        // Cover and TOC pages at the front and the back matter page are never searched
        for (int page = settings.getLeadingPagesSkipped() + 1; page < totalPages; page++) {
            if (figureLimitReached(figures, settings, fileName)) {
                return figures;
            }
            List<BoundingBox> regions = figureGrouper.groupAndFilter(pages.get(page - 1).getImagePlacements());
            for (int i = 0; i < regions.size(); i++) {
                if (figureLimitReached(figures, settings, fileName)) {
                    return figures;
                }

                BoundingBox region = regions.get(i);
                String id = String.format("fig_p%d_%d", page, i + 1);
                byte[] image;
                try {
                    image = source.renderRegion(page, region, settings.getRenderDpi());
                } catch (IOException | RuntimeException e) {
                    logger.warn("Could not render figure {} of {}: {}", id, fileName, e.getMessage());
                    continue;
                }

                images.put(id, image);
                figures.add(new Figure(
                    id,
                    String.format("%s/%s/%s.%s", FIGURES_DIR, baseName, id, settings.getFormat()),
                    page,
                    region,
                    sectionEstimator.estimate(page, totalPages, sections),
                    settings.getFormat(),
                    image.length));
            }
        }
        return figures;
    }

    private static boolean figureLimitReached(List<Figure> figures, ExtractorConfig.FigureSettings settings,
                                              String fileName) {
        if (figures.size() < settings.getMaxPerDocument()) {
            return false;
        }
        logger.warn("Figure limit of {} reached in {}, remaining pages not searched",
            settings.getMaxPerDocument(), fileName);
        return true;
    }

    private static String joinPageTexts(List<RawPage> pages) {
        List<String> texts = new ArrayList<>();
        for (RawPage page : pages) {
            if (page.getText() != null && !page.getText().isEmpty()) {
                texts.add(page.getText());
            }
        }
        return String.join("\n\n", texts);
    }

    /**
     * File-system friendly name shared by every artifact of a document:
     * lower-cased stem, spaces as underscores, '=' as '-'.
     */
    public static String baseName(String fileName) {
        return stem(fileName).toLowerCase(Locale.ROOT).replace(' ', '_').replace('=', '-');
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String abbreviate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
