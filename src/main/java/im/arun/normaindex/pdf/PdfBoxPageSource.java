package im.arun.normaindex.pdf;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.BoundingBox;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link PageSource} backed by Apache PDFBox.
 * <p>
 * Text comes from {@link PDFTextStripper}, one page at a time. Tables and image placements come
 * from a single content-stream pass per page ({@link PageGraphicsCollector}); cell text is read
 * with {@link PDFTextStripperByArea}. Regions are rendered with {@link PDFRenderer}.
 * PDFBox is not thread-safe per document, so an instance must stay on one thread.
 */
public class PdfBoxPageSource implements PageSource {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxPageSource.class);
    private static final String LINES_STRATEGY = "lines";

    private final PDDocument document;
    private final PDFTextStripper stripper;
    private PDFRenderer renderer;
    private PageGraphicsCollector cachedGraphics;
    private int cachedGraphicsPage = -1;
    private BufferedImage cachedPageImage;
    private int cachedImagePage = -1;
    private float cachedImageDpi;
    private boolean strategyWarned;

    PdfBoxPageSource(PDDocument document) throws IOException {
        this.document = document;
        this.stripper = new PDFTextStripper();
        this.stripper.setLineSeparator("\n");
    }

    /**
     * Open a PDF file. The caller owns the returned source and must close it.
     */
    public static PdfBoxPageSource open(Path pdfPath) throws IOException {
        PDDocument document = Loader.loadPDF(pdfPath.toFile());
        try {
            return new PdfBoxPageSource(document);
        } catch (IOException | RuntimeException e) {
            document.close();
            throw e;
        }
    }

    @Override
    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public String pageText(int page) throws IOException {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(document);
        return text == null || text.isBlank() ? null : text;
    }

    @Override
    public List<List<List<String>>> pageTables(int page, ExtractorConfig.TableSettings settings) throws IOException {
        if (!LINES_STRATEGY.equalsIgnoreCase(settings.getVerticalStrategy())
                || !LINES_STRATEGY.equalsIgnoreCase(settings.getHorizontalStrategy())) {
            if (!strategyWarned) {
                logger.warn("Only the 'lines' table strategy is supported (got {}/{}), tables disabled",
                    settings.getVerticalStrategy(), settings.getHorizontalStrategy());
                strategyWarned = true;
            }
            return List.of();
        }

        List<List<List<BoundingBox>>> layouts = new RulingTableFinder(settings).findTables(graphics(page).getRulings());
        if (layouts.isEmpty()) {
            return List.of();
        }

        PDFTextStripperByArea areaStripper = new PDFTextStripperByArea();
        areaStripper.setSortByPosition(true);
        for (int t = 0; t < layouts.size(); t++) {
            List<List<BoundingBox>> layout = layouts.get(t);
            for (int r = 0; r < layout.size(); r++) {
                List<BoundingBox> row = layout.get(r);
                for (int c = 0; c < row.size(); c++) {
                    BoundingBox cell = row.get(c);
                    if (cell != null) {
                        areaStripper.addRegion(regionName(t, r, c),
                            new Rectangle2D.Double(cell.getX(), cell.getY(), cell.getWidth(), cell.getHeight()));
                    }
                }
            }
        }
        areaStripper.extractRegions(document.getPage(page - 1));

        List<List<List<String>>> tables = new ArrayList<>(layouts.size());
        for (int t = 0; t < layouts.size(); t++) {
            List<List<String>> grid = new ArrayList<>();
            List<List<BoundingBox>> layout = layouts.get(t);
            for (int r = 0; r < layout.size(); r++) {
                List<String> cells = new ArrayList<>();
                List<BoundingBox> row = layout.get(r);
                for (int c = 0; c < row.size(); c++) {
                    cells.add(row.get(c) == null ? null : areaStripper.getTextForRegion(regionName(t, r, c)));
                }
                grid.add(cells);
            }
            tables.add(grid);
        }
        return tables;
    }

    @Override
    public List<BoundingBox> pageImagePlacements(int page) throws IOException {
        return List.copyOf(graphics(page).getImagePlacements());
    }

    @Override
    public byte[] renderRegion(int page, BoundingBox region, float dpi) throws IOException {
        BufferedImage pageImage = pageImage(page, dpi);

        // PDF points are 1/72 inch
        float scale = dpi / 72f;
        int x = Math.max(0, (int) Math.floor(region.getX() * scale));
        int y = Math.max(0, (int) Math.floor(region.getY() * scale));
        int width = Math.min((int) Math.ceil(region.getWidth() * scale), pageImage.getWidth() - x);
        int height = Math.min((int) Math.ceil(region.getHeight() * scale), pageImage.getHeight() - y);
        if (width <= 0 || height <= 0) {
            throw new IOException(String.format("Region %s lies outside page %d", region, page));
        }

        BufferedImage cropped = pageImage.getSubimage(x, y, width, height);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (!ImageIO.write(cropped, "png", baos)) {
            throw new IOException("No PNG writer available");
        }
        return baos.toByteArray();
    }

    @Override
    public boolean canRender() {
        return RenderingSupport.AVAILABLE;
    }

    @Override
    public void close() throws IOException {
        document.close();
    }

    private PageGraphicsCollector graphics(int page) throws IOException {
        if (cachedGraphicsPage != page) {
            PDPage pdPage = document.getPage(page - 1);
            cachedGraphics = new PageGraphicsCollector(pdPage).collect();
            cachedGraphicsPage = page;
        }
        return cachedGraphics;
    }

    /** Rasterised page, kept for the next region on the same page and resolution. */
    BufferedImage pageImage(int page, float dpi) throws IOException {
        if (cachedImagePage != page || Float.compare(cachedImageDpi, dpi) != 0) {
            if (renderer == null) {
                renderer = new PDFRenderer(document);
            }
            cachedPageImage = renderer.renderImageWithDPI(page - 1, dpi);
            cachedImagePage = page;
            cachedImageDpi = dpi;
        }
        return cachedPageImage;
    }

    private static String regionName(int table, int row, int column) {
        return "t" + table + "r" + row + "c" + column;
    }

    /** Checked once: AWT imaging and a PNG writer are needed to rasterise regions. */
    private static final class RenderingSupport {
        static final boolean AVAILABLE = detect();

        private static boolean detect() {
            try {
                return ImageIO.getImageWritersByFormatName("png").hasNext();
            } catch (LinkageError e) {
                logger.warn("Image rendering unavailable: {}", e.toString());
                return false;
            }
        }
    }
}
