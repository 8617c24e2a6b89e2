package im.arun.normaindex.pdf;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.BoundingBox;
import im.arun.normaindex.model.ExtractedTable;
import im.arun.normaindex.table.TableCleaner;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PdfBoxPageSourceTest {

    private static final float PAGE_HEIGHT = PDRectangle.A4.getHeight();

    @TempDir
    static Path tempDir;

    private static Path samplePdf;

    @BeforeAll
    static void createSamplePdf() throws IOException {
        samplePdf = tempDir.resolve("muestra.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            document.addPage(new PDPage(PDRectangle.A4));

            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            BufferedImage pixels = new BufferedImage(100, 80, BufferedImage.TYPE_INT_RGB);
            Graphics2D g = pixels.createGraphics();
            g.setColor(Color.RED);
            g.fillRect(0, 0, 100, 80);
            g.dispose();
            PDImageXObject image = LosslessFactory.createFromImage(document, pixels);

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                text(content, font, 72, 770, "1 OBJETO Y CAMPO DE APLICACION");

                // 2 x 2 ruled table between y=600 and y=680 (PDF coordinates)
                for (float y : new float[]{600, 640, 680}) {
                    content.moveTo(72, y);
                    content.lineTo(272, y);
                }
                for (float x : new float[]{72, 172, 272}) {
                    content.moveTo(x, 600);
                    content.lineTo(x, 680);
                }
                content.stroke();

                text(content, font, 80, 655, "Tipo");
                text(content, font, 180, 655, "Valor");
                text(content, font, 80, 615, "A");
                text(content, font, 180, 615, "1");

                content.drawImage(image, 300, 400, 100, 80);
            }
            document.save(samplePdf.toFile());
        }
    }

    private static void text(PDPageContentStream content, PDType1Font font, float x, float y, String value)
            throws IOException {
        content.beginText();
        content.setFont(font, 12);
        content.newLineAtOffset(x, y);
        content.showText(value);
        content.endText();
    }

    @Test
    void shouldReadPageCountAndText() throws IOException {
        try (PdfBoxPageSource source = PdfBoxPageSource.open(samplePdf)) {
            assertThat(source.pageCount()).isEqualTo(2);
            assertThat(source.pageText(1)).contains("1 OBJETO Y CAMPO DE APLICACION");
            assertThat(source.pageText(2)).isNull();
        }
    }

    @Test
    void shouldExtractRuledTable() throws IOException {
        ExtractorConfig.TableSettings settings = new ExtractorConfig.TableSettings();
        try (PdfBoxPageSource source = PdfBoxPageSource.open(samplePdf)) {
            List<List<List<String>>> grids = source.pageTables(1, settings);

            assertThat(grids).hasSize(1);
            List<ExtractedTable> tables = new TableCleaner(settings).cleanPage(grids, 1);
            assertThat(tables).hasSize(1);
            assertThat(tables.get(0).getHeader()).containsExactly("Tipo", "Valor");
            assertThat(tables.get(0).getRows()).containsExactly(List.of("A", "1"));
        }
    }

    @Test
    void shouldSkipTables_forUnsupportedStrategy() throws IOException {
        ExtractorConfig.TableSettings settings = new ExtractorConfig.TableSettings();
        settings.setVerticalStrategy("text");
        try (PdfBoxPageSource source = PdfBoxPageSource.open(samplePdf)) {
            assertThat(source.pageTables(1, settings)).isEmpty();
        }
    }

    @Test
    void shouldLocateImagesInTopLeftCoordinates() throws IOException {
        try (PdfBoxPageSource source = PdfBoxPageSource.open(samplePdf)) {
            List<BoundingBox> placements = source.pageImagePlacements(1);

            assertThat(placements).hasSize(1);
            BoundingBox box = placements.get(0);
            assertThat(box.getX()).isCloseTo(300, within(0.5));
            assertThat(box.getY()).isCloseTo(PAGE_HEIGHT - 480, within(0.5));
            assertThat(box.getWidth()).isCloseTo(100, within(0.5));
            assertThat(box.getHeight()).isCloseTo(80, within(0.5));
            assertThat(source.pageImagePlacements(2)).isEmpty();
        }
    }

    @Test
    void shouldRenderRegionAsPng() throws IOException {
        try (PdfBoxPageSource source = PdfBoxPageSource.open(samplePdf)) {
            assertThat(source.canRender()).isTrue();

            BoundingBox region = source.pageImagePlacements(1).get(0);
            byte[] png = source.renderRegion(1, region, 72f);

            assertThat(png).isNotEmpty();
            assertThat(png[1]).isEqualTo((byte) 'P');
            assertThat(png[2]).isEqualTo((byte) 'N');
            assertThat(png[3]).isEqualTo((byte) 'G');
        }
    }

    @Test
    void shouldRasterisePageOnce_forRegionsOnSamePageAndResolution() throws IOException {
        try (PdfBoxPageSource source = PdfBoxPageSource.open(samplePdf)) {
            BufferedImage first = source.pageImage(1, 72f);
            byte[] figure = source.renderRegion(1, source.pageImagePlacements(1).get(0), 72f);
            byte[] corner = source.renderRegion(1, new BoundingBox(0, 0, 50, 50), 72f);

            assertThat(figure).isNotEmpty();
            assertThat(corner).isNotEmpty();
            assertThat(source.pageImage(1, 72f)).isSameAs(first);
            assertThat(source.pageImage(1, 144f)).isNotSameAs(first);
            assertThat(source.pageImage(2, 144f).getWidth()).isEqualTo(first.getWidth() * 2);
        }
    }

    @Test
    void shouldFailToRenderRegionOutsidePage() throws IOException {
        try (PdfBoxPageSource source = PdfBoxPageSource.open(samplePdf)) {
            assertThatThrownBy(() -> source.renderRegion(1, new BoundingBox(5000, 5000, 5100, 5100), 72f))
                .isInstanceOf(IOException.class);
        }
    }

    @Test
    void shouldFailToOpenMissingFile() {
        assertThatThrownBy(() -> PdfBoxPageSource.open(tempDir.resolve("no-existe.pdf")))
            .isInstanceOf(IOException.class);
    }
}
