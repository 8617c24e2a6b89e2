package im.arun.normaindex.pdf;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.BoundingBox;
import im.arun.normaindex.model.RawPage;

import java.io.IOException;
import java.util.List;

/**
 * Page-level extraction primitives for one open document. Pages are 1-based.
 */
public interface PageSource extends AutoCloseable {

    int pageCount();

    /**
     * @return the page text, or null when the page carries none
     */
    String pageText(int page) throws IOException;

    /**
     * @return raw grids as rows of cells; a cell is null where a merged cell spans it
     */
    List<List<List<String>>> pageTables(int page, ExtractorConfig.TableSettings settings) throws IOException;

    /**
     * @return one box per drawn image, in page coordinates with the origin at the top-left
     */
    List<BoundingBox> pageImagePlacements(int page) throws IOException;

    /**
     * Rasterise a page region to PNG bytes.
     */
    byte[] renderRegion(int page, BoundingBox region, float dpi) throws IOException;

    /**
     * False when region rendering is not available in this runtime.
     */
    boolean canRender();

    default RawPage readPage(int page, ExtractorConfig.TableSettings settings) throws IOException {
        return new RawPage(page, pageText(page), pageTables(page, settings), pageImagePlacements(page));
    }

    @Override
    void close() throws IOException;
}
