package im.arun.normaindex.service;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.BoundingBox;
import im.arun.normaindex.pdf.PageSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Page source backed by maps, for pipeline tests without PDF files.
 */
class InMemoryPageSource implements PageSource {
    private final int pageCount;
    private final Map<Integer, String> texts = new HashMap<>();
    private final Map<Integer, List<List<List<String>>>> tables = new HashMap<>();
    private final Map<Integer, List<BoundingBox>> images = new HashMap<>();
    private final Set<BoundingBox> unrenderable = new HashSet<>();
    private final List<BoundingBox> rendered = new ArrayList<>();
    private boolean renderable = true;
    private boolean closed;

    InMemoryPageSource(int pageCount) {
        this.pageCount = pageCount;
    }

    InMemoryPageSource text(int page, String text) {
        texts.put(page, text);
        return this;
    }

    InMemoryPageSource table(int page, List<List<String>> grid) {
        tables.computeIfAbsent(page, k -> new ArrayList<>()).add(grid);
        return this;
    }

    InMemoryPageSource images(int page, BoundingBox... placements) {
        images.put(page, List.of(placements));
        return this;
    }

    InMemoryPageSource failRendering(BoundingBox region) {
        unrenderable.add(region);
        return this;
    }

    InMemoryPageSource renderable(boolean value) {
        this.renderable = value;
        return this;
    }

    boolean isClosed() {
        return closed;
    }

    List<BoundingBox> rendered() {
        return rendered;
    }

    @Override
    public int pageCount() {
        return pageCount;
    }

    @Override
    public String pageText(int page) {
        return texts.get(page);
    }

    @Override
    public List<List<List<String>>> pageTables(int page, ExtractorConfig.TableSettings settings) {
        return tables.getOrDefault(page, List.of());
    }

    @Override
    public List<BoundingBox> pageImagePlacements(int page) {
        return images.getOrDefault(page, List.of());
    }

    @Override
    public byte[] renderRegion(int page, BoundingBox region, float dpi) throws IOException {
        if (unrenderable.contains(region)) {
            throw new IOException("corrupt image stream");
        }
        rendered.add(region);
        return new byte[]{(byte) 0x89, 'P', 'N', 'G', (byte) page};
    }

    @Override
    public boolean canRender() {
        return renderable;
    }

    @Override
    public void close() {
        closed = true;
    }
}
