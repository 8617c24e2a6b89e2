package im.arun.normaindex.table;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.ExtractedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalises raw table grids and discards degenerate ones (too few rows, mostly empty).
 */
public class TableCleaner {
    private static final Logger logger = LoggerFactory.getLogger(TableCleaner.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int minRows;
    private final double maxEmptyCellRatio;

    public TableCleaner(ExtractorConfig.TableSettings settings) {
        this(settings.getMinRows(), settings.getMaxEmptyCellRatio());
    }

    public TableCleaner(int minRows, double maxEmptyCellRatio) {
        this.minRows = minRows;
        this.maxEmptyCellRatio = maxEmptyCellRatio;
    }

    /**
     * Clean one raw grid.
     *
     * @param rawGrid rows of nullable cells as returned by the page source
     * @param page    1-based page number
     * @param ordinal 1-based position of the grid among the page's raw grids
     * @return the table, or empty when the grid does not qualify
     */
    public Optional<ExtractedTable> clean(List<List<String>> rawGrid, int page, int ordinal) {
        if (rawGrid == null || rawGrid.size() < minRows) {
            return Optional.empty();
        }

        List<List<String>> rows = new ArrayList<>();
        for (List<String> rawRow : rawGrid) {
            if (rawRow == null || rawRow.isEmpty()) {
                continue;
            }
            List<String> row = new ArrayList<>(rawRow.size());
            for (String cell : rawRow) {
                row.add(cleanCell(cell));
            }
            if (row.stream().anyMatch(cell -> !cell.isEmpty())) {
                rows.add(List.copyOf(row));
            }
        }

        if (rows.size() < minRows) {
            return Optional.empty();
        }

        int totalCells = 0;
        int emptyCells = 0;
        for (List<String> row : rows) {
            totalCells += row.size();
            for (String cell : row) {
                if (cell.isEmpty()) {
                    emptyCells++;
                }
            }
        }
        if ((double) emptyCells / totalCells > maxEmptyCellRatio) {
            logger.debug("Discarding grid {} on page {}: {}/{} cells empty", ordinal, page, emptyCells, totalCells);
            return Optional.empty();
        }

        String id = String.format("tabla_p%d_%d", page, ordinal);
        return Optional.of(new ExtractedTable(id, page, rows.get(0), List.copyOf(rows.subList(1, rows.size()))));
    }

    /**
     * Clean every raw grid of a page, keeping the raw ordinal in the table id.
     */
    public List<ExtractedTable> cleanPage(List<List<List<String>>> rawGrids, int page) {
        List<ExtractedTable> tables = new ArrayList<>();
        for (int i = 0; i < rawGrids.size(); i++) {
            clean(rawGrids.get(i), page, i + 1).ifPresent(tables::add);
        }
        return tables;
    }

    private static String cleanCell(String cell) {
        if (cell == null) {
            return "";
        }
        return WHITESPACE.matcher(cell).replaceAll(" ").strip();
    }
}
