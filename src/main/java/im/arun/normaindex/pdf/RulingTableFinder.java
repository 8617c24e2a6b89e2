package im.arun.normaindex.pdf;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.BoundingBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds ruled tables ("lines" strategy) from the rulings of a page and returns their cell
 * layout.
 * <p>
 * Rulings are snapped (nearly aligned lines moved to a shared coordinate), joined (collinear
 * pieces separated by small gaps merged), then grouped into tables by intersection. Each table's
 * distinct horizontal and vertical positions define the grid; a cell extends over the next column
 * while no vertical ruling separates them, and the spanned positions are reported as null.
 */
public class RulingTableFinder {
    private static final Logger logger = LoggerFactory.getLogger(RulingTableFinder.class);

    private final double snapTolerance;
    private final double joinTolerance;
    private final double intersectionTolerance;

    public RulingTableFinder(ExtractorConfig.TableSettings settings) {
        this(settings.getSnapTolerance(), settings.getJoinTolerance(), settings.getIntersectionTolerance());
    }

    public RulingTableFinder(double snapTolerance, double joinTolerance, double intersectionTolerance) {
        this.snapTolerance = snapTolerance;
        this.joinTolerance = joinTolerance;
        this.intersectionTolerance = intersectionTolerance;
    }

    /**
     * @return one grid per table, top to bottom; each grid is rows of cell boxes (null for spanned cells)
     */
    public List<List<List<BoundingBox>>> findTables(List<Ruling> rulings) {
        List<Ruling> horizontal = join(snap(filter(rulings, true)));
        List<Ruling> vertical = join(snap(filter(rulings, false)));

        List<Ruling> all = new ArrayList<>(horizontal);
        all.addAll(vertical);
        List<List<Ruling>> components = connectedComponents(all);

        List<List<List<BoundingBox>>> tables = new ArrayList<>();
        components.sort(Comparator
            .comparingDouble((List<Ruling> c) -> minPosition(c, true))
            .thenComparingDouble(c -> minPosition(c, false)));
        for (List<Ruling> component : components) {
            List<List<BoundingBox>> grid = buildGrid(component);
            if (!grid.isEmpty()) {
                tables.add(grid);
            }
        }

        logger.debug("Found {} ruled tables from {} rulings", tables.size(), rulings.size());
        return tables;
    }

    private static List<Ruling> filter(List<Ruling> rulings, boolean horizontal) {
        return rulings.stream().filter(r -> r.isHorizontal() == horizontal).collect(Collectors.toList());
    }

    /** Cluster positions within the snap tolerance and move each ruling to its cluster mean. */
    private List<Ruling> snap(List<Ruling> rulings) {
        List<Ruling> sorted = new ArrayList<>(rulings);
        sorted.sort(Comparator.comparingDouble(Ruling::getPosition));

        List<Ruling> snapped = new ArrayList<>(sorted.size());
        List<Ruling> cluster = new ArrayList<>();
        for (Ruling ruling : sorted) {
            if (!cluster.isEmpty()
                    && ruling.getPosition() - cluster.get(cluster.size() - 1).getPosition() > snapTolerance) {
                flushCluster(cluster, snapped);
            }
            cluster.add(ruling);
        }
        flushCluster(cluster, snapped);
        return snapped;
    }

    private static void flushCluster(List<Ruling> cluster, List<Ruling> out) {
        if (cluster.isEmpty()) {
            return;
        }
        double mean = cluster.stream().mapToDouble(Ruling::getPosition).average().orElse(0);
        for (Ruling ruling : cluster) {
            out.add(ruling.withPosition(mean));
        }
        cluster.clear();
    }

    /** Merge collinear rulings whose gap is within the join tolerance. */
    private List<Ruling> join(List<Ruling> rulings) {
        Map<Double, List<Ruling>> byPosition = new TreeMap<>();
        for (Ruling ruling : rulings) {
            byPosition.computeIfAbsent(ruling.getPosition(), k -> new ArrayList<>()).add(ruling);
        }

        List<Ruling> joined = new ArrayList<>();
        for (List<Ruling> line : byPosition.values()) {
            line.sort(Comparator.comparingDouble(Ruling::getStart));
            Ruling current = line.get(0);
            for (int i = 1; i < line.size(); i++) {
                Ruling next = line.get(i);
                if (next.getStart() <= current.getEnd() + joinTolerance) {
                    current = current.withSpan(current.getStart(), Math.max(current.getEnd(), next.getEnd()));
                } else {
                    joined.add(current);
                    current = next;
                }
            }
            joined.add(current);
        }
        return joined;
    }

    private List<List<Ruling>> connectedComponents(List<Ruling> rulings) {
        int n = rulings.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (rulings.get(i).intersects(rulings.get(j), intersectionTolerance)) {
                    parent[find(parent, i)] = find(parent, j);
                }
            }
        }

        Map<Integer, List<Ruling>> groups = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(rulings.get(i));
        }
        return new ArrayList<>(groups.values());
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    private List<List<BoundingBox>> buildGrid(List<Ruling> component) {
        TreeSet<Double> ys = new TreeSet<>();
        TreeSet<Double> xs = new TreeSet<>();
        List<Ruling> verticals = new ArrayList<>();
        for (Ruling ruling : component) {
            if (ruling.isHorizontal()) {
                ys.add(ruling.getPosition());
            } else {
                xs.add(ruling.getPosition());
                verticals.add(ruling);
            }
        }
        if (ys.size() < 2 || xs.size() < 2) {
            return List.of();
        }

        List<Double> rowEdges = new ArrayList<>(ys);
        List<Double> columnEdges = new ArrayList<>(xs);
        List<List<BoundingBox>> grid = new ArrayList<>();
        for (int i = 0; i + 1 < rowEdges.size(); i++) {
            double top = rowEdges.get(i);
            double bottom = rowEdges.get(i + 1);
            double middle = (top + bottom) / 2;

            List<BoundingBox> row = new ArrayList<>();
            int j = 0;
            while (j + 1 < columnEdges.size()) {
                int k = j + 1;
                while (k + 1 < columnEdges.size() && !hasVerticalAt(verticals, columnEdges.get(k), middle)) {
                    k++;
                }
                row.add(new BoundingBox(columnEdges.get(j), top, columnEdges.get(k), bottom));
                for (int spanned = j + 1; spanned < k; spanned++) {
                    row.add(null);
                }
                j = k;
            }
            grid.add(row);
        }
        return grid;
    }

    private boolean hasVerticalAt(List<Ruling> verticals, double x, double y) {
        for (Ruling ruling : verticals) {
            if (Math.abs(ruling.getPosition() - x) <= intersectionTolerance && ruling.covers(y, intersectionTolerance)) {
                return true;
            }
        }
        return false;
    }

    private static double minPosition(List<Ruling> component, boolean horizontal) {
        return component.stream()
            .filter(r -> r.isHorizontal() == horizontal)
            .mapToDouble(Ruling::getPosition)
            .min()
            .orElse(Double.MAX_VALUE);
    }
}
