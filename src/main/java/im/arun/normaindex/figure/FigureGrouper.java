package im.arun.normaindex.figure;

import im.arun.normaindex.config.ExtractorConfig;
import im.arun.normaindex.model.BoundingBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the image placements of one page into figure regions.
 * <p>
 * Some producers store one logical figure as a grid of image tiles. Placements whose boxes are
 * adjacent (within the tolerance) are clustered with union-find; clusters whose envelopes are
 * adjacent to each other are then merged until no two envelopes touch. Each cluster becomes one
 * region, its union bounding box, emitted in the order of the cluster's first placement.
 * <p>
 * This deliberately differs from a greedy scan that seeds a region with the first unvisited
 * placement and absorbs only placements touching that region. The scan's partition depends on
 * input order: for a placement that touches only the grown envelope of two others, listing it
 * first leaves it as a region of its own. Here the partition is the same for every order.
 * <p>
 * Regions smaller than the minimum size (icons, bullets) or shaped like a letterhead strip are
 * rejected by {@link #accept(BoundingBox)}.
 */
public class FigureGrouper {
    private static final Logger logger = LoggerFactory.getLogger(FigureGrouper.class);

    private final double tolerance;
    private final double minWidth;
    private final double minHeight;
    private final double bannerMinWidth;
    private final double bannerMaxHeight;
    private final double bannerMinAspect;

    public FigureGrouper(ExtractorConfig.FigureSettings settings) {
        this(settings.getAdjacencyTolerance(), settings.getMinWidth(), settings.getMinHeight(),
            settings.getBannerMinWidth(), settings.getBannerMaxHeight(), settings.getBannerMinAspect());
    }

    public FigureGrouper(double tolerance, double minWidth, double minHeight,
                         double bannerMinWidth, double bannerMaxHeight, double bannerMinAspect) {
        this.tolerance = tolerance;
        this.minWidth = minWidth;
        this.minHeight = minHeight;
        this.bannerMinWidth = bannerMinWidth;
        this.bannerMaxHeight = bannerMaxHeight;
        this.bannerMinAspect = bannerMinAspect;
    }

    /**
     * Partition placements into maximal adjacency clusters and return their envelopes.
     */
    public List<BoundingBox> group(List<BoundingBox> placements) {
        if (placements == null || placements.isEmpty()) {
            return new ArrayList<>();
        }

        int n = placements.size();
        UnionFind uf = new UnionFind(n);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (placements.get(i).isAdjacentTo(placements.get(j), tolerance)) {
                    uf.union(i, j);
                }
            }
        }

        // A grown envelope can reach another cluster none of its members touched
        Map<Integer, BoundingBox> envelopes = envelopes(placements, uf);
        boolean merged = true;
        while (merged) {
            merged = false;
            List<Integer> roots = new ArrayList<>(envelopes.keySet());
            for (int a = 0; a < roots.size(); a++) {
                for (int b = a + 1; b < roots.size(); b++) {
                    if (envelopes.get(roots.get(a)).isAdjacentTo(envelopes.get(roots.get(b)), tolerance)) {
                        merged |= uf.union(roots.get(a), roots.get(b));
                    }
                }
            }
            if (merged) {
                envelopes = envelopes(placements, uf);
            }
        }

        logger.debug("Grouped {} placements into {} regions", n, envelopes.size());
        return new ArrayList<>(envelopes.values());
    }

    /**
     * Group the placements and keep only the regions that look like figures.
     */
    public List<BoundingBox> groupAndFilter(List<BoundingBox> placements) {
        List<BoundingBox> accepted = new ArrayList<>();
        for (BoundingBox region : group(placements)) {
            if (accept(region)) {
                accepted.add(region);
            }
        }
        return accepted;
    }

    public boolean accept(BoundingBox region) {
        if (region.getWidth() < minWidth || region.getHeight() < minHeight) {
            return false;
        }
        return !isBanner(region);
    }

    /**
     * Wide, short and elongated: a letterhead or logo strip.
     */
    public boolean isBanner(BoundingBox region) {
        double width = region.getWidth();
        double height = region.getHeight();
        return width > bannerMinWidth
            && height < bannerMaxHeight
            && height > 0
            && width / height > bannerMinAspect;
    }

    /** Envelope per cluster, keyed by root, in order of each cluster's first placement. */
    private static Map<Integer, BoundingBox> envelopes(List<BoundingBox> placements, UnionFind uf) {
        Map<Integer, BoundingBox> envelopes = new LinkedHashMap<>();
        for (int i = 0; i < placements.size(); i++) {
            envelopes.merge(uf.find(i), placements.get(i), BoundingBox::union);
        }
        return envelopes;
    }

    /** Union-Find (Disjoint Set Union) over placement indices. */
    private static class UnionFind {
        private final int[] parent;
        private final int[] rank;

        UnionFind(int size) {
            parent = new int[size];
            rank = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int x) {
            if (parent[x] != x) {
                parent[x] = find(parent[x]);
            }
            return parent[x];
        }

        /** Returns true when two distinct sets were joined. */
        boolean union(int x, int y) {
            int rootX = find(x);
            int rootY = find(y);
            if (rootX == rootY) {
                return false;
            }
            if (rank[rootX] < rank[rootY]) {
                parent[rootX] = rootY;
            } else if (rank[rootX] > rank[rootY]) {
                parent[rootY] = rootX;
            } else {
                parent[rootY] = rootX;
                rank[rootX]++;
            }
            return true;
        }
    }
}
