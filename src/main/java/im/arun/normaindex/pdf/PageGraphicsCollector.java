package im.arun.normaindex.pdf;

import im.arun.normaindex.model.BoundingBox;
import org.apache.pdfbox.contentstream.PDFGraphicsStreamEngine;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImage;
import org.apache.pdfbox.util.Matrix;

import java.awt.geom.Point2D;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks a page's content stream and records the straight ruling lines (stroked lines and thin
 * filled rectangles) and the placement of every drawn image.
 * <p>
 * Coordinates handed to this engine are already in page space; they are converted to top-left
 * origin relative to the crop box, the space used by text extraction and rendering.
 */
public class PageGraphicsCollector extends PDFGraphicsStreamEngine {
    private static final double AXIS_SLACK = 1.0;
    private static final double MIN_RULING_LENGTH = 2.0;

    private final PDRectangle cropBox;
    private final List<double[]> currentPath = new ArrayList<>();
    private final List<Ruling> rulings = new ArrayList<>();
    private final List<BoundingBox> imagePlacements = new ArrayList<>();
    private Point2D.Float currentPoint;
    private Point2D.Float subpathStart;

    public PageGraphicsCollector(PDPage page) {
        super(page);
        this.cropBox = page.getCropBox();
    }

    public PageGraphicsCollector collect() throws IOException {
        processPage(getPage());
        return this;
    }

    public List<Ruling> getRulings() {
        return rulings;
    }

    public List<BoundingBox> getImagePlacements() {
        return imagePlacements;
    }

    @Override
    public void drawImage(PDImage pdImage) throws IOException {
        Matrix ctm = getGraphicsState().getCurrentTransformationMatrix();
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        // Images are drawn into the unit square of the current transformation
        float[][] corners = {{0, 0}, {1, 0}, {0, 1}, {1, 1}};
        for (float[] corner : corners) {
            Point2D.Float p = ctm.transformPoint(corner[0], corner[1]);
            minX = Math.min(minX, p.x);
            minY = Math.min(minY, p.y);
            maxX = Math.max(maxX, p.x);
            maxY = Math.max(maxY, p.y);
        }
        imagePlacements.add(new BoundingBox(toX(minX), toTop(maxY), toX(maxX), toTop(minY)));
    }

    @Override
    public void appendRectangle(Point2D p0, Point2D p1, Point2D p2, Point2D p3) throws IOException {
        addSegment(p0, p1);
        addSegment(p1, p2);
        addSegment(p2, p3);
        addSegment(p3, p0);
        currentPoint = new Point2D.Float((float) p0.getX(), (float) p0.getY());
        subpathStart = currentPoint;
    }

    @Override
    public void moveTo(float x, float y) throws IOException {
        currentPoint = new Point2D.Float(x, y);
        subpathStart = currentPoint;
    }

    @Override
    public void lineTo(float x, float y) throws IOException {
        Point2D.Float next = new Point2D.Float(x, y);
        if (currentPoint != null) {
            addSegment(currentPoint, next);
        }
        currentPoint = next;
    }

    @Override
    public void curveTo(float x1, float y1, float x2, float y2, float x3, float y3) throws IOException {
        currentPoint = new Point2D.Float(x3, y3);
    }

    @Override
    public Point2D getCurrentPoint() throws IOException {
        return currentPoint != null ? currentPoint : new Point2D.Float(0, 0);
    }

    @Override
    public void closePath() throws IOException {
        if (currentPoint != null && subpathStart != null) {
            addSegment(currentPoint, subpathStart);
            currentPoint = subpathStart;
        }
    }

    @Override
    public void endPath() throws IOException {
        currentPath.clear();
    }

    @Override
    public void strokePath() throws IOException {
        commitPath();
    }

    @Override
    public void fillPath(int windingRule) throws IOException {
        commitPath();
    }

    @Override
    public void fillAndStrokePath(int windingRule) throws IOException {
        commitPath();
    }

    @Override
    public void clip(int windingRule) throws IOException {
        // The path is discarded by the following 'n' operator
    }

    @Override
    public void shadingFill(COSName shadingName) throws IOException {
        // Shadings carry no rulings
    }

    private void addSegment(Point2D from, Point2D to) {
        currentPath.add(new double[]{from.getX(), from.getY(), to.getX(), to.getY()});
    }

    private void commitPath() {
        for (double[] segment : currentPath) {
            double x0 = toX(segment[0]);
            double y0 = toTop(segment[1]);
            double x1 = toX(segment[2]);
            double y1 = toTop(segment[3]);

            Ruling ruling = null;
            if (Math.abs(y0 - y1) <= AXIS_SLACK) {
                ruling = Ruling.horizontal((y0 + y1) / 2, x0, x1);
            } else if (Math.abs(x0 - x1) <= AXIS_SLACK) {
                ruling = Ruling.vertical((x0 + x1) / 2, y0, y1);
            }
            if (ruling != null && ruling.length() >= MIN_RULING_LENGTH) {
                rulings.add(ruling);
            }
        }
        currentPath.clear();
        currentPoint = null;
        subpathStart = null;
    }

    private double toX(double pageX) {
        return pageX - cropBox.getLowerLeftX();
    }

    private double toTop(double pageY) {
        return cropBox.getUpperRightY() - pageY;
    }
}
