package com.conveyal.gridmaps.geometry;

import org.locationtech.jts.geom.Envelope;

import static com.conveyal.gridmaps.geometry.CornerPointGeometry.PILLARS_PER_CELL;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * The lateral footprint of every active cell: a quadrilateral whose vertices are the midpoints of the cell's four
 * pillars, halfway between the top and bottom face. Using pillar midpoints rather than clipping the top and bottom
 * faces keeps faulted or skewed cells to a single four-vertex polygon.
 *
 * Vertices are stored in boundary order (corners 0, 1, 3, 2) so that each footprint is a simple polygon. Dimension
 * order of the vertex arrays is (vertex, cell). The axis-aligned bounding box of each footprint is also kept.
 * Non-finite corner coordinates yield non-finite footprints, which contain no point.
 */
public class Footprints {

    /** Order in which the four pillars of a cell are visited to trace its boundary. */
    private static final int[] BOUNDARY_ORDER = {0, 1, 3, 2};

    public static final int VERTICES = BOUNDARY_ORDER.length;

    private final int cellCount;

    /** Footprint vertex coordinates. Dimension order is (vertex, cell). */
    private final double[][] xs;
    private final double[][] ys;

    private final double[] minX;
    private final double[] minY;
    private final double[] maxX;
    private final double[] maxY;

    private Footprints (int cellCount) {
        this.cellCount = cellCount;
        this.xs = new double[VERTICES][cellCount];
        this.ys = new double[VERTICES][cellCount];
        this.minX = new double[cellCount];
        this.minY = new double[cellCount];
        this.maxX = new double[cellCount];
        this.maxY = new double[cellCount];
    }

    /** Average the top and bottom corner of each pillar to find the mid-height footprint of every cell. */
    public static Footprints fromGeometry (CornerPointGeometry geometry) {
        Footprints footprints = new Footprints(geometry.cellCount());
        for (int cell = 0; cell < geometry.cellCount(); cell++) {
            double x0 = Double.POSITIVE_INFINITY, y0 = Double.POSITIVE_INFINITY;
            double x1 = Double.NEGATIVE_INFINITY, y1 = Double.NEGATIVE_INFINITY;
            for (int v = 0; v < VERTICES; v++) {
                int pillar = BOUNDARY_ORDER[v];
                double x = (geometry.cornerX(cell, pillar) + geometry.cornerX(cell, pillar + PILLARS_PER_CELL)) / 2;
                double y = (geometry.cornerY(cell, pillar) + geometry.cornerY(cell, pillar + PILLARS_PER_CELL)) / 2;
                footprints.xs[v][cell] = x;
                footprints.ys[v][cell] = y;
                // Math.min and max propagate NaN, so a cell with any bad corner gets a NaN bounding box.
                x0 = Math.min(x0, x);
                y0 = Math.min(y0, y);
                x1 = Math.max(x1, x);
                y1 = Math.max(y1, y);
            }
            footprints.minX[cell] = x0;
            footprints.minY[cell] = y0;
            footprints.maxX[cell] = x1;
            footprints.maxY[cell] = y1;
        }
        return footprints;
    }

    public int cellCount () {
        return cellCount;
    }

    public double vertexX (int vertex, int cell) {
        return xs[vertex][cell];
    }

    public double vertexY (int vertex, int cell) {
        return ys[vertex][cell];
    }

    public double minX (int cell) { return minX[cell]; }
    public double minY (int cell) { return minY[cell]; }
    public double maxX (int cell) { return maxX[cell]; }
    public double maxY (int cell) { return maxY[cell]; }

    /** True if every vertex coordinate of the cell's footprint is finite. */
    public boolean isFinite (int cell) {
        checkElementIndex(cell, cellCount);
        return Double.isFinite(minX[cell]) && Double.isFinite(minY[cell])
                && Double.isFinite(maxX[cell]) && Double.isFinite(maxY[cell]);
    }

    /** Bounding box of a single footprint. Null for footprints with non-finite coordinates. */
    public Envelope envelope (int cell) {
        if (!isFinite(cell)) return null;
        return new Envelope(minX[cell], maxX[cell], minY[cell], maxY[cell]);
    }

    /** Bounding box of all finite footprints. A null envelope (isNull() true) if there are none. */
    public Envelope boundingBox () {
        Envelope envelope = new Envelope();
        for (int cell = 0; cell < cellCount; cell++) {
            if (isFinite(cell)) {
                envelope.expandToInclude(minX[cell], minY[cell]);
                envelope.expandToInclude(maxX[cell], maxY[cell]);
            }
        }
        return envelope;
    }

    /** Mean width of the finite footprint bounding boxes, or NaN if there are none. */
    public double meanExtentX () {
        return meanExtent(minX, maxX);
    }

    /** Mean height of the finite footprint bounding boxes, or NaN if there are none. */
    public double meanExtentY () {
        return meanExtent(minY, maxY);
    }

    private double meanExtent (double[] min, double[] max) {
        double sum = 0;
        int n = 0;
        for (int cell = 0; cell < cellCount; cell++) {
            if (isFinite(cell)) {
                sum += max[cell] - min[cell];
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

}
