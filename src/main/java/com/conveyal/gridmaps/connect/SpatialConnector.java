package com.conveyal.gridmaps.connect;

import com.conveyal.gridmaps.geometry.Footprints;
import com.conveyal.gridmaps.map.MapAxes;
import com.conveyal.gridmaps.util.LambdaCounter;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

import static com.conveyal.gridmaps.geometry.Footprints.VERTICES;

/**
 * Finds which map pixels fall inside which grid cells. A pixel belongs to a cell when its center lies inside the
 * cell footprint; no partial overlap areas are computed.
 *
 * Candidates are found per cell by locating the range of pixel centers within the footprint bounding box along each
 * axis with a binary search, so the work per cell is proportional to the pixels near that cell rather than to the
 * size of the map. Each candidate is then checked against the footprint polygon itself.
 */
public abstract class SpatialConnector {

    private static final Logger LOG = LoggerFactory.getLogger(SpatialConnector.class);

    /** Edges whose x extent is smaller than this are widened to it, to keep the edge interpolation finite. */
    public static final double MIN_EDGE_DX = 1e-12;

    private static final int[] NO_PIXELS = new int[0];

    public static Connections connect (MapAxes axes, Footprints footprints, int logFrequency) {
        final int cellCount = footprints.cellCount();
        final LambdaCounter cellCounter = new LambdaCounter(LOG, cellCount, logFrequency,
                "Tested {} of {} cells for contained pixel centers.");
        // Each cell produces its own array, and toArray keeps encounter order, so the result does not depend on how
        // the parallel stream splits up the work.
        int[][] pixelsPerCell = IntStream.range(0, cellCount)
                .parallel()
                .mapToObj(cell -> {
                    int[] pixels = containedPixels(axes, footprints, cell);
                    cellCounter.increment();
                    return pixels;
                })
                .toArray(int[][]::new);
        cellCounter.done();
        Connections connections = Connections.fromPixelsPerCell(axes.pixelCount(), pixelsPerCell);
        LOG.info("Found {} pixel to cell connections between {} pixels and {} cells.", connections.size(),
                axes.pixelCount(), cellCount);
        return connections;
    }

    /**
     * Return the linear indexes of all pixels whose centers lie inside the footprint of the given cell. Candidates
     * are the pixels with centers in [min, max) of the footprint bounding box on both axes.
     */
    public static int[] containedPixels (MapAxes axes, Footprints footprints, int cell) {
        if (!footprints.isFinite(cell)) {
            return NO_PIXELS;
        }
        int i0 = axes.firstAtOrAboveX(footprints.minX(cell));
        int i1 = axes.firstAtOrAboveX(footprints.maxX(cell));
        int j0 = axes.firstAtOrAboveY(footprints.minY(cell));
        int j1 = axes.firstAtOrAboveY(footprints.maxY(cell));
        if (i1 <= i0 || j1 <= j0) {
            return NO_PIXELS;
        }
        TIntArrayList pixels = new TIntArrayList((i1 - i0) * (j1 - j0));
        for (int i = i0; i < i1; i++) {
            double x = axes.x(i);
            for (int j = j0; j < j1; j++) {
                if (contains(footprints, cell, x, axes.y(j))) {
                    pixels.add(axes.pixelIndex(i, j));
                }
            }
        }
        return pixels.toArray();
    }

    /**
     * Crossing number test of a point against a cell footprint. Each polygon edge is interpolated at the x
     * coordinate of the point, and edges spanning that x with an interpolated y at or above the point are counted.
     * The point is inside if the count is odd. Footprints with any non-finite coordinate contain nothing.
     */
    public static boolean contains (Footprints footprints, int cell, double x, double y) {
        if (!footprints.isFinite(cell)) {
            return false;
        }
        int crossings = 0;
        for (int v = 0; v < VERTICES; v++) {
            int next = (v + 1) % VERTICES;
            double x0 = footprints.vertexX(v, cell);
            double y0 = footprints.vertexY(v, cell);
            double x1 = footprints.vertexX(next, cell);
            double y1 = footprints.vertexY(next, cell);
            double dx = x1 - x0;
            if (Math.abs(dx) < MIN_EDGE_DX) {
                // Exactly vertical edges keep dx == 0 and never count as crossed.
                dx = Math.signum(dx) * MIN_EDGE_DX;
            }
            double w = (x - x0) / dx;
            double edgeY = (1 - w) * y0 + w * y1;
            if (w >= 0 && w <= 1 && edgeY >= y) {
                crossings++;
            }
        }
        return crossings % 2 == 1;
    }

}
