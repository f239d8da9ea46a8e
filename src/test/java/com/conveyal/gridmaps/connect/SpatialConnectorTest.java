package com.conveyal.gridmaps.connect;

import com.conveyal.gridmaps.SyntheticGrid;
import com.conveyal.gridmaps.geometry.Footprints;
import com.conveyal.gridmaps.map.MapAxes;
import com.conveyal.gridmaps.map.MapSpecification;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpatialConnectorTest {

    /** A vertical-pillar cell whose footprint is the given quadrilateral, in corner order 0, 1, 2, 3. */
    private static Footprints quad (double[] x, double[] y) {
        double[][] corners = new double[8][];
        for (int c = 0; c < 8; c++) {
            corners[c] = new double[] {x[c % 4], y[c % 4], c < 4 ? 0 : 1};
        }
        return Footprints.fromGeometry(SyntheticGrid.singleCell(corners));
    }

    @Test
    void squareContainment () {
        Footprints square = quad(new double[] {0, 10, 0, 10}, new double[] {0, 0, 10, 10});
        assertTrue(SpatialConnector.contains(square, 0, 5, 5));
        assertTrue(SpatialConnector.contains(square, 0, 0.001, 9.999));
        assertFalse(SpatialConnector.contains(square, 0, 11, 5));
        assertFalse(SpatialConnector.contains(square, 0, 5, -1));
        assertFalse(SpatialConnector.contains(square, 0, 5, 10.5));
    }

    /** A diamond has no vertical edges, so only the interpolated crossings decide. */
    @Test
    void diamondContainment () {
        // Corners 0 and 3 are opposite each other on the boundary walk 0, 1, 3, 2.
        Footprints diamond = quad(new double[] {0, 5, 5, 10}, new double[] {5, 0, 10, 5});
        assertTrue(SpatialConnector.contains(diamond, 0, 4, 5));
        assertTrue(SpatialConnector.contains(diamond, 0, 6, 5));
        assertTrue(SpatialConnector.contains(diamond, 0, 2, 5));
        assertFalse(SpatialConnector.contains(diamond, 0, 1, 1));
        assertFalse(SpatialConnector.contains(diamond, 0, 9, 9));
        assertFalse(SpatialConnector.contains(diamond, 0, 5, 11));
    }

    @Test
    void nanFootprintContainsNothing () {
        Footprints bad = quad(new double[] {0, Double.NaN, 0, 10}, new double[] {0, 0, 10, 10});
        assertFalse(SpatialConnector.contains(bad, 0, 5, 5));
        MapAxes axes = new MapAxes(new double[] {5}, new double[] {5});
        assertEquals(0, SpatialConnector.containedPixels(axes, bad, 0).length);
    }

    /** A skewed cell covers pixels on a diagonal band that its bounding box alone would overstate. */
    @Test
    void boundingBoxCandidatesArePruned () {
        Footprints parallelogram = quad(new double[] {0, 10, 10, 20}, new double[] {0, 0, 10, 10});
        MapAxes axes = MapAxes.fromExplicit(MapSpecification.explicit(0.5, 1, 2, 2, 10, 5));
        int[] pixels = SpatialConnector.containedPixels(axes, parallelogram, 0);
        for (int pixel : pixels) {
            double x = axes.centerX(pixel);
            double y = axes.centerY(pixel);
            assertTrue(x > y && x < y + 10, "pixel at " + x + ", " + y);
        }
        // Five rows of five pixels each fall inside.
        assertEquals(25, pixels.length);
    }

    @Test
    void connectionsAreGroupedByPixelAndCell () {
        SyntheticGrid grid = new SyntheticGrid(4, 3, 0, 0, 10, 10, 0, 1, 2);
        Footprints footprints = Footprints.fromGeometry(grid.geometry());
        MapAxes axes = MapAxes.derive(footprints, 2);
        Connections connections = SpatialConnector.connect(axes, footprints, 5);
        assertEquals(axes.pixelCount(), connections.pixelCount());
        // Each pixel lies in exactly one cell of each of the two layers.
        assertEquals(2 * axes.pixelCount(), connections.size());
        for (int p = 0; p < connections.pixelCount(); p++) {
            assertEquals(2, connections.cellCount(p));
            int upper = connections.cell(connections.start(p));
            int lower = connections.cell(connections.start(p) + 1);
            assertEquals(upper + grid.nx * grid.ny, lower);
            int ix = p / axes.rowCount();
            int iy = p % axes.rowCount();
            assertEquals(grid.cellIndex(ix / 2, iy / 2, 0), upper);
        }
    }

    @Test
    void pixelsOutsideEveryCellHaveNoConnections () {
        SyntheticGrid grid = new SyntheticGrid(1, 1, 0, 0, 10, 10, 0, 1);
        Footprints footprints = Footprints.fromGeometry(grid.geometry());
        MapAxes axes = MapAxes.fromExplicit(MapSpecification.explicit(-5, 5, 10, 10, 3, 1));
        Connections connections = SpatialConnector.connect(axes, footprints, 1);
        assertArrayEquals(new int[] {1}, connections.pixelColumn());
        assertArrayEquals(new int[] {0}, connections.cellColumn());
        assertEquals(0, connections.cellCount(0));
        assertEquals(0, connections.cellCount(2));
    }

}
