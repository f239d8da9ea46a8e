package com.conveyal.gridmaps.map;

import com.conveyal.gridmaps.SyntheticGrid;
import com.conveyal.gridmaps.geometry.Footprints;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MapAxesTest {

    @Test
    void explicitTemplateRoundTrip () {
        MapAxes axes = MapAxes.fromExplicit(MapSpecification.explicit(100, 200, 10, 10, 5, 3));
        Assertions.assertArrayEquals(new double[] {100, 110, 120, 130, 140}, axes.xAxis());
        Assertions.assertArrayEquals(new double[] {200, 210, 220}, axes.yAxis());
        Assertions.assertEquals(15, axes.pixelCount());
        Assertions.assertEquals(3 * 4 + 2, axes.pixelIndex(4, 2));
        Assertions.assertEquals(140, axes.centerX(14));
        Assertions.assertEquals(220, axes.centerY(14));
    }

    @Test
    void rotatedTemplateIsRejected () {
        MapSpecification spec = MapSpecification.explicit(0, 0, 1, 1, 2, 2, 15);
        Assertions.assertThrows(UnsupportedOperationException.class, () -> MapAxes.build(spec, null));
    }

    /** Pixels half as wide as the ten unit cells, from half a pixel inside each edge of the grid. */
    @Test
    void derivedFromFootprints () {
        Footprints footprints = Footprints.fromGeometry(new SyntheticGrid(4, 2, 0, 100, 10, 10, 0, 1).geometry());
        MapAxes axes = MapAxes.build(MapSpecification.fromPixelToCellRatio(2), footprints);
        Assertions.assertEquals(8, axes.columnCount());
        Assertions.assertEquals(4, axes.rowCount());
        Assertions.assertEquals(2.5, axes.x(0), 1e-12);
        Assertions.assertEquals(37.5, axes.x(7), 1e-12);
        Assertions.assertEquals(102.5, axes.y(0), 1e-12);
        Assertions.assertEquals(117.5, axes.y(3), 1e-12);
    }

    /** The resolution is the mean of the mean cell width and the mean cell height. */
    @Test
    void derivedResolutionAveragesBothDirections () {
        Footprints footprints = Footprints.fromGeometry(new SyntheticGrid(2, 2, 0, 0, 20, 10, 0, 1).geometry());
        MapAxes axes = MapAxes.derive(footprints, 1);
        double[] x = axes.xAxis();
        Assertions.assertEquals(15, x[1] - x[0], 1e-12);
        Assertions.assertEquals(7.5, x[0], 1e-12);
        Assertions.assertEquals(2, x.length);
        Assertions.assertEquals(1, axes.rowCount());
    }

    @Test
    void boxNarrowerThanOnePixelGetsCenteredPixel () {
        Footprints footprints = Footprints.fromGeometry(new SyntheticGrid(1, 1, 0, 0, 10, 10, 0, 1).geometry());
        MapAxes axes = MapAxes.derive(footprints, 0.25);
        Assertions.assertArrayEquals(new double[] {5}, axes.xAxis());
        Assertions.assertArrayEquals(new double[] {5}, axes.yAxis());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0, -1})
    void nonPositiveRatioIsRejected (double ratio) {
        Assertions.assertThrows(IllegalArgumentException.class, () -> MapSpecification.fromPixelToCellRatio(ratio));
    }

    @Test
    void invalidExplicitTemplatesAreRejected () {
        Assertions.assertThrows(IllegalArgumentException.class, () -> MapSpecification.explicit(0, 0, 0, 1, 2, 2));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MapSpecification.explicit(0, 0, 1, 1, 0, 2));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new MapAxes(new double[] {0, 1, 1}, new double[] {0}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new MapAxes(new double[0], new double[] {0}));
    }

    @Test
    void axesAreCopiedFromCallerArrays () {
        double[] x = {0, 10, 20};
        double[] y = {0};
        MapAxes axes = new MapAxes(x, y);
        x[1] = 50;
        y[0] = 7;
        Assertions.assertEquals(10, axes.x(1));
        Assertions.assertEquals(0, axes.y(0));
        Assertions.assertEquals(1, axes.firstAtOrAboveX(3));
        Assertions.assertEquals(2, axes.firstAtOrAboveX(15));
    }

    /** An increment lost to rounding at a large origin is refused when the template is made, not later. */
    @Test
    void indistinguishableCentersAreRejected () {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> MapSpecification.explicit(1e16, 0, 1, 1, 3, 1));
        Assertions.assertTrue(e.getMessage().contains("too small"), e.getMessage());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MapSpecification.explicit(0, -1e17, 1, 1, 1, 2));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MapSpecification.explicit(0, 0, Double.POSITIVE_INFINITY, 1, 2, 2));
    }

    @Test
    void oversizedTemplatesAreRejected () {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> MapSpecification.explicit(0, 0, 1, 1, 100_000, 100_000));
        Assertions.assertTrue(e.getMessage().contains("too large"), e.getMessage());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MapSpecification.explicit(0, 0, 1, 1, Integer.MAX_VALUE, 1));
    }

    /** Coordinates equal to a center find that center, so a range [min, max) includes a center exactly at min. */
    @Test
    void searchFindsLeftmostInsertionPoint () {
        MapAxes axes = new MapAxes(new double[] {0, 10, 20, 30}, new double[] {5});
        Assertions.assertEquals(0, axes.firstAtOrAboveX(-100));
        Assertions.assertEquals(0, axes.firstAtOrAboveX(0));
        Assertions.assertEquals(1, axes.firstAtOrAboveX(0.001));
        Assertions.assertEquals(2, axes.firstAtOrAboveX(20));
        Assertions.assertEquals(4, axes.firstAtOrAboveX(30.5));
        Assertions.assertEquals(1, axes.firstAtOrAboveY(6));
    }

}
