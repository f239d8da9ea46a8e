package com.conveyal.gridmaps.map;

import com.conveyal.gridmaps.geometry.Footprints;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * The pixel-center coordinates of a regular, unrotated map. Both axes are strictly ascending with constant spacing
 * and at least one element. Pixels are identified by a linear index in which y changes fastest, matching the
 * (x, y) dimension order of the output arrays: index = ix * rowCount + iy.
 */
public class MapAxes {

    private static final Logger LOG = LoggerFactory.getLogger(MapAxes.class);

    /** Slack on the upper end of derived axes, so a final center landing exactly on the bound is kept. */
    private static final double UPPER_BOUND_TOLERANCE = 1e-12;

    private final double[] x;
    private final double[] y;

    /** The axes are copied before they are checked, so the caller may reuse its arrays. */
    public MapAxes (double[] x, double[] y) {
        x = x.clone();
        y = y.clone();
        checkAscending(x, "x");
        checkAscending(y, "y");
        checkPixelCount(x.length, y.length);
        this.x = x;
        this.y = y;
    }

    /**
     * Pixel indexes are ints, and the connection table needs one offset past the last pixel, so the pixel count must
     * stay below Integer.MAX_VALUE.
     */
    static void checkPixelCount (int columns, int rows) {
        checkArgument((long) columns * rows < Integer.MAX_VALUE, "Map of %s x %s pixels is too large.", columns, rows);
    }

    /**
     * Produce the axes for a map specification. Explicit maps are copied as given; derived maps cover the bounding
     * box of all footprints with a resolution set by the mean footprint size.
     *
     * @throws UnsupportedOperationException if the specification is rotated.
     */
    public static MapAxes build (MapSpecification specification, Footprints footprints) {
        if (specification instanceof MapSpecification.Explicit) {
            return fromExplicit((MapSpecification.Explicit) specification);
        } else if (specification instanceof MapSpecification.Derived) {
            return derive(footprints, ((MapSpecification.Derived) specification).pixelToCellRatio);
        } else {
            throw new UnsupportedOperationException("Unrecognized map specification: " + specification);
        }
    }

    public static MapAxes fromExplicit (MapSpecification.Explicit spec) {
        if (spec.isRotated()) {
            throw new UnsupportedOperationException(
                    "Rotated maps are not supported, map rotation is " + spec.rotation + " degrees.");
        }
        double[] x = new double[spec.ncol];
        double[] y = new double[spec.nrow];
        for (int i = 0; i < x.length; i++) x[i] = spec.xori + i * spec.xinc;
        for (int j = 0; j < y.length; j++) y[j] = spec.yori + j * spec.yinc;
        return new MapAxes(x, y);
    }

    /**
     * Derive axes whose pixel size is the mean of the mean footprint width and mean footprint height, divided by
     * the pixel to cell ratio. Pixel centers run from half a pixel inside the lower edge of the footprint bounding box
     * to half a pixel inside its upper edge. Footprints with non-finite coordinates are ignored.
     */
    public static MapAxes derive (Footprints footprints, double pixelToCellRatio) {
        checkArgument(pixelToCellRatio > 0, "Pixel to cell ratio must be positive, got %s.", pixelToCellRatio);
        Envelope box = footprints.boundingBox();
        checkArgument(!box.isNull(), "Cannot derive a map from a grid without any finite cell footprints.");
        double resolution = (footprints.meanExtentX() + footprints.meanExtentY()) / 2 / pixelToCellRatio;
        checkArgument(resolution > 0 && Double.isFinite(resolution),
                "Cannot derive a map from cells of zero size (resolution %s).", resolution);
        MapAxes axes = new MapAxes(
                centers(box.getMinX(), box.getMaxX(), resolution),
                centers(box.getMinY(), box.getMaxY(), resolution)
        );
        LOG.info("Derived {}x{} pixel map with resolution {} covering {}.", axes.columnCount(), axes.rowCount(),
                resolution, box);
        return axes;
    }

    private static double[] centers (double min, double max, double resolution) {
        double first = min + resolution / 2;
        double last = max - resolution / 2 + UPPER_BOUND_TOLERANCE;
        int n = (int) Math.ceil((last - first) / resolution);
        if (n < 1) {
            // The box is narrower than one pixel. Center a single pixel on it.
            return new double[] { (min + max) / 2 };
        }
        double[] centers = new double[n];
        for (int i = 0; i < n; i++) centers[i] = first + i * resolution;
        return centers;
    }

    private static void checkAscending (double[] axis, String name) {
        checkArgument(axis.length > 0, "The %s axis must have at least one pixel.", name);
        for (int i = 1; i < axis.length; i++) {
            checkArgument(axis[i] > axis[i - 1], "The %s axis must be strictly ascending.", name);
        }
    }

    /** Number of pixels along x, the first dimension of output arrays. */
    public int columnCount () {
        return x.length;
    }

    /** Number of pixels along y, the second dimension of output arrays. */
    public int rowCount () {
        return y.length;
    }

    public int pixelCount () {
        return x.length * y.length;
    }

    public int pixelIndex (int ix, int iy) {
        checkElementIndex(ix, x.length);
        checkElementIndex(iy, y.length);
        return ix * y.length + iy;
    }

    public double x (int ix) {
        return x[ix];
    }

    public double y (int iy) {
        return y[iy];
    }

    public double centerX (int pixel) {
        return x[pixel / y.length];
    }

    public double centerY (int pixel) {
        return y[pixel % y.length];
    }

    /** Copy of the x axis. */
    public double[] xAxis () {
        return x.clone();
    }

    /** Copy of the y axis. */
    public double[] yAxis () {
        return y.clone();
    }

    /**
     * Index of the first x center that is not below the given coordinate, or columnCount() if there is none.
     * Pixels in [firstAtOrAboveX(min), firstAtOrAboveX(max)) have centers in [min, max).
     */
    public int firstAtOrAboveX (double coordinate) {
        return firstAtOrAbove(x, coordinate);
    }

    public int firstAtOrAboveY (double coordinate) {
        return firstAtOrAbove(y, coordinate);
    }

    // Arrays.binarySearch makes no promise about which of several equal elements it finds, so search by hand for
    // the leftmost insertion point.
    private static int firstAtOrAbove (double[] axis, double coordinate) {
        int lo = 0;
        int hi = axis.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (axis[mid] < coordinate) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    @Override
    public String toString () {
        return String.format("[%dx%d pixels, x %s to %s, y %s to %s]", x.length, y.length, x[0], x[x.length - 1],
                y[0], y[y.length - 1]);
    }

}
