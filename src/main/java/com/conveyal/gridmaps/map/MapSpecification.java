package com.conveyal.gridmaps.map;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Describes the target pixel grid of an aggregation. Either the grid is given explicitly by its origin, increments
 * and dimensions, or it is derived from the grid cells themselves using a pixel-to-cell size ratio.
 * Equals and hashcode are semantic.
 */
public abstract class MapSpecification {

    /** Ratio used when a map is derived from the grid and no ratio is given. */
    public static final double DEFAULT_PIXEL_TO_CELL_RATIO = 2.0;

    private MapSpecification () { }

    public static Explicit explicit (double xori, double yori, double xinc, double yinc, int ncol, int nrow) {
        return new Explicit(xori, yori, xinc, yinc, ncol, nrow, 0);
    }

    /**
     * Rotated maps are not supported, but a rotation is accepted here so that it can be rejected loudly when the
     * axes are built rather than silently dropped by whatever produced the template.
     */
    public static Explicit explicit (
            double xori, double yori, double xinc, double yinc, int ncol, int nrow, double rotation
    ) {
        return new Explicit(xori, yori, xinc, yinc, ncol, nrow, rotation);
    }

    public static Derived fromPixelToCellRatio (double ratio) {
        return new Derived(ratio);
    }

    /** A regular map with the first pixel center at (xori, yori) and ncol x nrow pixels. */
    public static final class Explicit extends MapSpecification {
        public final double xori;
        public final double yori;
        public final double xinc;
        public final double yinc;
        public final int ncol;
        public final int nrow;
        /** Rotation in degrees. Anything but zero is refused by MapAxes. */
        public final double rotation;

        private Explicit (double xori, double yori, double xinc, double yinc, int ncol, int nrow, double rotation) {
            checkArgument(ncol > 0 && nrow > 0, "Map must have at least one column and one row, got %s x %s.",
                    ncol, nrow);
            checkArgument(xinc > 0 && yinc > 0, "Map increments must be positive, got %s and %s.", xinc, yinc);
            checkArgument(Double.isFinite(xori) && Double.isFinite(yori), "Map origin must be finite.");
            MapAxes.checkPixelCount(ncol, nrow);
            checkDistinctCenters(xori, xinc, ncol, "x");
            checkDistinctCenters(yori, yinc, nrow, "y");
            this.xori = xori;
            this.yori = yori;
            this.xinc = xinc;
            this.yinc = yinc;
            this.ncol = ncol;
            this.nrow = nrow;
            this.rotation = rotation;
        }

        /**
         * An increment that is tiny next to the origin is lost to floating point rounding, giving several pixels the
         * same center.
         */
        private static void checkDistinctCenters (double origin, double increment, int n, String axis) {
            checkArgument(Double.isFinite(increment), "Map %s increment must be finite.", axis);
            double previous = origin;
            for (int i = 1; i < n; i++) {
                double center = origin + i * increment;
                checkArgument(center > previous && Double.isFinite(center),
                        "Map %s increment %s is too small to separate pixel centers at origin %s.", axis, increment,
                        origin);
                previous = center;
            }
        }

        public boolean isRotated () {
            return rotation != 0;
        }

        @Override
        public boolean equals (Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Explicit other = (Explicit) o;
            return Double.compare(xori, other.xori) == 0 && Double.compare(yori, other.yori) == 0
                    && Double.compare(xinc, other.xinc) == 0 && Double.compare(yinc, other.yinc) == 0
                    && ncol == other.ncol && nrow == other.nrow && Double.compare(rotation, other.rotation) == 0;
        }

        @Override
        public int hashCode () {
            return Objects.hash(xori, yori, xinc, yinc, ncol, nrow, rotation);
        }

        @Override
        public String toString () {
            return String.format("[map origin (%s, %s) increment (%s, %s) size %dx%d rotation %s]", xori, yori, xinc,
                    yinc, ncol, nrow, rotation);
        }
    }

    /**
     * A map covering the bounding box of all cell footprints, whose pixel size is the mean cell size divided by the
     * given ratio. A ratio of 2 gives pixels about half as wide as the cells.
     */
    public static final class Derived extends MapSpecification {
        public final double pixelToCellRatio;

        private Derived (double pixelToCellRatio) {
            checkArgument(pixelToCellRatio > 0 && Double.isFinite(pixelToCellRatio),
                    "Pixel to cell ratio must be positive and finite, got %s.", pixelToCellRatio);
            this.pixelToCellRatio = pixelToCellRatio;
        }

        @Override
        public boolean equals (Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Double.compare(pixelToCellRatio, ((Derived) o).pixelToCellRatio) == 0;
        }

        @Override
        public int hashCode () {
            return Double.hashCode(pixelToCellRatio);
        }

        @Override
        public String toString () {
            return String.format("[map derived from grid, pixel to cell ratio %s]", pixelToCellRatio);
        }
    }

}
