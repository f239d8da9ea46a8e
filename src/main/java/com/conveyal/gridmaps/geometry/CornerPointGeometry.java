package com.conveyal.gridmaps.geometry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * The geometry of the active cells of a corner-point grid: for each cell eight (x, y, z) corners and a thickness.
 * Corners 0 through 3 lie on the top face and corners 4 through 7 on the bottom face, with corner p + 4 on the same
 * pillar as corner p. Within a face, corners are ordered (i, j), (i + 1, j), (i, j + 1), (i + 1, j + 1), so walking
 * them in the order 0, 1, 3, 2 traces the face boundary.
 *
 * Coordinates are held in one flat array indexed by cell, then corner, then axis, to avoid allocating an object
 * per cell on large grids. Instances are never modified after construction.
 */
public class CornerPointGeometry {

    public static final int CORNERS_PER_CELL = 8;

    public static final int PILLARS_PER_CELL = 4;

    /** Number of doubles used to store the corners of one cell. */
    public static final int VALUES_PER_CELL = CORNERS_PER_CELL * 3;

    private final int cellCount;

    private final double[] corners;

    private final double[] thickness;

    /**
     * @param corners flat array of length cellCount * 24, cell-major, then corner, then x, y, z.
     * @param thickness one vertical thickness per cell.
     */
    public CornerPointGeometry (int cellCount, double[] corners, double[] thickness) {
        checkArgument(cellCount >= 0, "Cell count must not be negative.");
        checkArgument(corners.length == cellCount * VALUES_PER_CELL,
                "Expected %s corner coordinates for %s cells, got %s.",
                cellCount * VALUES_PER_CELL, cellCount, corners.length);
        checkArgument(thickness.length == cellCount,
                "Expected %s thickness values, got %s.", cellCount, thickness.length);
        this.cellCount = cellCount;
        this.corners = corners;
        this.thickness = thickness;
    }

    /**
     * Create geometry whose cell thickness is derived from the corners, as the mean vertical distance between the
     * top and bottom corner of each of the four pillars.
     */
    public static CornerPointGeometry withDerivedThickness (int cellCount, double[] corners) {
        checkArgument(corners.length == cellCount * VALUES_PER_CELL,
                "Expected %s corner coordinates for %s cells, got %s.",
                cellCount * VALUES_PER_CELL, cellCount, corners.length);
        double[] thickness = new double[cellCount];
        for (int cell = 0; cell < cellCount; cell++) {
            double sum = 0;
            for (int p = 0; p < PILLARS_PER_CELL; p++) {
                int top = cell * VALUES_PER_CELL + p * 3 + 2;
                int bottom = top + PILLARS_PER_CELL * 3;
                sum += Math.abs(corners[bottom] - corners[top]);
            }
            thickness[cell] = sum / PILLARS_PER_CELL;
        }
        return new CornerPointGeometry(cellCount, corners, thickness);
    }

    public int cellCount () {
        return cellCount;
    }

    public double cornerX (int cell, int corner) {
        return corners[index(cell, corner)];
    }

    public double cornerY (int cell, int corner) {
        return corners[index(cell, corner) + 1];
    }

    public double cornerZ (int cell, int corner) {
        return corners[index(cell, corner) + 2];
    }

    public double thickness (int cell) {
        checkElementIndex(cell, cellCount);
        return thickness[cell];
    }

    /**
     * Restrict full-grid geometry to the cells flagged true in the given mask, typically the grid's active-cell
     * flags. The order of the remaining cells is preserved.
     */
    public CornerPointGeometry restrictTo (boolean[] mask) {
        checkArgument(mask.length == cellCount, "Mask has %s entries for %s cells.", mask.length, cellCount);
        int kept = 0;
        for (boolean m : mask) if (m) kept++;
        int[] cells = new int[kept];
        for (int cell = 0, k = 0; cell < cellCount; cell++) {
            if (mask[cell]) cells[k++] = cell;
        }
        return subset(cells);
    }

    /** Return geometry for only the given cells, in the order they are listed. */
    public CornerPointGeometry subset (int[] cells) {
        double[] subCorners = new double[cells.length * VALUES_PER_CELL];
        double[] subThickness = new double[cells.length];
        for (int i = 0; i < cells.length; i++) {
            int cell = cells[i];
            checkElementIndex(cell, cellCount);
            System.arraycopy(corners, cell * VALUES_PER_CELL, subCorners, i * VALUES_PER_CELL, VALUES_PER_CELL);
            subThickness[i] = thickness[cell];
        }
        return new CornerPointGeometry(cells.length, subCorners, subThickness);
    }

    private int index (int cell, int corner) {
        checkElementIndex(cell, cellCount);
        checkElementIndex(corner, CORNERS_PER_CELL);
        return cell * VALUES_PER_CELL + corner * 3;
    }

}
