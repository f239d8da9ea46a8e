package com.conveyal.gridmaps.connect;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

/**
 * The verified (pixel, cell) pairs of a map and a grid, meaning the pixel center lies inside the cell footprint.
 * Pairs are sorted by pixel and then by cell, and stored as one array of cell indexes segmented by pixel: the cells
 * connected to pixel p are cells[pixelStart[p]] up to but excluding cells[pixelStart[p + 1]]. Storage is proportional
 * to the number of pixels plus the number of connections, never to their product.
 */
public class Connections {

    private final int pixelCount;

    /** Offsets into the cells array, one per pixel plus a final entry equal to the number of connections. */
    private final int[] pixelStart;

    /** Connected cell indexes, grouped by pixel and ascending within each pixel. */
    private final int[] cells;

    private Connections (int pixelCount, int[] pixelStart, int[] cells) {
        this.pixelCount = pixelCount;
        this.pixelStart = pixelStart;
        this.cells = cells;
    }

    /**
     * Group per-cell lists of connected pixels by pixel, with a counting sort. Because cells are visited in order,
     * the cells within each pixel segment come out ascending.
     *
     * @param pixelsPerCell for each cell, the linear indexes of the pixels it contains.
     */
    public static Connections fromPixelsPerCell (int pixelCount, int[][] pixelsPerCell) {
        int[] pixelStart = new int[pixelCount + 1];
        long total = 0;
        for (int[] pixels : pixelsPerCell) {
            for (int pixel : pixels) {
                checkElementIndex(pixel, pixelCount);
                pixelStart[pixel + 1] += 1;
            }
            total += pixels.length;
        }
        checkArgument(total <= Integer.MAX_VALUE, "Too many pixel to cell connections: %s", total);
        for (int p = 0; p < pixelCount; p++) {
            pixelStart[p + 1] += pixelStart[p];
        }
        int[] cells = new int[(int) total];
        int[] cursor = new int[pixelCount];
        System.arraycopy(pixelStart, 0, cursor, 0, pixelCount);
        for (int cell = 0; cell < pixelsPerCell.length; cell++) {
            for (int pixel : pixelsPerCell[cell]) {
                cells[cursor[pixel]++] = cell;
            }
        }
        checkState(pixelCount == 0 || cursor[pixelCount - 1] == pixelStart[pixelCount],
                "Connections were not completely filled.");
        return new Connections(pixelCount, pixelStart, cells);
    }

    public int pixelCount () {
        return pixelCount;
    }

    /** Total number of (pixel, cell) connections. */
    public int size () {
        return cells.length;
    }

    /** Position in the connection table of the first cell connected to the given pixel. */
    public int start (int pixel) {
        return pixelStart[pixel];
    }

    /** Position in the connection table just past the last cell connected to the given pixel. */
    public int end (int pixel) {
        return pixelStart[pixel + 1];
    }

    /** The cell index of the connection at the given position in the table. */
    public int cell (int connection) {
        return cells[connection];
    }

    /** Number of cells connected to the given pixel. */
    public int cellCount (int pixel) {
        return pixelStart[pixel + 1] - pixelStart[pixel];
    }

    /** Pixel linear index of each connection, in table order. Allocated on each call. */
    public int[] pixelColumn () {
        int[] pixels = new int[cells.length];
        for (int p = 0; p < pixelCount; p++) {
            for (int c = pixelStart[p]; c < pixelStart[p + 1]; c++) pixels[c] = p;
        }
        return pixels;
    }

    /** Cell index of each connection, in table order. */
    public int[] cellColumn () {
        return cells.clone();
    }

}
