package com.conveyal.gridmaps.aggregate;

/**
 * One output map: the aggregated value of one property under one filter at every pixel. Dimension order is (x, y),
 * with range [0, columnCount) and [0, rowCount). Pixels to which no valid sample contributed hold NO_DATA.
 */
public class AggregatedMap {

    /** Value of pixels without data. Test for it with isNoData or Double.isNaN, never with ==. */
    public static final double NO_DATA = Double.NaN;

    public final String filterName;

    public final String propertyName;

    public final double[][] values;

    public AggregatedMap (String filterName, String propertyName, double[][] values) {
        this.filterName = filterName;
        this.propertyName = propertyName;
        this.values = values;
    }

    public int columnCount () {
        return values.length;
    }

    public int rowCount () {
        return values.length == 0 ? 0 : values[0].length;
    }

    public double value (int x, int y) {
        return values[x][y];
    }

    public boolean isNoData (int x, int y) {
        return Double.isNaN(values[x][y]);
    }

    /** Number of pixels holding an aggregated value. */
    public int dataCount () {
        int n = 0;
        for (double[] column : values) {
            for (double v : column) {
                if (!Double.isNaN(v)) n++;
            }
        }
        return n;
    }

    @Override
    public String toString () {
        return String.format("[map of %s for %s, %dx%d]", propertyName, filterName, columnCount(), rowCount());
    }

}
