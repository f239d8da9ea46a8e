package com.conveyal.gridmaps.aggregate;

import com.conveyal.gridmaps.connect.Connections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Reduces the cell values connected to each pixel into a single pixel value, for one property under one filter.
 *
 * Connections are already grouped by pixel, so each pixel is folded independently with explicit accumulators: a
 * running extreme for MAX and MIN, or a weighted sum and total weight for MEAN and SUM. A pixel only gets a value
 * when at least one connection passes the filter and carries a valid sample, so there is never an implicit zero
 * competing with real data. Within a pixel, cells are visited in ascending index order, so floating point sums come
 * out the same no matter which thread performs the reduction.
 *
 * Every cell contributes its full weight to every pixel it contains. Weights are not split between the pixels a
 * large cell covers.
 */
public class PixelReducer {

    private static final Logger LOG = LoggerFactory.getLogger(PixelReducer.class);

    private final Connections connections;

    private final int columnCount;

    private final int rowCount;

    /** One weight per cell, or null to weight every cell equally. */
    private final double[] weights;

    private final AggregationMethod method;

    public PixelReducer (
            Connections connections, int columnCount, int rowCount, double[] weights, AggregationMethod method
    ) {
        checkState(connections.pixelCount() == columnCount * rowCount,
                "Connections cover %s pixels but the map has %sx%s.", connections.pixelCount(), columnCount,
                rowCount);
        checkArgument(weights == null || method.supportsWeights(),
                "Cell weights cannot be applied to the %s aggregation method.", method);
        this.connections = connections;
        this.columnCount = columnCount;
        this.rowCount = rowCount;
        this.weights = weights;
        this.method = method;
    }

    public AggregatedMap reduce (InclusionFilter filter, PropertyValues property) {
        double[][] result = new double[columnCount][rowCount];
        if (filter.excludesAll() || !property.anyValid()) {
            LOG.debug("No cells contribute to {} under {}, map is empty.", property.name, filter.name);
            for (double[] column : result) Arrays.fill(column, AggregatedMap.NO_DATA);
            return new AggregatedMap(filter.name, property.name, result);
        }
        int pixel = 0;
        for (int x = 0; x < columnCount; x++) {
            for (int y = 0; y < rowCount; y++, pixel++) {
                result[x][y] = reducePixel(pixel, filter, property);
            }
        }
        return new AggregatedMap(filter.name, property.name, result);
    }

    private double reducePixel (int pixel, InclusionFilter filter, PropertyValues property) {
        double accumulator = 0;
        double totalWeight = 0;
        int count = 0;
        for (int c = connections.start(pixel), end = connections.end(pixel); c < end; c++) {
            int cell = connections.cell(c);
            if (!filter.includes(cell) || !property.isValid(cell)) continue;
            double value = property.value(cell);
            double weight = weights == null ? 1 : weights[cell];
            switch (method) {
                case MAX:
                    accumulator = count == 0 ? value : Math.max(accumulator, value);
                    break;
                case MIN:
                    accumulator = count == 0 ? value : Math.min(accumulator, value);
                    break;
                case MEAN:
                case SUM:
                    accumulator += value * weight;
                    break;
                default:
                    throw new UnsupportedOperationException("Aggregation method not implemented: " + method);
            }
            totalWeight += weight;
            count += 1;
        }
        if (count == 0 || totalWeight == 0) {
            return AggregatedMap.NO_DATA;
        }
        return method == AggregationMethod.MEAN ? accumulator / totalWeight : accumulator;
    }

}
