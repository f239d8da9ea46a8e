package com.conveyal.gridmaps.aggregate;

import java.util.Locale;

/**
 * How the values of all cells connected to one pixel are reduced to a single pixel value.
 */
public enum AggregationMethod {

    MAX, MIN, MEAN, SUM;

    /**
     * Only MEAN and SUM take cell weights into account. Weighting a reduction that picks a single winning value is
     * meaningless, so it is refused rather than ignored.
     */
    public boolean supportsWeights () {
        return this == MEAN || this == SUM;
    }

    /** Lower case name, used in map names. */
    public String tag () {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup by name, e.g. "max" or "Mean".
     * @throws IllegalArgumentException for unknown names.
     */
    public static AggregationMethod fromString (String name) {
        if (name == null) {
            throw new IllegalArgumentException("Aggregation method must be specified.");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation method: " + name, e);
        }
    }

}
