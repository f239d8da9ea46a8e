package com.conveyal.gridmaps.aggregate;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named property with one sample per active cell. Each sample is a value paired with a validity flag; invalid
 * samples never contribute to any map. Valid samples must be finite, so no numeric value doubles as a marker for
 * missing data.
 */
public class PropertyValues {

    public final String name;

    private final double[] values;

    private final boolean[] valid;

    /** The arrays are copied, so later changes to them by the caller have no effect. */
    public PropertyValues (String name, double[] values, boolean[] valid) {
        checkNotNull(name, "Property name must not be null.");
        checkArgument(values.length == valid.length, "Property %s has %s values but %s validity flags.", name,
                values.length, valid.length);
        for (int i = 0; i < values.length; i++) {
            checkArgument(!valid[i] || Double.isFinite(values[i]),
                    "Property %s has a non-finite value %s at cell %s marked valid.", name, values[i], i);
        }
        this.name = name;
        this.values = values.clone();
        this.valid = valid.clone();
    }

    /** A property whose samples are all valid. */
    public static PropertyValues allValid (String name, double[] values) {
        boolean[] valid = new boolean[values.length];
        Arrays.fill(valid, true);
        return new PropertyValues(name, values, valid);
    }

    /** A property where null entries are invalid samples. */
    public static PropertyValues fromNullable (String name, Double[] samples) {
        double[] values = new double[samples.length];
        boolean[] valid = new boolean[samples.length];
        for (int i = 0; i < samples.length; i++) {
            if (samples[i] != null) {
                values[i] = samples[i];
                valid[i] = true;
            }
        }
        return new PropertyValues(name, values, valid);
    }

    public int size () {
        return values.length;
    }

    public boolean isValid (int cell) {
        return valid[cell];
    }

    /** The value of a sample. Only meaningful when isValid(cell) is true; callers check that first. */
    public double value (int cell) {
        return values[cell];
    }

    public boolean anyValid () {
        for (boolean v : valid) if (v) return true;
        return false;
    }

    /** Copy of this property where samples with values strictly below the threshold are invalid. */
    public PropertyValues withLowerThreshold (double threshold) {
        boolean[] thresholded = new boolean[valid.length];
        for (int i = 0; i < valid.length; i++) {
            thresholded[i] = valid[i] && !(values[i] < threshold);
        }
        return new PropertyValues(name, values, thresholded);
    }

    /** Copy of this property under another name. */
    public PropertyValues rename (String newName) {
        return new PropertyValues(newName, values, valid);
    }

    /** Samples for only the given cells, in the order listed. */
    public PropertyValues subset (int[] cells) {
        double[] subValues = new double[cells.length];
        boolean[] subValid = new boolean[cells.length];
        for (int i = 0; i < cells.length; i++) {
            subValues[i] = values[cells[i]];
            subValid[i] = valid[cells[i]];
        }
        return new PropertyValues(name, subValues, subValid);
    }

    @Override
    public String toString () {
        return String.format("[property %s, %d samples]", name, values.length);
    }

}
