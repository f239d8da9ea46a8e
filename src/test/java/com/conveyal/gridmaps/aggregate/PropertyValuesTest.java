package com.conveyal.gridmaps.aggregate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PropertyValuesTest {

    @Test
    void lowerThresholdInvalidatesSmallerValues () {
        PropertyValues sgas = PropertyValues.fromNullable("sgas", new Double[] {0.0, 0.1, null, 0.5});
        PropertyValues thresholded = sgas.withLowerThreshold(0.1);
        assertFalse(thresholded.isValid(0));
        assertTrue(thresholded.isValid(1));
        assertFalse(thresholded.isValid(2));
        assertTrue(thresholded.isValid(3));
        // The thresholded copy leaves the source property alone.
        assertTrue(sgas.isValid(0));
    }

    @Test
    void subsetFollowsGivenOrder () {
        PropertyValues values = PropertyValues.fromNullable("p", new Double[] {1.0, null, 3.0});
        PropertyValues subset = values.subset(new int[] {2, 1});
        assertEquals(2, subset.size());
        assertEquals(3.0, subset.value(0));
        assertFalse(subset.isValid(1));
        assertTrue(subset.anyValid());
        assertFalse(subset.subset(new int[] {1}).anyValid());
        assertEquals("q", subset.rename("q").name);
    }

    @Test
    void samplesAreCopiedFromCallerArrays () {
        double[] values = {1, 2};
        boolean[] valid = {true, false};
        PropertyValues property = new PropertyValues("p", values, valid);
        PropertyValues allValid = PropertyValues.allValid("q", values);
        values[0] = Double.NaN;
        valid[1] = true;
        assertEquals(1, property.value(0));
        assertTrue(property.isValid(0));
        assertFalse(property.isValid(1));
        assertEquals(1, allValid.value(0));
    }

    @Test
    void filterMasksAreCopiedFromCallerArrays () {
        boolean[] mask = {true, false};
        InclusionFilter filter = InclusionFilter.of("zone", mask);
        mask[0] = false;
        mask[1] = true;
        assertTrue(filter.includes(0));
        assertFalse(filter.includes(1));
    }

    @Test
    void validSamplesMustBeFinite () {
        assertThrows(IllegalArgumentException.class,
                () -> PropertyValues.allValid("p", new double[] {1, Double.NaN}));
        assertThrows(IllegalArgumentException.class,
                () -> new PropertyValues("p", new double[] {1, 2}, new boolean[] {true}));
        // An invalid sample may hold anything.
        new PropertyValues("p", new double[] {Double.NaN}, new boolean[] {false});
    }

}
