package com.conveyal.gridmaps.aggregate;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MigrationTimeTest {

    private static final List<LocalDate> DATES = List.of(
            LocalDate.of(2030, 1, 1),
            LocalDate.of(2031, 1, 1),
            LocalDate.of(2032, 1, 1)
    );

    @Test
    void earliestTimeAboveThreshold () {
        List<PropertyValues> series = List.of(
                PropertyValues.fromNullable("sgas", new Double[] {0.2, 0.0, 0.0, null}),
                PropertyValues.fromNullable("sgas", new Double[] {0.0, 0.05, 0.0, 0.3}),
                PropertyValues.fromNullable("sgas", new Double[] {0.0, 0.3, 0.1, 0.3})
        );
        PropertyValues arrival = MigrationTime.derive(series, DATES, 0.1);
        assertEquals(MigrationTime.PROPERTY_NAME, arrival.name);
        assertEquals(0, arrival.value(0));
        // 2032-01-01 is 730 days after 2030-01-01.
        assertEquals(2, arrival.value(1));
        // Equal to the threshold is not above it.
        assertFalse(arrival.isValid(2));
        assertEquals(1, arrival.value(3));
    }

    @Test
    void seriesAndDatesMustAlign () {
        PropertyValues one = PropertyValues.allValid("sgas", new double[] {1});
        assertThrows(IllegalArgumentException.class, () -> MigrationTime.derive(List.of(one), DATES, 0));
        assertThrows(IllegalArgumentException.class, () -> MigrationTime.derive(List.of(), List.of(), 0));
    }

}
