package com.conveyal.gridmaps.aggregate;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Derives, from a time series of one property (such as a gas saturation at successive report dates), the time at
 * which each cell first exceeds a threshold. Aggregating the result with MIN gives a map of first arrival times.
 */
public abstract class MigrationTime {

    public static final String PROPERTY_NAME = "MigrationTime";

    public static final double DAYS_PER_YEAR = 365;

    /**
     * @param series one property per date, all with the same number of cells.
     * @param dates the date of each property. Times are measured from the first date in this list.
     * @param threshold a sample must be strictly above this value to count as arrived.
     * @return for each cell, the years elapsed from the first date until the first date at which its sample is valid
     *         and above the threshold. Cells that never exceed the threshold have invalid samples.
     */
    public static PropertyValues derive (List<PropertyValues> series, List<LocalDate> dates, double threshold) {
        checkArgument(!series.isEmpty(), "A migration time needs at least one property.");
        checkArgument(series.size() == dates.size(), "Got %s properties but %s dates.", series.size(), dates.size());
        int cellCount = series.get(0).size();
        double[] years = new double[cellCount];
        boolean[] arrived = new boolean[cellCount];
        LocalDate start = dates.get(0);
        for (int t = 0; t < series.size(); t++) {
            PropertyValues property = series.get(t);
            checkArgument(property.size() == cellCount, "Property %s has %s cells, expected %s.", property.name,
                    property.size(), cellCount);
            double elapsed = ChronoUnit.DAYS.between(start, dates.get(t)) / DAYS_PER_YEAR;
            for (int cell = 0; cell < cellCount; cell++) {
                if (property.isValid(cell) && property.value(cell) > threshold) {
                    if (!arrived[cell] || elapsed < years[cell]) {
                        years[cell] = elapsed;
                        arrived[cell] = true;
                    }
                }
            }
        }
        return new PropertyValues(PROPERTY_NAME, years, arrived);
    }

}
