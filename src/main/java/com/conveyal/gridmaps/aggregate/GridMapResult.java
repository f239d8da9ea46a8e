package com.conveyal.gridmaps.aggregate;

import com.conveyal.gridmaps.map.MapAxes;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * All maps produced by one aggregation, with the pixel-center axes they share. Maps are nested first by filter and
 * then by property, in the order the filters and properties were supplied.
 */
public class GridMapResult {

    public final AggregationMethod method;

    private final MapAxes axes;

    public final List<String> filterNames;

    public final List<String> propertyNames;

    /** Outer index is the filter, inner index the property. */
    public final List<List<AggregatedMap>> maps;

    public GridMapResult (
            AggregationMethod method,
            MapAxes axes,
            List<String> filterNames,
            List<String> propertyNames,
            List<List<AggregatedMap>> maps
    ) {
        checkState(maps.size() == filterNames.size(), "Got maps for %s filters, expected %s.", maps.size(),
                filterNames.size());
        ImmutableList.Builder<List<AggregatedMap>> nested = ImmutableList.builder();
        for (int f = 0; f < maps.size(); f++) {
            List<AggregatedMap> filterMaps = maps.get(f);
            checkState(filterMaps.size() == propertyNames.size(), "Got %s maps for filter %s, expected %s.",
                    filterMaps.size(), filterNames.get(f), propertyNames.size());
            for (int p = 0; p < filterMaps.size(); p++) {
                AggregatedMap map = filterMaps.get(p);
                checkState(map.filterName.equals(filterNames.get(f)) && map.propertyName.equals(propertyNames.get(p)),
                        "Map %s is out of order at (%s, %s).", map, f, p);
                checkState(map.columnCount() == axes.columnCount() && map.rowCount() == axes.rowCount(),
                        "Map %s does not match the %sx%s pixel axes.", map, axes.columnCount(), axes.rowCount());
            }
            nested.add(ImmutableList.copyOf(filterMaps));
        }
        this.method = method;
        this.axes = axes;
        this.filterNames = ImmutableList.copyOf(filterNames);
        this.propertyNames = ImmutableList.copyOf(propertyNames);
        this.maps = nested.build();
    }

    /** Pixel-center x coordinates, ascending. */
    public double[] xAxis () {
        return axes.xAxis();
    }

    /** Pixel-center y coordinates, ascending. */
    public double[] yAxis () {
        return axes.yAxis();
    }

    public MapAxes axes () {
        return axes;
    }

    public AggregatedMap get (int filterIndex, int propertyIndex) {
        return maps.get(filterIndex).get(propertyIndex);
    }

    public AggregatedMap get (String filterName, String propertyName) {
        int f = filterNames.indexOf(filterName);
        int p = propertyNames.indexOf(propertyName);
        checkArgument(f >= 0, "No maps for filter %s.", filterName);
        checkArgument(p >= 0, "No maps for property %s.", propertyName);
        return get(f, p);
    }

    /**
     * The conventional name of a map, such as "all--max_sgas". Underscores in the property name are replaced with
     * double dashes, and the aggregation method tag may be left out.
     */
    public String mapName (AggregatedMap map, boolean includeMethod) {
        return mapName(map.filterName, method, map.propertyName, includeMethod);
    }

    public static String mapName (
            String filterName, AggregationMethod method, String propertyName, boolean includeMethod
    ) {
        String methodTag = includeMethod ? method.tag() + "_" : "";
        return filterName + "--" + methodTag + propertyName.replace("_", "--");
    }

}
