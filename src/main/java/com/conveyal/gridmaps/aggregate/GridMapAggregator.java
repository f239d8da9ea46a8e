package com.conveyal.gridmaps.aggregate;

import com.conveyal.gridmaps.GridMapsConfig;
import com.conveyal.gridmaps.connect.Connections;
import com.conveyal.gridmaps.connect.SpatialConnector;
import com.conveyal.gridmaps.geometry.CornerPointGeometry;
import com.conveyal.gridmaps.geometry.Footprints;
import com.conveyal.gridmaps.map.MapAxes;
import com.conveyal.gridmaps.map.MapSpecification;
import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns per-cell properties of a corner-point grid into regular 2D maps.
 *
 * The footprint of every active cell is projected onto the map, each pixel is connected to the cells whose footprints
 * contain its center, and then for every filter and every property the values of the connected cells are reduced to
 * one value per pixel. The connections are computed once and shared by all the (filter, property) reductions, which
 * are independent of one another and run concurrently on a fixed thread pool.
 *
 * Nothing is retained between calls. The same inputs always produce the same output, bit for bit.
 */
public class GridMapAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(GridMapAggregator.class);

    public interface Config {
        /** Number of threads used to reduce (filter, property) pairs. With one thread they run on the caller. */
        int aggregationThreads ();
        /** How many cells to process between progress log messages. */
        int progressLogFrequency ();
    }

    private final Config config;

    public GridMapAggregator (Config config) {
        this.config = checkNotNull(config);
    }

    /** Use the default configuration shipped on the classpath. */
    public GridMapAggregator () {
        this(GridMapsConfig.fromDefaults());
    }

    /**
     * @param geometry corners and thickness of the active cells.
     * @param properties at least one property, each with one sample per active cell. Names must be unique.
     * @param filters named cell subsets to map separately, with unique names. An empty list maps all cells.
     * @param method how the values of all cells connected to a pixel are reduced.
     * @param weightByThickness weight MEAN and SUM by cell thickness. Not allowed for MAX and MIN.
     * @param mapSpecification the target map, explicit or derived from the grid.
     * @throws IllegalArgumentException for misaligned inputs or thickness weighting of MAX or MIN.
     * @throws UnsupportedOperationException for rotated maps.
     */
    public GridMapResult aggregate (
            CornerPointGeometry geometry,
            List<PropertyValues> properties,
            List<InclusionFilter> filters,
            AggregationMethod method,
            boolean weightByThickness,
            MapSpecification mapSpecification
    ) {
        checkNotNull(method, "Aggregation method must be specified.");
        checkNotNull(mapSpecification, "Map specification must be specified.");
        if (mapSpecification instanceof MapSpecification.Explicit
                && ((MapSpecification.Explicit) mapSpecification).isRotated()) {
            throw new UnsupportedOperationException("Rotated maps are not supported: " + mapSpecification);
        }
        checkArgument(!weightByThickness || method.supportsWeights(),
                "Weighting by thickness is not possible with the %s aggregation method.", method);
        checkArgument(!properties.isEmpty(), "At least one property is needed to make a map.");
        if (filters.isEmpty()) {
            filters = ImmutableList.of(InclusionFilter.all());
        }
        final int cellCount = geometry.cellCount();
        checkUniqueNames(properties, filters);
        for (PropertyValues property : properties) {
            checkArgument(property.size() == cellCount, "Property %s has %s samples for %s active cells.",
                    property.name, property.size(), cellCount);
        }
        for (InclusionFilter filter : filters) {
            filter.checkSize(cellCount);
        }

        // Cells that cannot appear on any map only cost time in the geometric search. A derived map then covers only
        // the cells that contribute. If no cell contributes at all, keep them all so a derived map still has extents.
        int[] keep = contributingCells(cellCount, properties, filters);
        if (keep.length > 0 && keep.length < cellCount) {
            LOG.info("Removing {} of {} cells that are invalid in every property or excluded by every filter.",
                    cellCount - keep.length, cellCount);
            geometry = geometry.subset(keep);
            properties = subsetProperties(properties, keep);
            filters = subsetFilters(filters, keep);
        }

        Footprints footprints = Footprints.fromGeometry(geometry);
        MapAxes axes = MapAxes.build(mapSpecification, footprints);
        Connections connections = SpatialConnector.connect(axes, footprints, config.progressLogFrequency());
        double[] weights = weightByThickness ? thickness(geometry) : null;
        PixelReducer reducer = new PixelReducer(connections, axes.columnCount(), axes.rowCount(), weights, method);

        List<Callable<AggregatedMap>> reductions = new ArrayList<>();
        for (InclusionFilter filter : filters) {
            for (PropertyValues property : properties) {
                reductions.add(() -> reducer.reduce(filter, property));
            }
        }
        LOG.info("Aggregating {} maps with method {}{}.", reductions.size(), method,
                weightByThickness ? " weighted by thickness" : "");
        List<AggregatedMap> flatMaps = runAll(reductions);

        List<String> filterNames = new ArrayList<>();
        List<String> propertyNames = new ArrayList<>();
        filters.forEach(f -> filterNames.add(f.name));
        properties.forEach(p -> propertyNames.add(p.name));
        List<List<AggregatedMap>> nested = new ArrayList<>();
        for (int f = 0; f < filters.size(); f++) {
            int from = f * properties.size();
            nested.add(flatMaps.subList(from, from + properties.size()));
        }
        return new GridMapResult(method, axes, filterNames, propertyNames, nested);
    }

    /**
     * Run the reductions, concurrently if more than one thread is configured, and return their results in the order
     * they were submitted. Any exception thrown by a reduction is rethrown here.
     */
    private List<AggregatedMap> runAll (List<Callable<AggregatedMap>> reductions) {
        int nThreads = Math.min(config.aggregationThreads(), reductions.size());
        List<AggregatedMap> results = new ArrayList<>(reductions.size());
        if (nThreads <= 1) {
            for (Callable<AggregatedMap> reduction : reductions) {
                results.add(callUnchecked(reduction));
            }
            return results;
        }
        ExecutorService executor = Executors.newFixedThreadPool(nThreads);
        try {
            List<Future<AggregatedMap>> futures = executor.invokeAll(reductions);
            for (Future<AggregatedMap> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while aggregating maps.", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new RuntimeException("Map aggregation failed.", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static AggregatedMap callUnchecked (Callable<AggregatedMap> reduction) {
        try {
            return reduction.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Map aggregation failed.", e);
        }
    }

    /**
     * Indexes of cells valid in at least one property and included by at least one filter, in ascending order.
     */
    private static int[] contributingCells (
            int cellCount, List<PropertyValues> properties, List<InclusionFilter> filters
    ) {
        boolean anyFilterIncludesAll = filters.stream().anyMatch(InclusionFilter::includesAll);
        TIntArrayList keep = new TIntArrayList(cellCount);
        for (int cell = 0; cell < cellCount; cell++) {
            boolean valid = false;
            for (PropertyValues property : properties) {
                if (property.isValid(cell)) {
                    valid = true;
                    break;
                }
            }
            boolean included = anyFilterIncludesAll;
            for (int f = 0; !included && f < filters.size(); f++) {
                included = filters.get(f).includes(cell);
            }
            if (valid && included) keep.add(cell);
        }
        return keep.toArray();
    }

    private static List<PropertyValues> subsetProperties (List<PropertyValues> properties, int[] cells) {
        List<PropertyValues> result = new ArrayList<>(properties.size());
        for (PropertyValues property : properties) result.add(property.subset(cells));
        return result;
    }

    private static List<InclusionFilter> subsetFilters (List<InclusionFilter> filters, int[] cells) {
        List<InclusionFilter> result = new ArrayList<>(filters.size());
        for (InclusionFilter filter : filters) result.add(filter.subset(cells));
        return result;
    }

    private static double[] thickness (CornerPointGeometry geometry) {
        double[] thickness = new double[geometry.cellCount()];
        for (int cell = 0; cell < thickness.length; cell++) thickness[cell] = geometry.thickness(cell);
        return thickness;
    }

    private static void checkUniqueNames (List<PropertyValues> properties, List<InclusionFilter> filters) {
        Set<String> names = new HashSet<>();
        for (PropertyValues property : properties) {
            checkArgument(names.add(property.name), "Duplicate property name %s.", property.name);
        }
        names.clear();
        for (InclusionFilter filter : filters) {
            checkArgument(names.add(filter.name), "Duplicate filter name %s.", filter.name);
        }
    }

}
