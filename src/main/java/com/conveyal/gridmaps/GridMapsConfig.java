package com.conveyal.gridmaps;

import com.conveyal.gridmaps.aggregate.GridMapAggregator;

import java.util.Map;
import java.util.Properties;

/** Loads config information for the aggregation engine and exposes it to the engine through its Config interface. */
public class GridMapsConfig extends ConfigBase implements GridMapAggregator.Config {

    /** Name of the properties file shipped on the classpath with the default settings. */
    public static final String DEFAULT_PROPERTIES_RESOURCE = "gridmaps.properties";

    // INSTANCE FIELDS

    private final int aggregationThreads;
    private final int progressLogFrequency;

    // CONSTRUCTORS

    private GridMapsConfig (Properties props) {
        super(props);
        aggregationThreads = intProp("aggregation-threads", 1);
        progressLogFrequency = intProp("progress-log-frequency", 1);
        throwIfErrors();
    }

    private GridMapsConfig (Properties props, Map<?, ?> environment, Map<?, ?> systemProperties) {
        super(props, environment, systemProperties);
        aggregationThreads = intProp("aggregation-threads", 1);
        progressLogFrequency = intProp("progress-log-frequency", 1);
        throwIfErrors();
    }

    public static GridMapsConfig fromDefaults () {
        return new GridMapsConfig(propsFromResource(DEFAULT_PROPERTIES_RESOURCE));
    }

    public static GridMapsConfig fromFile (String filename) {
        return new GridMapsConfig(propsFromFile(filename));
    }

    public static GridMapsConfig fromProperties (Properties properties) {
        return new GridMapsConfig(properties);
    }

    /** Only the supplied maps are consulted for overrides, not the real environment or JVM system properties. */
    public static GridMapsConfig fromProperties (
            Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties
    ) {
        return new GridMapsConfig(properties, environment, systemProperties);
    }

    // INTERFACE IMPLEMENTATIONS

    @Override public int aggregationThreads ()   { return aggregationThreads; }
    @Override public int progressLogFrequency () { return progressLogFrequency; }

}
