package com.conveyal.gridmaps.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

class LambdaCounterTest {

    private static final Logger LOG = LoggerFactory.getLogger(LambdaCounterTest.class);

    @Test
    void countsFromParallelStreams () {
        LambdaCounter counter = new LambdaCounter(LOG, 10_000, 1000, "Counted {} of {}");
        IntStream.range(0, 10_000).parallel().forEach(i -> counter.increment());
        counter.done();
        Assertions.assertEquals(10_000, counter.getCount());
    }

    @Test
    void frequencyMustBePositive () {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new LambdaCounter(LOG, 1, 0, "{} {}"));
    }

}
