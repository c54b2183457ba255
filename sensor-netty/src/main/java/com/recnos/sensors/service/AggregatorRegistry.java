package com.recnos.sensors.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Process-wide map from location name to its {@link LocationAggregator}.
 *
 * Insert-only: aggregators are created lazily on first use and never removed.
 * Creation is atomic per key, so concurrent first batches for a new location
 * all land in the same aggregator.
 */
public class AggregatorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(AggregatorRegistry.class);

    private final ConcurrentMap<String, LocationAggregator> aggregators = new ConcurrentHashMap<>();
    private final Function<String, LocationAggregator> factory;

    public AggregatorRegistry() {
        this(LocationAggregator::new);
    }

    public AggregatorRegistry(Function<String, LocationAggregator> factory) {
        this.factory = factory;
    }

    public LocationAggregator getOrCreate(String location) {
        LocationAggregator existing = aggregators.get(location);
        if (existing != null) {
            return existing;
        }
        return aggregators.computeIfAbsent(location, name -> {
            logger.info("Registering aggregator for location '{}'", name);
            return factory.apply(name);
        });
    }

    /**
     * @return sorted copy of the known location names
     */
    public Set<String> listLocations() {
        return Collections.unmodifiableSet(new TreeSet<>(aggregators.keySet()));
    }

    /**
     * Copy of the current handles. Locations registered after this call are
     * not part of the returned list.
     */
    public List<LocationAggregator> allAggregators() {
        return List.copyOf(aggregators.values());
    }

    public int size() {
        return aggregators.size();
    }
}
