package com.recnos.sensors.service;

import com.recnos.sensors.model.CountMap;
import com.recnos.sensors.model.VehicleType;

/**
 * Cumulative vehicle counts for a single location.
 *
 * All reads and writes go through the instance monitor, so a batch is either
 * fully visible to a snapshot or not at all. Aggregators for different
 * locations share no lock.
 */
public class LocationAggregator {

    private final String location;

    private long cars;
    private long motorcycles;
    private long buses;
    private long batches;

    public LocationAggregator(String location) {
        this.location = location;
    }

    public String location() {
        return location;
    }

    /**
     * Adds a parsed batch to the running totals.
     */
    public synchronized void applyBatch(CountMap batch) {
        cars += batch.get(VehicleType.CAR);
        motorcycles += batch.get(VehicleType.MOTORCYCLE);
        buses += batch.get(VehicleType.BUS);
        batches++;
    }

    /**
     * @return an immutable copy of the totals as of this call
     */
    public synchronized CountMap snapshot() {
        return new CountMap(cars, motorcycles, buses);
    }

    public synchronized long batchesApplied() {
        return batches;
    }

    @Override
    public String toString() {
        return "LocationAggregator{location='" + location + "'}";
    }
}
