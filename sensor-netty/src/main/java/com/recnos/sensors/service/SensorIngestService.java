package com.recnos.sensors.service;

import com.recnos.sensors.metrics.SensorMetrics;
import com.recnos.sensors.model.CountMap;
import com.recnos.sensors.model.SensorBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingestion path: parse a batch and apply it to its location's aggregator.
 * Runs synchronously on the caller's thread and never waits on queries.
 */
public class SensorIngestService {

    private static final Logger logger = LoggerFactory.getLogger(SensorIngestService.class);

    private final AggregatorRegistry registry;
    private final VehicleBatchParser parser;
    private final SensorMetrics metrics;

    public SensorIngestService(AggregatorRegistry registry, VehicleBatchParser parser, SensorMetrics metrics) {
        this.registry = registry;
        this.parser = parser;
        this.metrics = metrics;
    }

    /**
     * @return the counts that were added to the location's totals
     */
    public CountMap ingest(SensorBatch batch) {
        VehicleBatchParser.Tally tally = parser.tally(batch.vehicles());

        LocationAggregator aggregator = registry.getOrCreate(batch.location());
        aggregator.applyBatch(tally.counts());

        metrics.recordBatch(tally.counts(), tally.unknown());
        metrics.updateLocations(registry.size());
        logger.debug("Applied {} to '{}'", tally.counts(), batch.location());
        return tally.counts();
    }
}
