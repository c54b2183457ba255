package com.recnos.sensors.metrics;

import com.recnos.sensors.model.CountMap;
import com.recnos.sensors.model.VehicleType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Prometheus collectors for ingestion, queries and the HTTP gateway.
 *
 * Collectors are registered on the registry handed in, so tests can use a
 * private {@link CollectorRegistry} while the server uses the default one.
 */
public class SensorMetrics {

    private final CollectorRegistry registry;

    // Ingestion
    private final Counter batchesTotal;
    private final Counter vehiclesTotal;
    private final Counter unknownLabelsTotal;
    private final Gauge locations;

    // Queries
    private final Counter queriesTotal;
    private final Histogram queryDuration;

    // HTTP
    private final Counter httpRequestsTotal;

    public SensorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.batchesTotal = Counter.build()
                .name("sensor_batches_total")
                .help("Total number of sensor batches ingested")
                .register(registry);

        this.vehiclesTotal = Counter.build()
                .name("sensor_vehicles_total")
                .help("Total number of vehicles counted")
                .labelNames("type")
                .register(registry);

        this.unknownLabelsTotal = Counter.build()
                .name("sensor_unknown_labels_total")
                .help("Vehicle labels skipped because they were not recognized")
                .register(registry);

        this.locations = Gauge.build()
                .name("sensor_locations")
                .help("Number of locations with an aggregator")
                .register(registry);

        this.queriesTotal = Counter.build()
                .name("sensor_queries_total")
                .help("Total number of cross-location queries by outcome")
                .labelNames("outcome")
                .register(registry);

        this.queryDuration = Histogram.build()
                .name("sensor_query_duration_seconds")
                .help("Time spent collecting snapshots for a query")
                .buckets(0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 2.5, 5.0, 10.0)
                .register(registry);

        this.httpRequestsTotal = Counter.build()
                .name("http_requests_total")
                .help("Total number of HTTP requests")
                .labelNames("method", "endpoint", "status")
                .register(registry);
    }

    public void recordBatch(CountMap counts, int unknownLabels) {
        batchesTotal.inc();
        for (VehicleType type : VehicleType.values()) {
            long count = counts.get(type);
            if (count > 0) {
                vehiclesTotal.labels(type.label()).inc(count);
            }
        }
        if (unknownLabels > 0) {
            unknownLabelsTotal.inc(unknownLabels);
        }
    }

    public void updateLocations(int count) {
        locations.set(count);
    }

    public void recordQuery(String outcome, double durationSeconds) {
        queriesTotal.labels(outcome).inc();
        queryDuration.observe(durationSeconds);
    }

    public void recordHttpRequest(String method, String endpoint, int status) {
        httpRequestsTotal.labels(method, endpoint, String.valueOf(status)).inc();
    }

    /**
     * Renders every collector in the registry in Prometheus text format 0.0.4.
     */
    public String scrape() throws IOException {
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        return writer.toString();
    }
}
