package com.recnos.sensors.metrics;

import com.recnos.sensors.model.CountMap;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SensorMetricsTest {

    private final CollectorRegistry registry = new CollectorRegistry();
    private final SensorMetrics metrics = new SensorMetrics(registry);

    @Test
    @DisplayName("Should count batches, vehicles per type and skipped labels")
    void shouldRecordBatch() {
        metrics.recordBatch(new CountMap(3, 0, 1), 2);
        metrics.recordBatch(new CountMap(1, 0, 0), 0);

        assertThat(registry.getSampleValue("sensor_batches_total")).isEqualTo(2.0);
        assertThat(registry.getSampleValue("sensor_vehicles_total",
                new String[]{"type"}, new String[]{"car"})).isEqualTo(4.0);
        assertThat(registry.getSampleValue("sensor_vehicles_total",
                new String[]{"type"}, new String[]{"bus"})).isEqualTo(1.0);
        assertThat(registry.getSampleValue("sensor_unknown_labels_total")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should render collectors in Prometheus text format")
    void shouldScrape() throws Exception {
        metrics.updateLocations(3);
        metrics.recordHttpRequest("GET", "/api/data", 200);

        String text = metrics.scrape();

        assertThat(text).contains("sensor_locations 3.0");
        assertThat(text).contains("http_requests_total{method=\"GET\",endpoint=\"/api/data\",status=\"200\",} 1.0");
    }
}
