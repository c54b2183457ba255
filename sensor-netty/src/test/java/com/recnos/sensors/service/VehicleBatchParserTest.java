package com.recnos.sensors.service;

import com.recnos.sensors.model.CountMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for VehicleBatchParser.
 *
 * <p>The parser counts the three known labels and silently drops anything else,
 * so a batch never fails because of a label a sensor made up.</p>
 */
class VehicleBatchParserTest {

    private final VehicleBatchParser parser = new VehicleBatchParser();

    @Test
    @DisplayName("Should count each recognized vehicle label")
    void shouldCountRecognizedLabels() {
        // When
        CountMap counts = parser.parse(List.of("car", "motorcycle", "car", "car", "bus"));

        // Then
        assertThat(counts).isEqualTo(new CountMap(3, 1, 1));
    }

    @Test
    @DisplayName("Should drop unknown labels and still zero-fill known types")
    void shouldDropUnknownLabels() {
        // When
        CountMap counts = parser.parse(List.of("car", "unicycle"));

        // Then
        assertThat(counts).isEqualTo(new CountMap(1, 0, 0));
        assertThat(counts.toLabelMap()).containsOnly(
                entry("car", 1L),
                entry("motorcycle", 0L),
                entry("bus", 0L));
        assertThat(counts.toLabelMap().keySet()).containsExactly("car", "motorcycle", "bus");
    }

    @Test
    @DisplayName("Should return all zeros for an empty batch")
    void shouldReturnZerosForEmptyBatch() {
        assertThat(parser.parse(List.of())).isEqualTo(CountMap.EMPTY);
    }

    @Test
    @DisplayName("Should report how many labels were skipped")
    void shouldReportUnknownCount() {
        // Given - labels are case sensitive and null is not a vehicle
        List<String> labels = Arrays.asList("bus", "Car", null, "truck", "bus");

        // When
        VehicleBatchParser.Tally tally = parser.tally(labels);

        // Then
        assertThat(tally.counts()).isEqualTo(new CountMap(0, 0, 2));
        assertThat(tally.unknown()).isEqualTo(3);
    }
}
