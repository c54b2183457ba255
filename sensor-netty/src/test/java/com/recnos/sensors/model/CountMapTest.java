package com.recnos.sensors.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CountMapTest {

    @Test
    @DisplayName("Should add counts elementwise")
    void shouldAddElementwise() {
        CountMap sum = new CountMap(4, 0, 2).plus(new CountMap(1, 1, 0));

        assertThat(sum).isEqualTo(new CountMap(5, 1, 2));
        assertThat(sum.total()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should fill missing types with zero")
    void shouldFillMissingTypes() {
        CountMap counts = CountMap.of(Map.of(VehicleType.BUS, 7L));

        assertThat(counts.asMap())
                .containsEntry(VehicleType.CAR, 0L)
                .containsEntry(VehicleType.MOTORCYCLE, 0L)
                .containsEntry(VehicleType.BUS, 7L);
    }

    @Test
    @DisplayName("Should reject negative counts")
    void shouldRejectNegativeCounts() {
        assertThatThrownBy(() -> new CountMap(-1, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should resolve only exact lower-case labels")
    void shouldResolveExactLabels() {
        assertThat(VehicleType.fromLabel("motorcycle")).contains(VehicleType.MOTORCYCLE);
        assertThat(VehicleType.fromLabel("BUS")).isEmpty();
        assertThat(VehicleType.fromLabel(null)).isEmpty();
    }
}
