package com.recnos.sensors.service;

import com.recnos.sensors.model.CountMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AggregatorRegistryTest {

    @Test
    @DisplayName("Should return the same aggregator for the same location")
    void shouldReturnSameAggregator() {
        AggregatorRegistry registry = new AggregatorRegistry();

        LocationAggregator first = registry.getOrCreate("montlake-cut");
        LocationAggregator second = registry.getOrCreate("montlake-cut");

        assertThat(second).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should list locations in name order")
    void shouldListLocationsSorted() {
        AggregatorRegistry registry = new AggregatorRegistry();
        registry.getOrCreate("west-seattle-bridge");
        registry.getOrCreate("ballard-bridge");
        registry.getOrCreate("montlake-cut");

        assertThat(registry.listLocations())
                .containsExactly("ballard-bridge", "montlake-cut", "west-seattle-bridge");
    }

    @Test
    @DisplayName("Should return a handle list that later registrations do not change")
    void shouldSnapshotHandles() {
        // Given
        AggregatorRegistry registry = new AggregatorRegistry();
        registry.getOrCreate("A");
        List<LocationAggregator> handles = registry.allAggregators();
        Set<String> names = registry.listLocations();

        // When
        registry.getOrCreate("B");

        // Then
        assertThat(handles).extracting(LocationAggregator::location).containsExactly("A");
        assertThat(names).containsExactly("A");
        assertThat(registry.allAggregators()).hasSize(2);
    }

    @Test
    @DisplayName("Should create exactly one aggregator under concurrent first batches")
    void shouldCreateExactlyOneAggregatorConcurrently() throws Exception {
        // Given
        AtomicInteger created = new AtomicInteger();
        AggregatorRegistry registry = new AggregatorRegistry(name -> {
            created.incrementAndGet();
            return new LocationAggregator(name);
        });
        int callers = 32;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<LocationAggregator>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < callers; i++) {
            futures.add(executor.submit(() -> {
                startGate.await();
                LocationAggregator aggregator = registry.getOrCreate("new-location");
                aggregator.applyBatch(new CountMap(1, 0, 0));
                return aggregator;
            }));
        }
        startGate.countDown();

        List<LocationAggregator> handles = new ArrayList<>();
        for (Future<LocationAggregator> future : futures) {
            handles.add(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // Then
        assertThat(created).hasValue(1);
        assertThat(handles).allSatisfy(handle -> assertThat(handle).isSameAs(handles.get(0)));
        assertThat(registry.getOrCreate("new-location").snapshot()).isEqualTo(new CountMap(callers, 0, 0));
    }
}
