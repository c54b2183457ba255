package com.recnos.sensors.model;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cross-location query result, ordered by location name. Built fresh per query.
 */
public final class AggregatedReport {

    private final List<LocationCounts> entries;

    private AggregatedReport(List<LocationCounts> entries) {
        this.entries = entries;
    }

    public static AggregatedReport of(List<LocationCounts> entries) {
        return new AggregatedReport(entries.stream()
                .sorted(Comparator.comparing(LocationCounts::location))
                .collect(Collectors.toUnmodifiableList()));
    }

    public List<LocationCounts> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregatedReport)) return false;
        return entries.equals(((AggregatedReport) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "AggregatedReport{entries=" + entries + "}";
    }
}
