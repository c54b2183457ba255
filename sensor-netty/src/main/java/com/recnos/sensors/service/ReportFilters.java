package com.recnos.sensors.service;

import com.recnos.sensors.model.AggregatedReport;
import com.recnos.sensors.model.LocationCounts;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stateless post-query filters over an {@link AggregatedReport}.
 */
public final class ReportFilters {

    private ReportFilters() {
    }

    /**
     * Keeps only the entry whose location equals {@code location}.
     */
    public static AggregatedReport filterByLocation(AggregatedReport report, String location) {
        List<LocationCounts> kept = report.entries().stream()
                .filter(entry -> entry.location().equals(location))
                .collect(Collectors.toList());
        return AggregatedReport.of(kept);
    }

    /**
     * Narrows every entry to the given vehicle label. Entries are kept even if
     * the label matches nothing and their data ends up empty.
     */
    public static AggregatedReport filterByVehicle(AggregatedReport report, String vehicle) {
        List<LocationCounts> narrowed = report.entries().stream()
                .map(entry -> {
                    Map<String, Long> data = new LinkedHashMap<>();
                    entry.data().forEach((label, count) -> {
                        if (label.equals(vehicle)) {
                            data.put(label, count);
                        }
                    });
                    return new LocationCounts(entry.location(), data);
                })
                .collect(Collectors.toList());
        return AggregatedReport.of(narrowed);
    }

    /**
     * Location filter first, then vehicle filter, each only when present.
     */
    public static AggregatedReport apply(AggregatedReport report, Optional<String> location, Optional<String> vehicle) {
        AggregatedReport result = report;
        if (location.isPresent()) {
            result = filterByLocation(result, location.get());
        }
        if (vehicle.isPresent()) {
            result = filterByVehicle(result, vehicle.get());
        }
        return result;
    }
}
