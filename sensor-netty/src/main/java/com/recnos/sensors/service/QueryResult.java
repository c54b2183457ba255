package com.recnos.sensors.service;

import com.recnos.sensors.model.AggregatedReport;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Terminal outcome of {@link QueryCoordinator#collect()}.
 *
 * A timed-out result carries no report at all, only the locations that did
 * not reply before the deadline.
 */
public final class QueryResult {

    private final QueryState state;
    private final AggregatedReport report;
    private final List<String> missingLocations;
    private final Duration elapsed;

    private QueryResult(QueryState state, AggregatedReport report, List<String> missingLocations, Duration elapsed) {
        this.state = state;
        this.report = report;
        this.missingLocations = missingLocations;
        this.elapsed = elapsed;
    }

    public static QueryResult complete(AggregatedReport report, Duration elapsed) {
        return new QueryResult(QueryState.COMPLETE, Objects.requireNonNull(report, "report"), List.of(), elapsed);
    }

    public static QueryResult timedOut(List<String> missingLocations, Duration elapsed) {
        return new QueryResult(QueryState.TIMED_OUT, null,
                missingLocations.stream().sorted().collect(Collectors.toUnmodifiableList()), elapsed);
    }

    public QueryState state() {
        return state;
    }

    public boolean isComplete() {
        return state == QueryState.COMPLETE;
    }

    /**
     * @throws IllegalStateException if the query timed out
     */
    public AggregatedReport report() {
        if (report == null) {
            throw new IllegalStateException("Query timed out waiting for " + missingLocations);
        }
        return report;
    }

    public List<String> missingLocations() {
        return missingLocations;
    }

    public Duration elapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "QueryResult{state=" + state + ", entries=" + (report == null ? 0 : report.size())
                + ", missing=" + missingLocations + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
