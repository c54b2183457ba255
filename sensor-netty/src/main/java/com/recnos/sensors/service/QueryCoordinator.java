package com.recnos.sensors.service;

import com.recnos.sensors.metrics.SensorMetrics;
import com.recnos.sensors.model.AggregatedReport;
import com.recnos.sensors.model.LocationCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Answers cross-location queries by asking every registered aggregator for a
 * snapshot concurrently and joining the replies under a deadline.
 *
 * Each call to {@link #collect()} runs its own short-lived fan-out, so
 * concurrent queries never share state. Ingestion is only ever held up for
 * the duration of a single aggregator's snapshot copy.
 */
public class QueryCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(QueryCoordinator.class);

    private final AggregatorRegistry registry;
    private final Executor executor;
    private final Duration timeout;
    private final SensorMetrics metrics;

    public QueryCoordinator(AggregatorRegistry registry, Executor executor, Duration timeout, SensorMetrics metrics) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.registry = registry;
        this.executor = executor;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Collects a report over every location known at the time of the call.
     * Never blocks longer than the configured timeout.
     *
     * @return a COMPLETE result with the full report, or a TIMED_OUT result
     *         naming the locations that did not reply in time
     */
    public QueryResult collect() {
        long start = System.nanoTime();
        QueryResult result = new FanOut(registry.allAggregators(), start).run();
        metrics.recordQuery(result.state().outcome(), result.elapsed().toNanos() / 1_000_000_000.0);
        return result;
    }

    /**
     * One query's worth of scatter/gather. Discarded once it reaches a terminal state.
     */
    private final class FanOut {

        private final List<LocationAggregator> targets;
        private final long startNanos;
        private final AtomicReference<QueryState> state = new AtomicReference<>(QueryState.COLLECTING);

        FanOut(List<LocationAggregator> targets, long startNanos) {
            this.targets = targets;
            this.startNanos = startNanos;
        }

        QueryResult run() {
            List<CompletableFuture<LocationCounts>> replies = new ArrayList<>(targets.size());
            for (LocationAggregator aggregator : targets) {
                replies.add(CompletableFuture.supplyAsync(
                        () -> LocationCounts.of(aggregator.location(), aggregator.snapshot()), executor));
            }

            try {
                CompletableFuture.allOf(replies.toArray(new CompletableFuture[0]))
                        .get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return timedOut(replies);
            } catch (ExecutionException e) {
                logger.error("Snapshot request failed during query", e.getCause());
                return timedOut(replies);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Query interrupted while waiting for {} location(s)", targets.size());
                return timedOut(replies);
            }

            transition(QueryState.COMPLETE);
            List<LocationCounts> entries = new ArrayList<>(replies.size());
            for (CompletableFuture<LocationCounts> reply : replies) {
                entries.add(reply.join());
            }
            QueryResult result = QueryResult.complete(AggregatedReport.of(entries), elapsed());
            logger.debug("Query complete: {}", result);
            return result;
        }

        private QueryResult timedOut(List<CompletableFuture<LocationCounts>> replies) {
            transition(QueryState.TIMED_OUT);
            List<String> missing = new ArrayList<>();
            for (int i = 0; i < replies.size(); i++) {
                CompletableFuture<LocationCounts> reply = replies.get(i);
                if (!reply.isDone() || reply.isCompletedExceptionally()) {
                    missing.add(targets.get(i).location());
                    reply.cancel(false);
                }
            }
            QueryResult result = QueryResult.timedOut(missing, elapsed());
            logger.warn("Query timed out after {} ms, no reply from {} of {} location(s): {}",
                    result.elapsed().toMillis(), missing.size(), targets.size(), result.missingLocations());
            return result;
        }

        private void transition(QueryState next) {
            if (!state.compareAndSet(QueryState.COLLECTING, next)) {
                throw new IllegalStateException("Query already " + state.get() + ", cannot move to " + next);
            }
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }
}
