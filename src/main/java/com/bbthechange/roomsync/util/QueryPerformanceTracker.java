package com.bbthechange.roomsync.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times DynamoDB queries and chat network calls.
 * Logs slow operations and records a Micrometer timer per operation and outcome.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);

    static final String QUERY_METRIC = "dynamodb.query.duration";
    static final String NETWORK_METRIC = "chat.network.call.duration";

    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;
    private static final long SLOW_NETWORK_CALL_THRESHOLD_MS = 2000L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Track a DynamoDB operation.
     *
     * @param operation operation name for logging/metrics
     * @param table     table being queried
     * @param query     the operation to execute
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> query) {
        return track(QUERY_METRIC, "table", table, operation, SLOW_QUERY_THRESHOLD_MS, query);
    }

    /**
     * Track one call to the chat network. Retries inside the call count towards the same sample.
     */
    public <T> T trackNetworkCall(String operation, Supplier<T> call) {
        return track(NETWORK_METRIC, "target", "homeserver", operation, SLOW_NETWORK_CALL_THRESHOLD_MS, call);
    }

    private <T> T track(String metric, String targetTag, String target, String operation,
                        long slowThresholdMs, Supplier<T> work) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = work.get();
            long duration = System.currentTimeMillis() - startTime;
            if (duration > slowThresholdMs) {
                logger.warn("Slow operation detected: metric={}, operation={}, {}={}, duration={}ms",
                    metric, operation, targetTag, target, duration);
            } else {
                logger.debug("Operation completed: metric={}, operation={}, duration={}ms",
                    metric, operation, duration);
            }
            return result;

        } catch (RuntimeException e) {
            outcome = "error";
            long duration = System.currentTimeMillis() - startTime;
            logger.debug("Operation failed: metric={}, operation={}, {}={}, duration={}ms, error={}",
                metric, operation, targetTag, target, duration, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder(metric)
                .tag("operation", operation)
                .tag(targetTag, target)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }
}
