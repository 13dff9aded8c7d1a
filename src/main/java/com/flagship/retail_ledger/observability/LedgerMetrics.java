package com.flagship.retail_ledger.observability;

import com.flagship.retail_ledger.ledger.exception.LedgerException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: counter tagged with operation and outcome
 *   (success, or the lower-cased error code of the failure)
 * - ledger.operation.latency: timer tagged with operation
 * - ledger.account_number.collisions: generated account numbers that were already taken
 */
@Component
public class LedgerMetrics {

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_ERROR = "error";

    private final MeterRegistry registry;
    private final Counter accountNumberCollisions;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.accountNumberCollisions = Counter.builder("ledger.account_number.collisions")
                .description("Generated account numbers that collided with an existing account")
                .register(registry);
    }

    /**
     * Runs an operation, counting its outcome and timing it. Exceptions are rethrown unchanged.
     */
    public <T> T record(String operation, Supplier<T> work) {
        long startNanos = System.nanoTime();
        try {
            T result = work.get();
            recordOutcome(operation, OUTCOME_SUCCESS);
            return result;
        } catch (LedgerException e) {
            recordOutcome(operation, e.getCode().name().toLowerCase(Locale.ROOT));
            throw e;
        } catch (RuntimeException e) {
            recordOutcome(operation, OUTCOME_ERROR);
            throw e;
        } finally {
            registry.timer("ledger.operation.latency", "operation", operation)
                    .record(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    public void recordAccountNumberCollision() {
        accountNumberCollisions.increment();
    }

    private void recordOutcome(String operation, String outcome) {
        registry.counter("ledger.operations",
                "operation", operation,
                "outcome", outcome
        ).increment();
    }
}
