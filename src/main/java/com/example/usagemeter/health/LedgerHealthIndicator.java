package com.example.usagemeter.health;

import com.example.usagemeter.config.UsageMeterProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks usage-ledger write outcomes. Metering failures never reach callers, so this is where
 * they become visible: after {@code failure-alert-threshold} consecutive failures the indicator
 * reports DOWN until the next successful write.
 */
@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(LedgerHealthIndicator.class);

    private final Counter failureCounter;
    private final Counter successCounter;
    private final int threshold;
    private final Clock clock;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();

    public LedgerHealthIndicator(MeterRegistry meterRegistry, UsageMeterProperties properties, Clock clock) {
        this.failureCounter = Counter.builder("usage.ledger.write.failures")
                .description("Usage events that could not be written to the ledger")
                .register(meterRegistry);
        this.successCounter = Counter.builder("usage.ledger.write.successes")
                .description("Usage events written to the ledger")
                .register(meterRegistry);
        this.threshold = Math.max(1, properties.getTracker().getFailureAlertThreshold());
        this.clock = clock;
    }

    public void recordSuccess() {
        successCounter.increment();
        int previous = consecutiveFailures.getAndSet(0);
        if (previous >= threshold) {
            log.info("Usage ledger writes recovered after {} consecutive failures", previous);
        }
    }

    public void recordFailure(Throwable cause) {
        failureCounter.increment();
        lastError.set(cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage());
        lastFailureAt.set(clock.instant());
        int failures = consecutiveFailures.incrementAndGet();
        if (failures == threshold) {
            log.error("Usage ledger unhealthy: {} consecutive write failures, last error: {}", failures, lastError.get());
        }
    }

    public boolean isHealthy() {
        return consecutiveFailures.get() < threshold;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    @Override
    public Health health() {
        Health.Builder builder = isHealthy() ? Health.up() : Health.down();
        builder.withDetail("consecutiveFailures", consecutiveFailures.get())
                .withDetail("threshold", threshold)
                .withDetail("totalFailures", (long) failureCounter.count())
                .withDetail("totalWrites", (long) successCounter.count());
        if (lastError.get() != null) {
            builder.withDetail("lastError", lastError.get())
                    .withDetail("lastFailureAt", String.valueOf(lastFailureAt.get()));
        }
        return builder.build();
    }
}
