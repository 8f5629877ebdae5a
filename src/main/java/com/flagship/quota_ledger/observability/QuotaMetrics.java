package com.flagship.quota_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for ledger operations.
 *
 * Metrics exposed:
 * - quota.bookings{outcome}: bookings by booked / quota_exceeded / invalid
 * - quota.booked.seconds{source}: seconds charged to topup or subscription
 * - quota.credits{outcome}: credits by credited / duplicate / invalid
 * - quota.records.created{carried_forward}: lazily created period records
 * - quota.store.conflicts{operation}: retried store conflicts
 * - quota.operation.latency{operation}: end to end latency per operation
 */
@Component
public class QuotaMetrics {

    private final MeterRegistry registry;
    private final Counter topupSecondsBooked;
    private final Counter subscriptionSecondsBooked;

    public QuotaMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.topupSecondsBooked = Counter.builder("quota.booked.seconds")
            .description("Seconds booked, by balance they were drawn from")
            .tag("source", "topup")
            .register(registry);
        this.subscriptionSecondsBooked = Counter.builder("quota.booked.seconds")
            .description("Seconds booked, by balance they were drawn from")
            .tag("source", "subscription")
            .register(registry);
    }

    public void recordBooking(String outcome) {
        registry.counter("quota.bookings", "outcome", outcome).increment();
    }

    public void recordBookedSeconds(long fromTopup, long fromSubscription) {
        topupSecondsBooked.increment(fromTopup);
        subscriptionSecondsBooked.increment(fromSubscription);
    }

    public void recordCredit(String outcome) {
        registry.counter("quota.credits", "outcome", outcome).increment();
    }

    public void recordRecordCreated(boolean carriedForward) {
        registry.counter("quota.records.created",
            "carried_forward", String.valueOf(carriedForward)).increment();
    }

    public void recordStoreConflict(String operation) {
        registry.counter("quota.store.conflicts", "operation", operation).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("quota.operation.latency", "operation", operation)
            .record(Duration.ofMillis(durationMs));
    }
}
