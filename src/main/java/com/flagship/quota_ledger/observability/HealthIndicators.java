package com.flagship.quota_ledger.observability;

import com.flagship.quota_ledger.purchase.CreditedTransactionCache;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators.
 */
public class HealthIndicators {

    /**
     * Redis backs only the credited-transaction fast path. Losing it
     * degrades latency of duplicate credits, never their correctness.
     */
    @Component("creditedCacheHealth")
    public static class CreditedCacheHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Duplicate credits are detected through the purchase journal";

        private final CreditedTransactionCache cache;

        public CreditedCacheHealthIndicator(CreditedTransactionCache cache) {
            this.cache = cache;
        }

        @Override
        public Health health() {
            if (!cache.isEnabled()) {
                return Health.up()
                    .withDetail("enabled", false)
                    .build();
            }
            try {
                if (cache.ping()) {
                    return Health.up()
                        .withDetail("enabled", true)
                        .build();
                }
                return Health.status("DEGRADED")
                    .withDetail("error", "No PONG from Redis")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
            }
        }
    }
}
