package com.flagship.quota_ledger.plan;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single lookup point from plan identifier to allowance.
 *
 * Every caller gets the same fallback: an absent or unrecognised plan
 * identifier resolves to {@link Plan#FREE}.
 */
@Component
@Slf4j
public class PlanCatalog {

    public static final Plan DEFAULT_PLAN = Plan.FREE;

    private static final Map<String, Plan> PLANS_BY_ID = Arrays.stream(Plan.values())
        .collect(Collectors.toUnmodifiableMap(Plan::getId, Function.identity()));

    /**
     * Looks up a plan without applying the fallback.
     */
    public Optional<Plan> find(String planId) {
        if (planId == null || planId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(PLANS_BY_ID.get(planId.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Resolves a plan identifier, falling back to the free plan.
     */
    public Plan resolve(String planId) {
        return find(planId).orElseGet(() -> {
            if (planId != null && !planId.isBlank()) {
                log.warn("Unknown plan '{}', falling back to {}", planId, DEFAULT_PLAN.getId());
            }
            return DEFAULT_PLAN;
        });
    }
}
