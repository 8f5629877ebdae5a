package com.flagship.quota_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed settings under the {@code ledger} prefix.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
public class LedgerProperties {

    @Valid
    private final Auth auth = new Auth();

    @Valid
    private final TopUp topUp = new TopUp();

    @Valid
    private final Store store = new Store();

    private final Plans plans = new Plans();

    @Valid
    private final IdempotencyCache idempotencyCache = new IdempotencyCache();

    @Getter
    @Setter
    public static class Auth {
        /**
         * Shared credential of the calling backend. The service refuses to start without it.
         */
        @NotBlank(message = "ledger.auth.service-token must be configured")
        private String serviceToken;

        /**
         * Header accepted as an alternative to {@code Authorization: Bearer}.
         */
        @NotBlank
        private String headerName = "X-Analytics-Token";
    }

    @Getter
    @Setter
    public static class TopUp {
        /**
         * Purchasable product id to the number of seconds it grants.
         */
        @NotNull
        private Map<String, Long> products = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Store {
        @Min(1)
        private int maxAttempts = 5;
    }

    @Getter
    @Setter
    public static class Plans {
        /**
         * When true, a plan hint on Fetch/Book that differs from the stored plan
         * replaces it and recomputes the subscription allowance.
         */
        private boolean syncOnRequest = true;
    }

    @Getter
    @Setter
    public static class IdempotencyCache {
        private boolean enabled = true;

        @NotNull
        private Duration ttl = Duration.ofDays(7);

        @NotBlank
        private String keyPrefix = "topup:credited:";
    }
}
