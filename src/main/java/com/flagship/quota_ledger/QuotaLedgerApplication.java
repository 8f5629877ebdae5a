package com.flagship.quota_ledger;

import com.flagship.quota_ledger.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Usage quota ledger.
 *
 * Tracks per-user, per-month consumption of metered service time against a
 * plan allowance plus a purchased top-up balance that never expires.
 */
@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class QuotaLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotaLedgerApplication.class, args);
    }
}
