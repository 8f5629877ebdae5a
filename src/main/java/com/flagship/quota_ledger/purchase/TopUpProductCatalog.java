package com.flagship.quota_ledger.purchase;

import com.flagship.quota_ledger.config.LedgerProperties;
import com.flagship.quota_ledger.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Purchasable top-up products and the seconds each one grants.
 *
 * Credits are only accepted for an amount that matches a known product,
 * which filters out malformed or tampered calls.
 */
@Component
@Slf4j
public class TopUpProductCatalog {

    private final Map<String, Long> products;

    public TopUpProductCatalog(LedgerProperties properties) {
        this.products = Map.copyOf(properties.getTopUp().getProducts());
        if (products.isEmpty()) {
            log.warn("No top-up products configured, every credit will be rejected");
        }
    }

    /**
     * Resolves the product a credit is for.
     *
     * @param productId product named by the caller, may be null
     * @param seconds seconds the caller wants credited
     * @return the matching product id
     * @throws InvalidRequestException if no configured product grants that amount
     */
    public String resolveProduct(String productId, long seconds) {
        if (productId != null && !productId.isBlank()) {
            Long granted = products.get(productId);
            if (granted == null) {
                throw new InvalidRequestException("Unknown top-up product: " + productId);
            }
            if (granted != seconds) {
                throw new InvalidRequestException(String.format(
                    "Product %s grants %ds, not %ds", productId, granted, seconds));
            }
            return productId;
        }
        return findBySeconds(seconds)
            .orElseThrow(() -> new InvalidRequestException("Invalid seconds amount: " + seconds));
    }

    public Optional<String> findBySeconds(long seconds) {
        return products.entrySet().stream()
            .filter(product -> product.getValue() == seconds)
            .map(Map.Entry::getKey)
            .sorted()
            .findFirst();
    }
}
