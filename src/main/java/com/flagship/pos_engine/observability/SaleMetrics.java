package com.flagship.pos_engine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for sales and stock.
 *
 * Metrics exposed:
 * - pos.sell: Counter of sell calls, tagged by status
 * - pos.sell.latency: Timer for sell calls
 * - pos.stock.depleted: Counter of stock items deleted after selling out
 * - pos.stock.registered / pos.stock.restocked: Counters of stock changes
 * - pos.checkout: Counter of checkouts, tagged by policy and result
 */
@Component
public class SaleMetrics {

    private final MeterRegistry registry;

    private final Counter stockDepleted;
    private final Counter stockRegistered;
    private final Counter stockRestocked;

    public SaleMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.stockDepleted = Counter.builder("pos.stock.depleted")
                .description("Number of stock items removed because they sold out")
                .register(registry);

        this.stockRegistered = Counter.builder("pos.stock.registered")
                .description("Number of stock items registered")
                .register(registry);

        this.stockRestocked = Counter.builder("pos.stock.restocked")
                .description("Number of restock operations")
                .register(registry);
    }

    public void recordSell(String status) {
        registry.counter("pos.sell", "status", sanitizeTag(status)).increment();
    }

    public void recordSellLatency(long durationMs) {
        registry.timer("pos.sell.latency").record(Duration.ofMillis(durationMs));
    }

    public void recordCheckout(String policy, String result) {
        registry.counter("pos.checkout",
                "policy", sanitizeTag(policy),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void incrementStockDepleted() {
        stockDepleted.increment();
    }

    public void incrementStockRegistered() {
        stockRegistered.increment();
    }

    public void incrementStockRestocked() {
        stockRestocked.increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
