package com.soora.shop.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Business and latency metrics for the storefront, published through Micrometer.
 * Exported to CloudWatch when {@code cloud.aws.cloudwatch.enabled=true}, otherwise held by
 * the actuator's default registry.
 *
 * Key Metrics:
 * - Product views
 * - Orders placed and status transitions
 * - Revenue from placed orders
 * - Query latency for list and report endpoints
 * - Error rates
 *
 * @author Soora Platform Team
 */
@Service
public class StoreMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(StoreMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "soora.";
    private static final String PRODUCT_PREFIX = METRIC_PREFIX + "product.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";

    public StoreMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a single-product page view.
     */
    public void recordProductView() {
        Counter.builder(PRODUCT_PREFIX + "views")
                .description("Single product reads")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a placed order.
     *
     * @param itemCount Number of line items
     */
    public void recordOrderPlaced(int itemCount) {
        Counter.builder(ORDER_PREFIX + "placed")
                .description("Orders placed")
                .register(meterRegistry)
                .increment();
        Counter.builder(ORDER_PREFIX + "items")
                .description("Line items across placed orders")
                .register(meterRegistry)
                .increment(itemCount);
        logger.debug("Recorded order placed with {} items", itemCount);
    }

    /**
     * Record an order status change made by an administrator.
     *
     * @param status New status
     */
    public void recordOrderStatusChange(String status) {
        Counter.builder(ORDER_PREFIX + "status.changed")
                .tag("status", status)
                .description("Order status transitions")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded order status change to {}", status);
    }

    /**
     * Record revenue from a placed order.
     *
     * @param amount Order total
     */
    public void recordRevenue(double amount) {
        Counter.builder(METRIC_PREFIX + "revenue")
                .description("Order totals at placement")
                .register(meterRegistry)
                .increment(amount);
    }

    /**
     * Record stock rejected at checkout.
     *
     * @param productId Product ID
     */
    public void recordStockRejection(String productId) {
        Counter.builder(PRODUCT_PREFIX + "stock.rejected")
                .tag("product_id", productId)
                .description("Order lines rejected for insufficient stock")
                .register(meterRegistry)
                .increment();
        logger.info("Recorded stock rejection for product: {}", productId);
    }

    /**
     * Record database query latency.
     *
     * @param queryType Type of query (e.g., "listProducts", "salesReport")
     * @param durationMs Duration in milliseconds
     */
    public void recordQueryLatency(String queryType, long durationMs) {
        Timer.builder(METRIC_PREFIX + "query.latency")
                .tag("query_type", queryType)
                .description("Query latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
