package com.soora.shop.service;

import com.soora.shop.api.dto.DashboardStatsResponse;
import com.soora.shop.api.dto.OrderResponse;
import com.soora.shop.api.dto.SalesReportResponse;
import com.soora.shop.config.AsyncConfig;
import com.soora.shop.domain.model.Order;
import com.soora.shop.domain.model.Order.OrderStatus;
import com.soora.shop.exception.InvalidRequestException;
import com.soora.shop.infrastructure.metrics.StoreMetricsService;
import com.soora.shop.repository.OrderRepository;
import com.soora.shop.repository.OrderSpecifications;
import com.soora.shop.repository.ProductRepository;
import com.soora.shop.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Admin analytics: dashboard counters and the sales report.
 * Revenue always means the sum of totals over {@link Order#REVENUE_STATUSES}.
 *
 * @author Soora Platform Team
 */
@Service
public class ReportService {

    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final ProductRepository productRepository;
    private final StoreMetricsService metricsService;
    private final Executor queryExecutor;

    public ReportService(
            OrderRepository orderRepository,
            UserRepository userRepository,
            ProductRepository productRepository,
            StoreMetricsService metricsService,
            @Qualifier(AsyncConfig.QUERY_EXECUTOR) Executor queryExecutor
    ) {
        this.orderRepository = orderRepository;
        this.userRepository = userRepository;
        this.productRepository = productRepository;
        this.metricsService = metricsService;
        this.queryExecutor = queryExecutor;
    }

    /**
     * Compute the dashboard counters. The five queries are independent and run
     * concurrently on the query executor.
     *
     * @return Dashboard stats
     */
    public DashboardStatsResponse getDashboardStats() {
        long startTime = System.currentTimeMillis();

        CompletableFuture<Long> totalOrders =
                CompletableFuture.supplyAsync(orderRepository::count, queryExecutor);
        CompletableFuture<Long> pendingOrders =
                CompletableFuture.supplyAsync(() -> orderRepository.countByStatus(OrderStatus.PENDING), queryExecutor);
        CompletableFuture<BigDecimal> totalRevenue =
                CompletableFuture.supplyAsync(() -> orderRepository.sumTotalByStatusIn(Order.REVENUE_STATUSES), queryExecutor);
        CompletableFuture<Long> totalUsers =
                CompletableFuture.supplyAsync(userRepository::count, queryExecutor);
        CompletableFuture<Long> lowStockProducts =
                CompletableFuture.supplyAsync(productRepository::countLowStockProducts, queryExecutor);

        try {
            CompletableFuture.allOf(totalOrders, pendingOrders, totalRevenue, totalUsers, lowStockProducts).join();
        } catch (CompletionException e) {
            logger.error("Dashboard query failed", e.getCause());
            metricsService.recordError("DASHBOARD_QUERY_ERROR", "getDashboardStats");
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        BigDecimal revenue = totalRevenue.join();
        DashboardStatsResponse stats = new DashboardStatsResponse(
                totalOrders.join(),
                pendingOrders.join(),
                revenue != null ? revenue : BigDecimal.ZERO,
                totalUsers.join(),
                lowStockProducts.join()
        );

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordQueryLatency("dashboardStats", duration);
        logger.debug("Computed dashboard stats in {}ms", duration);
        return stats;
    }

    /**
     * Build the sales report over revenue-counting orders.
     * Each bound is optional and applied on its own. A date-only end bound covers
     * that whole day (UTC).
     *
     * @param startDate ISO date or instant, may be null
     * @param endDate ISO date or instant, may be null
     * @return Totals, average order value and the matching orders
     * @throws InvalidRequestException if a bound cannot be parsed or start is after end
     */
    @Transactional(readOnly = true)
    public SalesReportResponse getSalesReport(String startDate, String endDate) {
        long startTime = System.currentTimeMillis();

        Instant from = parseBound("startDate", startDate, false);
        Instant to = parseBound("endDate", endDate, true);
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidRequestException("startDate", "startDate must not be after endDate");
        }

        Specification<Order> spec = Specification.where(OrderSpecifications.statusIn(Order.REVENUE_STATUSES))
                .and(OrderSpecifications.createdAtOrAfter(from))
                .and(OrderSpecifications.createdAtOrBefore(to));

        List<Order> orders = orderRepository.findAll(spec);

        BigDecimal totalRevenue = orders.stream()
                .map(Order::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        int totalOrders = orders.size();

        List<OrderResponse> orderResponses = orders.stream()
                .map(OrderResponse::fromEntity)
                .collect(Collectors.toList());

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordQueryLatency("salesReport", duration);
        logger.debug("Sales report from {} to {}: {} orders, revenue {} ({}ms)",
                from, to, totalOrders, totalRevenue, duration);

        return new SalesReportResponse(
                totalRevenue,
                totalOrders,
                averageOrderValue(totalRevenue, totalOrders),
                orderResponses
        );
    }

    static BigDecimal averageOrderValue(BigDecimal totalRevenue, int totalOrders) {
        if (totalOrders == 0) {
            return BigDecimal.ZERO;
        }
        return totalRevenue.divide(BigDecimal.valueOf(totalOrders), 2, RoundingMode.HALF_UP);
    }

    /**
     * Parse {@code 2024-03-01} or {@code 2024-03-01T08:00:00Z}.
     * For an end bound a plain date means the last microsecond of that day.
     */
    static Instant parseBound(String field, String value, boolean endOfDay) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                LocalDate date = LocalDate.parse(trimmed);
                if (endOfDay) {
                    return date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minus(1, ChronoUnit.MICROS);
                }
                return date.atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(field, field + " must be an ISO date or timestamp");
        }
    }
}
