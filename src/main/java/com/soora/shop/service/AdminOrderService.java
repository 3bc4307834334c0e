package com.soora.shop.service;

import com.soora.shop.api.dto.OrderListResponse;
import com.soora.shop.api.dto.OrderResponse;
import com.soora.shop.api.dto.PaginationResponse;
import com.soora.shop.domain.model.Order;
import com.soora.shop.domain.model.Order.OrderStatus;
import com.soora.shop.exception.InvalidRequestException;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.infrastructure.metrics.StoreMetricsService;
import com.soora.shop.repository.OrderRepository;
import com.soora.shop.repository.OrderSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Order management for administrators: listing across all users and status changes.
 *
 * @author Soora Platform Team
 */
@Service
public class AdminOrderService {

    private static final Logger logger = LoggerFactory.getLogger(AdminOrderService.class);

    private final OrderRepository orderRepository;
    private final StoreMetricsService metricsService;

    public AdminOrderService(OrderRepository orderRepository, StoreMetricsService metricsService) {
        this.orderRepository = orderRepository;
        this.metricsService = metricsService;
    }

    /**
     * List orders newest first, optionally restricted to one status.
     *
     * @param statusValue Status name, may be null or blank
     * @param pageQuery Page window
     * @return One page of orders with purchaser, items and shipping address
     * @throws InvalidRequestException if the status is unknown
     */
    @Transactional(readOnly = true)
    public OrderListResponse listOrders(String statusValue, PageQuery pageQuery) {
        long startTime = System.currentTimeMillis();

        OrderStatus status = statusValue == null || statusValue.isBlank() ? null : parseStatus(statusValue);
        Specification<Order> spec = Specification.where(OrderSpecifications.hasStatus(status));

        Page<Order> page = orderRepository.findAll(
                spec, pageQuery.toPageable(Sort.by(Sort.Direction.DESC, "createdAt")));

        List<OrderResponse> orders = page.getContent().stream()
                .map(OrderResponse::fromEntityWithPurchaser)
                .collect(Collectors.toList());

        metricsService.recordQueryLatency("adminListOrders", System.currentTimeMillis() - startTime);
        return new OrderListResponse(orders, PaginationResponse.of(pageQuery, page.getTotalElements()));
    }

    /**
     * Move an order to a new status. DELIVERED stamps the delivery time.
     *
     * @param orderId Order ID
     * @param statusValue New status name
     * @return Updated order
     * @throws InvalidRequestException if the status is unknown
     * @throws ResourceNotFoundException if the order does not exist
     */
    @Transactional
    public OrderResponse updateStatus(String orderId, String statusValue) {
        OrderStatus status = parseStatus(statusValue);

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));

        OrderStatus previous = order.getStatus();
        order.changeStatus(status);
        Order saved = orderRepository.save(order);

        metricsService.recordOrderStatusChange(status.name());
        logger.info("Order: {} moved from {} to {}", orderId, previous, status);

        return OrderResponse.fromEntityWithPurchaser(saved);
    }

    static OrderStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("status", "Status is required");
        }
        try {
            return OrderStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("status", "Unknown order status: " + value);
        }
    }
}
