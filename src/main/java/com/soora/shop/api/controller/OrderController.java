package com.soora.shop.api.controller;

import com.soora.shop.api.dto.CreateOrderRequest;
import com.soora.shop.api.dto.OrderListResponse;
import com.soora.shop.api.dto.OrderResponse;
import com.soora.shop.infrastructure.metrics.StoreMetricsService;
import com.soora.shop.security.CallerContext;
import com.soora.shop.security.SecurityUtils;
import com.soora.shop.service.OrderService;
import com.soora.shop.service.PageQuery;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the caller's orders.
 *
 * Authorization: callers only ever see their own orders.
 *
 * @author Soora Platform Team
 */
@RestController
@RequestMapping("/api/orders")
@PreAuthorize("isAuthenticated()")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderService orderService;
    private final StoreMetricsService metricsService;

    public OrderController(OrderService orderService, StoreMetricsService metricsService) {
        this.orderService = orderService;
        this.metricsService = metricsService;
    }

    /**
     * Place an order.
     *
     * @param request Items, optional addressId (default address otherwise) and notes
     * @return Created order (201)
     */
    @PostMapping
    public ResponseEntity<OrderResponse> placeOrder(@Valid @RequestBody CreateOrderRequest request) {
        long startTime = System.currentTimeMillis();
        CallerContext caller = SecurityUtils.currentCaller();

        OrderResponse response = orderService.placeOrder(caller, request);

        metricsService.recordQueryLatency("placeOrder", System.currentTimeMillis() - startTime);
        logger.info("Order: {} placed by user: {}", response.getId(), caller.getUserId());

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<OrderListResponse> listOrders(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(orderService.listOrders(SecurityUtils.currentCaller(), PageQuery.of(page, limit)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId) {
        logger.debug("Fetching order: {}", orderId);
        return ResponseEntity.ok(orderService.getOrder(SecurityUtils.currentCaller(), orderId));
    }
}
