package com.soora.shop.api.controller;

import com.soora.shop.api.dto.DashboardStatsResponse;
import com.soora.shop.api.dto.MessageResponse;
import com.soora.shop.api.dto.OrderListResponse;
import com.soora.shop.api.dto.OrderResponse;
import com.soora.shop.api.dto.OrderStatusUpdateRequest;
import com.soora.shop.api.dto.ProductCreateRequest;
import com.soora.shop.api.dto.ProductListResponse;
import com.soora.shop.api.dto.ProductResponse;
import com.soora.shop.api.dto.ProductUpdateRequest;
import com.soora.shop.api.dto.SalesReportResponse;
import com.soora.shop.api.dto.StockUpdateRequest;
import com.soora.shop.api.dto.TierUpdateRequest;
import com.soora.shop.api.dto.UserListResponse;
import com.soora.shop.api.dto.UserTierResponse;
import com.soora.shop.service.AdminOrderService;
import com.soora.shop.service.AdminProductService;
import com.soora.shop.service.PageQuery;
import com.soora.shop.service.ReportService;
import com.soora.shop.service.UserService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the admin console: catalog, orders, users and analytics.
 *
 * Authorization: ADMIN role only (enforced by the filter chain and again here).
 *
 * @author Soora Platform Team
 */
@RestController
@RequestMapping("/api/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final AdminProductService adminProductService;
    private final AdminOrderService adminOrderService;
    private final UserService userService;
    private final ReportService reportService;

    public AdminController(
            AdminProductService adminProductService,
            AdminOrderService adminOrderService,
            UserService userService,
            ReportService reportService
    ) {
        this.adminProductService = adminProductService;
        this.adminOrderService = adminOrderService;
        this.userService = userService;
        this.reportService = reportService;
    }

    // ===== Products =====

    @GetMapping("/products")
    public ResponseEntity<ProductListResponse> listProducts(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(adminProductService.listProducts(search, PageQuery.of(page, limit)));
    }

    @PostMapping("/products")
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody ProductCreateRequest request) {
        ProductResponse response = adminProductService.createProduct(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/products/{productId}")
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable String productId,
            @Valid @RequestBody ProductUpdateRequest request
    ) {
        return ResponseEntity.ok(adminProductService.updateProduct(productId, request));
    }

    @PutMapping("/products/{productId}/stock")
    public ResponseEntity<ProductResponse> updateStock(
            @PathVariable String productId,
            @Valid @RequestBody StockUpdateRequest request
    ) {
        return ResponseEntity.ok(adminProductService.updateStock(productId, request.getStock()));
    }

    /**
     * Soft delete a product.
     */
    @DeleteMapping("/products/{productId}")
    public ResponseEntity<MessageResponse> deactivateProduct(@PathVariable String productId) {
        adminProductService.deactivateProduct(productId);
        return ResponseEntity.ok(new MessageResponse("Product deactivated"));
    }

    // ===== Orders =====

    @GetMapping("/orders")
    public ResponseEntity<OrderListResponse> listOrders(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(adminOrderService.listOrders(status, PageQuery.of(page, limit)));
    }

    /**
     * Change an order's status. DELIVERED also stamps {@code deliveredAt}.
     */
    @PutMapping("/orders/{orderId}/status")
    public ResponseEntity<OrderResponse> updateOrderStatus(
            @PathVariable String orderId,
            @Valid @RequestBody OrderStatusUpdateRequest request
    ) {
        logger.info("Admin status change requested - order: {}, status: {}", orderId, request.getStatus());
        return ResponseEntity.ok(adminOrderService.updateStatus(orderId, request.getStatus()));
    }

    // ===== Users =====

    @GetMapping("/users")
    public ResponseEntity<UserListResponse> listUsers(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(userService.listUsers(PageQuery.of(page, limit)));
    }

    @PutMapping("/users/{userId}/tier")
    public ResponseEntity<UserTierResponse> updateTier(
            @PathVariable String userId,
            @Valid @RequestBody TierUpdateRequest request
    ) {
        return ResponseEntity.ok(userService.updateTier(userId, request.getTier()));
    }

    // ===== Analytics =====

    @GetMapping("/stats")
    public ResponseEntity<DashboardStatsResponse> getDashboardStats() {
        return ResponseEntity.ok(reportService.getDashboardStats());
    }

    /**
     * Sales report over DELIVERED and CONFIRMED orders.
     *
     * @param startDate ISO date or instant, inclusive
     * @param endDate ISO date or instant, inclusive (a date covers the whole day)
     * @return Report
     */
    @GetMapping("/reports/sales")
    public ResponseEntity<SalesReportResponse> getSalesReport(
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate
    ) {
        return ResponseEntity.ok(reportService.getSalesReport(startDate, endDate));
    }
}
