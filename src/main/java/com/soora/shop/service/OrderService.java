package com.soora.shop.service;

import com.soora.shop.api.dto.CreateOrderRequest;
import com.soora.shop.api.dto.OrderItemRequest;
import com.soora.shop.api.dto.OrderListResponse;
import com.soora.shop.api.dto.OrderResponse;
import com.soora.shop.api.dto.PaginationResponse;
import com.soora.shop.domain.model.Address;
import com.soora.shop.domain.model.Order;
import com.soora.shop.domain.model.OrderItem;
import com.soora.shop.domain.model.Product;
import com.soora.shop.domain.model.ShippingAddress;
import com.soora.shop.domain.model.User;
import com.soora.shop.exception.InvalidRequestException;
import com.soora.shop.exception.OutOfStockException;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.infrastructure.metrics.StoreMetricsService;
import com.soora.shop.repository.AddressRepository;
import com.soora.shop.repository.OrderRepository;
import com.soora.shop.repository.ProductRepository;
import com.soora.shop.repository.UserRepository;
import com.soora.shop.security.AccessPolicy;
import com.soora.shop.security.CallerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Service for customer orders: checkout and order history.
 *
 * Checkout runs in one transaction:
 * 1. Resolve the shipping address (given or default) and snapshot it
 * 2. Lock the distinct products in ID order, check each is active and has stock
 * 3. Capture the unit price, decrement stock, add to sales count
 * 4. Compute subtotal, delivery fee and total
 * 5. Persist the order as PENDING
 *
 * @author Soora Platform Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final AddressRepository addressRepository;
    private final UserRepository userRepository;
    private final StoreMetricsService metricsService;
    private final BigDecimal deliveryFee;
    private final BigDecimal freeDeliveryThreshold;

    public OrderService(
            OrderRepository orderRepository,
            ProductRepository productRepository,
            AddressRepository addressRepository,
            UserRepository userRepository,
            StoreMetricsService metricsService,
            @Value("${app.orders.delivery-fee:5.00}") BigDecimal deliveryFee,
            @Value("${app.orders.free-delivery-threshold:50.00}") BigDecimal freeDeliveryThreshold
    ) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.addressRepository = addressRepository;
        this.userRepository = userRepository;
        this.metricsService = metricsService;
        this.deliveryFee = deliveryFee;
        this.freeDeliveryThreshold = freeDeliveryThreshold;
    }

    /**
     * Place an order for the caller.
     *
     * @param caller Current caller
     * @param request Items, optional address and notes
     * @return Created order
     * @throws ResourceNotFoundException if the user, address or a product does not exist
     * @throws InvalidRequestException if no address is given and the caller has no default
     * @throws OutOfStockException if a product has fewer units than requested
     */
    @Transactional
    public OrderResponse placeOrder(CallerContext caller, CreateOrderRequest request) {
        logger.info("Placing order for user: {} with {} items", caller.getUserId(), request.getItems().size());

        User user = userRepository.findById(caller.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("User", caller.getUserId()));

        Address address = resolveAddress(caller, request.getAddressId());

        Order order = Order.builder()
                .user(user)
                .status(Order.OrderStatus.PENDING)
                .shippingAddress(ShippingAddress.from(address))
                .notes(request.getNotes())
                .build();

        Map<String, Product> products = lockProducts(request.getItems());

        BigDecimal subtotal = BigDecimal.ZERO;
        for (OrderItemRequest line : request.getItems()) {
            Product product = products.get(line.getProductId());

            int quantity = line.getQuantity();
            if (!product.hasStockFor(quantity)) {
                logger.warn("Insufficient stock for product: {} - requested: {}, available: {}",
                        product.getId(), quantity, product.getStock());
                metricsService.recordStockRejection(product.getId());
                throw new OutOfStockException(product.getId(), quantity, product.getStock());
            }

            product.recordSale(quantity);

            OrderItem item = OrderItem.builder()
                    .product(product)
                    .quantity(quantity)
                    .price(product.getPrice())
                    .build();
            order.addItem(item);
            subtotal = subtotal.add(item.getLineTotal());
        }

        BigDecimal fee = deliveryFeeFor(subtotal);
        order.setSubtotal(subtotal);
        order.setDeliveryFee(fee);
        order.setTotal(subtotal.add(fee));

        Order saved = orderRepository.save(order);

        metricsService.recordOrderPlaced(saved.getItems().size());
        metricsService.recordRevenue(saved.getTotal().doubleValue());
        logger.info("Placed order: {} for user: {} - subtotal: {}, delivery fee: {}, total: {}",
                saved.getId(), caller.getUserId(), subtotal, fee, saved.getTotal());

        return OrderResponse.fromEntity(saved);
    }

    /**
     * List the caller's orders, newest first.
     */
    @Transactional(readOnly = true)
    public OrderListResponse listOrders(CallerContext caller, PageQuery pageQuery) {
        Page<Order> page = orderRepository.findByUserIdOrderByCreatedAtDesc(caller.getUserId(), pageQuery.toPageable());

        List<OrderResponse> orders = page.getContent().stream()
                .map(OrderResponse::fromEntity)
                .collect(Collectors.toList());

        logger.debug("Listed {} of {} orders for user: {}", orders.size(), page.getTotalElements(), caller.getUserId());
        return new OrderListResponse(orders, PaginationResponse.of(pageQuery, page.getTotalElements()));
    }

    /**
     * Get one of the caller's orders.
     *
     * @throws ResourceNotFoundException if the order is missing or placed by someone else
     */
    @Transactional(readOnly = true)
    public OrderResponse getOrder(CallerContext caller, String orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        AccessPolicy.requireOwner(caller, order.getUser().getId(), "Order", orderId);
        return OrderResponse.fromEntity(order);
    }

    /**
     * Lock every product the order touches. IDs are locked in sorted order so two checkouts
     * sharing products always acquire their locks in the same sequence.
     *
     * @throws ResourceNotFoundException if a product is missing or inactive
     */
    private Map<String, Product> lockProducts(List<OrderItemRequest> items) {
        Set<String> productIds = items.stream()
                .map(OrderItemRequest::getProductId)
                .collect(Collectors.toCollection(TreeSet::new));

        Map<String, Product> products = new HashMap<>();
        for (String productId : productIds) {
            Product product = productRepository.findByIdForUpdate(productId)
                    .filter(Product::getIsActive)
                    .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
            products.put(productId, product);
        }
        return products;
    }

    BigDecimal deliveryFeeFor(BigDecimal subtotal) {
        return subtotal.compareTo(freeDeliveryThreshold) >= 0 ? BigDecimal.ZERO : deliveryFee;
    }

    private Address resolveAddress(CallerContext caller, String addressId) {
        if (addressId == null || addressId.isBlank()) {
            return addressRepository.findFirstByUserIdAndIsDefaultTrue(caller.getUserId())
                    .orElseThrow(() -> new InvalidRequestException(
                            "addressId", "addressId is required when no default address is set"));
        }

        Address address = addressRepository.findById(addressId)
                .orElseThrow(() -> new ResourceNotFoundException("Address", addressId));
        AccessPolicy.requireOwner(caller, address);
        return address;
    }
}
