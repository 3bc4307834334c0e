package com.soora.shop.service;

import com.soora.shop.api.dto.CreateOrderRequest;
import com.soora.shop.api.dto.OrderItemRequest;
import com.soora.shop.api.dto.OrderListResponse;
import com.soora.shop.api.dto.OrderResponse;
import com.soora.shop.domain.model.Address;
import com.soora.shop.domain.model.Order;
import com.soora.shop.domain.model.Order.OrderStatus;
import com.soora.shop.domain.model.Product;
import com.soora.shop.domain.model.User;
import com.soora.shop.exception.InvalidRequestException;
import com.soora.shop.exception.OutOfStockException;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.infrastructure.metrics.StoreMetricsService;
import com.soora.shop.repository.AddressRepository;
import com.soora.shop.repository.OrderRepository;
import com.soora.shop.repository.ProductRepository;
import com.soora.shop.repository.UserRepository;
import com.soora.shop.security.CallerContext;
import com.soora.shop.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OrderService.
 * Tests checkout (address resolution, stock, pricing) and order history access.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderService Unit Tests")
class OrderServiceTest {

    private static final BigDecimal DELIVERY_FEE = new BigDecimal("5.00");
    private static final BigDecimal FREE_DELIVERY_THRESHOLD = new BigDecimal("50.00");

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private AddressRepository addressRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private StoreMetricsService metricsService;

    private OrderService orderService;

    private CallerContext caller;
    private User user;
    private Address defaultAddress;
    private Product scarf;

    @BeforeEach
    void setUp() {
        orderService = new OrderService(orderRepository, productRepository, addressRepository,
                userRepository, metricsService, DELIVERY_FEE, FREE_DELIVERY_THRESHOLD);

        caller = CallerContext.customer("user-1");
        user = TestDataBuilder.aUser().id("user-1").build();
        defaultAddress = TestDataBuilder.anAddress("user-1").id("addr-1").isDefault(true).build();
        scarf = TestDataBuilder.aProduct().id("prod-1").price(new BigDecimal("12.50")).stock(10).build();
    }

    private static CreateOrderRequest orderOf(String productId, int quantity) {
        return new CreateOrderRequest(List.of(new OrderItemRequest(productId, quantity)), null, "Ring the bell");
    }

    @Nested
    @DisplayName("placeOrder()")
    class PlaceOrder {

        @BeforeEach
        void stubUser() {
            when(userRepository.findById("user-1")).thenReturn(Optional.of(user));
        }

        @Test
        @DisplayName("Success - Below threshold: charges delivery, decrements stock, snapshots default address")
        void placeOrder_BelowThreshold_ChargesDelivery() {
            // Given
            when(addressRepository.findFirstByUserIdAndIsDefaultTrue("user-1")).thenReturn(Optional.of(defaultAddress));
            when(productRepository.findByIdForUpdate("prod-1")).thenReturn(Optional.of(scarf));
            when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            OrderResponse result = orderService.placeOrder(caller, orderOf("prod-1", 2));

            // Then
            assertThat(result.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(result.getSubtotal()).isEqualByComparingTo("25.00");
            assertThat(result.getDeliveryFee()).isEqualByComparingTo("5.00");
            assertThat(result.getTotal()).isEqualByComparingTo("30.00");
            assertThat(result.getNotes()).isEqualTo("Ring the bell");
            assertThat(result.getItems()).hasSize(1);
            assertThat(result.getItems().get(0).getPrice()).isEqualByComparingTo("12.50");
            assertThat(result.getShippingAddress().getStreet()).isEqualTo("10 Orchard Road");
            assertThat(result.getShippingAddress().getPostalCode()).isEqualTo("238841");

            assertThat(scarf.getStock()).isEqualTo(8);
            assertThat(scarf.getSalesCount()).isEqualTo(2);

            verify(metricsService).recordOrderPlaced(1);
            verify(metricsService).recordRevenue(30.00);
        }

        @Test
        @DisplayName("Success - At threshold: delivery is free")
        void placeOrder_AtThreshold_FreeDelivery() {
            // Given
            when(addressRepository.findFirstByUserIdAndIsDefaultTrue("user-1")).thenReturn(Optional.of(defaultAddress));
            when(productRepository.findByIdForUpdate("prod-1")).thenReturn(Optional.of(scarf));
            when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            OrderResponse result = orderService.placeOrder(caller, orderOf("prod-1", 4));

            // Then
            assertThat(result.getSubtotal()).isEqualByComparingTo("50.00");
            assertThat(result.getDeliveryFee()).isEqualByComparingTo("0");
            assertThat(result.getTotal()).isEqualByComparingTo("50.00");
        }

        @Test
        @DisplayName("Success - Explicit address owned by the caller is used")
        void placeOrder_ExplicitAddress_Used() {
            // Given
            Address office = TestDataBuilder.anAddress("user-1").id("addr-2").street("1 Raffles Place").build();
            CreateOrderRequest request = new CreateOrderRequest(
                    List.of(new OrderItemRequest("prod-1", 1)), "addr-2", null);
            when(addressRepository.findById("addr-2")).thenReturn(Optional.of(office));
            when(productRepository.findByIdForUpdate("prod-1")).thenReturn(Optional.of(scarf));
            when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            OrderResponse result = orderService.placeOrder(caller, request);

            // Then
            assertThat(result.getShippingAddress().getStreet()).isEqualTo("1 Raffles Place");
            verify(addressRepository, never()).findFirstByUserIdAndIsDefaultTrue(anyString());
        }

        @Test
        @DisplayName("Failure - Insufficient stock: 409 path, nothing saved, rejection recorded")
        void placeOrder_InsufficientStock_Throws() {
            // Given
            when(addressRepository.findFirstByUserIdAndIsDefaultTrue("user-1")).thenReturn(Optional.of(defaultAddress));
            when(productRepository.findByIdForUpdate("prod-1")).thenReturn(Optional.of(scarf));

            // When / Then
            assertThatThrownBy(() -> orderService.placeOrder(caller, orderOf("prod-1", 11)))
                    .isInstanceOf(OutOfStockException.class)
                    .satisfies(ex -> {
                        OutOfStockException oos = (OutOfStockException) ex;
                        assertThat(oos.getRequestedQuantity()).isEqualTo(11);
                        assertThat(oos.getAvailableQuantity()).isEqualTo(10);
                    });

            assertThat(scarf.getStock()).isEqualTo(10);
            verify(metricsService).recordStockRejection("prod-1");
            verify(orderRepository, never()).save(any());
        }

        @Test
        @DisplayName("Failure - Inactive product answers 404")
        void placeOrder_InactiveProduct_NotFound() {
            // Given
            scarf.setIsActive(false);
            when(addressRepository.findFirstByUserIdAndIsDefaultTrue("user-1")).thenReturn(Optional.of(defaultAddress));
            when(productRepository.findByIdForUpdate("prod-1")).thenReturn(Optional.of(scarf));

            // When / Then
            assertThatThrownBy(() -> orderService.placeOrder(caller, orderOf("prod-1", 1)))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("Product not found");
            verify(orderRepository, never()).save(any());
        }

        @Test
        @DisplayName("Success - Products are locked in ID order regardless of line order")
        void placeOrder_LocksProductsInIdOrder() {
            // Given
            Product tote = TestDataBuilder.aProduct().id("prod-2").price(new BigDecimal("20.00")).stock(5).build();
            CreateOrderRequest request = new CreateOrderRequest(
                    List.of(new OrderItemRequest("prod-2", 1), new OrderItemRequest("prod-1", 1)), null, null);
            when(addressRepository.findFirstByUserIdAndIsDefaultTrue("user-1")).thenReturn(Optional.of(defaultAddress));
            when(productRepository.findByIdForUpdate("prod-1")).thenReturn(Optional.of(scarf));
            when(productRepository.findByIdForUpdate("prod-2")).thenReturn(Optional.of(tote));
            when(orderRepository.save(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

            // When
            OrderResponse result = orderService.placeOrder(caller, request);

            // Then
            InOrder locks = inOrder(productRepository);
            locks.verify(productRepository).findByIdForUpdate("prod-1");
            locks.verify(productRepository).findByIdForUpdate("prod-2");

            assertThat(result.getItems()).extracting(item -> item.getPrice().toPlainString())
                    .containsExactly("20.00", "12.50");
            assertThat(result.getSubtotal()).isEqualByComparingTo("32.50");
            assertThat(tote.getStock()).isEqualTo(4);
            assertThat(scarf.getStock()).isEqualTo(9);
        }

        @Test
        @DisplayName("Failure - Repeated lines for one product share its stock and lock it once")
        void placeOrder_RepeatedProductLines_ShareStock() {
            // Given
            CreateOrderRequest request = new CreateOrderRequest(
                    List.of(new OrderItemRequest("prod-1", 6), new OrderItemRequest("prod-1", 5)), null, null);
            when(addressRepository.findFirstByUserIdAndIsDefaultTrue("user-1")).thenReturn(Optional.of(defaultAddress));
            when(productRepository.findByIdForUpdate("prod-1")).thenReturn(Optional.of(scarf));

            // When / Then
            assertThatThrownBy(() -> orderService.placeOrder(caller, request))
                    .isInstanceOf(OutOfStockException.class)
                    .satisfies(ex -> assertThat(((OutOfStockException) ex).getAvailableQuantity()).isEqualTo(4));

            verify(productRepository, times(1)).findByIdForUpdate("prod-1");
            verify(orderRepository, never()).save(any());
        }

        @Test
        @DisplayName("Failure - No address given and no default: 400 on addressId")
        void placeOrder_NoDefaultAddress_InvalidRequest() {
            // Given
            when(addressRepository.findFirstByUserIdAndIsDefaultTrue("user-1")).thenReturn(Optional.empty());

            // When / Then
            assertThatThrownBy(() -> orderService.placeOrder(caller, orderOf("prod-1", 1)))
                    .isInstanceOf(InvalidRequestException.class)
                    .satisfies(ex -> assertThat(((InvalidRequestException) ex).getViolations())
                            .extracting(InvalidRequestException.FieldViolation::getField)
                            .containsExactly("addressId"));
            verifyNoInteractions(productRepository, orderRepository);
        }

        @Test
        @DisplayName("Failure - Another user's address answers 404")
        void placeOrder_ForeignAddress_NotFound() {
            // Given
            Address foreign = TestDataBuilder.anAddress("user-2").id("addr-9").build();
            CreateOrderRequest request = new CreateOrderRequest(
                    List.of(new OrderItemRequest("prod-1", 1)), "addr-9", null);
            when(addressRepository.findById("addr-9")).thenReturn(Optional.of(foreign));

            // When / Then
            assertThatThrownBy(() -> orderService.placeOrder(caller, request))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("Address not found");
            verifyNoInteractions(productRepository, orderRepository);
        }
    }

    @Test
    @DisplayName("placeOrder - Unknown caller answers 404")
    void placeOrder_UnknownUser_NotFound() {
        when(userRepository.findById("user-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orderService.placeOrder(caller, orderOf("prod-1", 1)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("User not found");
    }

    // ========================================
    // getOrder() / listOrders() Tests
    // ========================================

    @Test
    @DisplayName("getOrder - Owner sees the order")
    void getOrder_Owner_ReturnsOrder() {
        Order order = TestDataBuilder.aSavedOrder(user, scarf, 1, OrderStatus.PENDING);
        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));

        OrderResponse result = orderService.getOrder(caller, order.getId());

        assertThat(result.getId()).isEqualTo(order.getId());
        assertThat(result.getUser()).isNull();
    }

    @Test
    @DisplayName("getOrder - Another user's order answers 404")
    void getOrder_OtherUser_NotFound() {
        User other = TestDataBuilder.aUser().id("user-2").build();
        Order order = TestDataBuilder.aSavedOrder(other, scarf, 1, OrderStatus.PENDING);
        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.getOrder(caller, order.getId()))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Order not found");
    }

    @Test
    @DisplayName("listOrders - Returns the caller's page with pagination")
    void listOrders_ReturnsPage() {
        Order order = TestDataBuilder.aSavedOrder(user, scarf, 1, OrderStatus.CONFIRMED);
        PageQuery pageQuery = PageQuery.of(1, 10);
        when(orderRepository.findByUserIdOrderByCreatedAtDesc("user-1", PageRequest.of(0, 10)))
                .thenReturn(new PageImpl<>(List.of(order), PageRequest.of(0, 10), 1));

        OrderListResponse result = orderService.listOrders(caller, pageQuery);

        assertThat(result.getOrders()).extracting(OrderResponse::getId).containsExactly(order.getId());
        assertThat(result.getPagination().getTotal()).isEqualTo(1L);
        assertThat(result.getPagination().getPages()).isEqualTo(1);
    }
}
