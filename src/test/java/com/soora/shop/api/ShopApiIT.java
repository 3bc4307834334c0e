package com.soora.shop.api;

import com.jayway.jsonpath.JsonPath;
import com.soora.shop.domain.model.Address;
import com.soora.shop.domain.model.Product;
import com.soora.shop.domain.model.User;
import com.soora.shop.repository.AddressRepository;
import com.soora.shop.repository.CategoryRepository;
import com.soora.shop.repository.OrderRepository;
import com.soora.shop.repository.ProductRepository;
import com.soora.shop.repository.ReviewRepository;
import com.soora.shop.repository.UserRepository;
import com.soora.shop.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests against the in-memory database.
 * Not transactional: the dashboard reads on executor threads and must see committed rows.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Shop API Integration Tests")
class ShopApiIT {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private AddressRepository addressRepository;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private ReviewRepository reviewRepository;

    @Autowired
    private CategoryRepository categoryRepository;

    private User shopper;
    private User otherShopper;
    private User admin;
    private Product scarf;
    private Product tote;
    private Product watch;
    private Address home;

    @BeforeEach
    void setUp() {
        orderRepository.deleteAll();
        reviewRepository.deleteAll();
        addressRepository.deleteAll();
        productRepository.deleteAll();
        categoryRepository.deleteAll();
        userRepository.deleteAll();

        shopper = userRepository.save(TestDataBuilder.aUser().name("Mei Tan").build());
        otherShopper = userRepository.save(TestDataBuilder.aUser().name("Raj Kumar").build());
        admin = userRepository.save(TestDataBuilder.aUser().name("Store Admin").role(User.Role.ADMIN).build());

        scarf = productRepository.save(TestDataBuilder.aProduct().name("Cotton Scarf")
                .description("Soft cotton").price(new BigDecimal("12.50")).stock(3).build());
        tote = productRepository.save(TestDataBuilder.aProduct().name("Canvas Tote")
                .description("Sturdy canvas").price(new BigDecimal("60.00")).stock(10).build());
        watch = productRepository.save(TestDataBuilder.aProduct().name("Steel Watch")
                .description("Quartz").price(new BigDecimal("30.00")).category("Watches").build());
        productRepository.save(TestDataBuilder.aProduct().name("Retired Scarf")
                .description("Old stock").price(new BigDecimal("20.00")).isActive(false).build());

        home = addressRepository.save(TestDataBuilder.anAddress(shopper.getId()).isDefault(true).build());
    }

    private String placeOrderBody(String productId, int quantity) {
        return "{ \"items\": [ { \"productId\": \"" + productId + "\", \"quantity\": " + quantity + " } ] }";
    }

    // ========================================
    // Public endpoints
    // ========================================

    @Test
    @DisplayName("GET /health - Reports service status")
    void health_ReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.message").value("Soora API is running"))
                .andExpect(jsonPath("$.region").value("Singapore"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Unknown route - Returns 404 JSON")
    void unknownRoute_Returns404() throws Exception {
        mockMvc.perform(get("/no/such/route"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Route not found"));
    }

    @Test
    @DisplayName("GET /api/products - Price range and category only return active matches")
    void listProducts_Filters() throws Exception {
        mockMvc.perform(get("/api/products")
                        .param("category", "Accessories")
                        .param("minPrice", "10")
                        .param("maxPrice", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.products[*].id", contains(scarf.getId())))
                .andExpect(jsonPath("$.pagination.total").value(1));
    }

    @Test
    @DisplayName("GET /api/products/{id} - Each read counts one view")
    void getProduct_CountsViews() throws Exception {
        mockMvc.perform(get("/api/products/{productId}", watch.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.viewCount").value(0));

        mockMvc.perform(get("/api/products/{productId}", watch.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.viewCount").value(1));

        assertThat(productRepository.findById(watch.getId()).orElseThrow().getViewCount()).isEqualTo(2);
    }

    // ========================================
    // Orders
    // ========================================

    @Test
    @DisplayName("POST /api/orders - Places an order against the default address and takes stock")
    void placeOrder_TakesStock() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("X-User-Id", shopper.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(placeOrderBody(scarf.getId(), 2)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.subtotal").value(25.00))
                .andExpect(jsonPath("$.deliveryFee").value(5.00))
                .andExpect(jsonPath("$.total").value(30.00))
                .andExpect(jsonPath("$.shippingAddress.street").value(home.getStreet()));

        Product after = productRepository.findById(scarf.getId()).orElseThrow();
        assertThat(after.getStock()).isEqualTo(1);
        assertThat(after.getSalesCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("POST /api/orders - Subtotal at the threshold ships free")
    void placeOrder_FreeDelivery() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("X-User-Id", shopper.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(placeOrderBody(tote.getId(), 1)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.deliveryFee").value(0))
                .andExpect(jsonPath("$.total").value(60.00));
    }

    @Test
    @DisplayName("POST /api/orders - More than the stock returns 409 and leaves stock alone")
    void placeOrder_OutOfStock() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("X-User-Id", shopper.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(placeOrderBody(scarf.getId(), 4)))
                .andExpect(status().isConflict());

        assertThat(productRepository.findById(scarf.getId()).orElseThrow().getStock()).isEqualTo(3);
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    @DisplayName("POST /api/orders - Caller without a default address must name one")
    void placeOrder_NoDefaultAddress() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header("X-User-Id", otherShopper.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(placeOrderBody(scarf.getId(), 1)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("addressId"));
    }

    @Test
    @DisplayName("GET /api/orders/{id} - Other users get 404 for someone else's order")
    void getOrder_OwnerOnly() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/orders")
                        .header("X-User-Id", shopper.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(placeOrderBody(watch.getId(), 1)))
                .andExpect(status().isCreated())
                .andReturn();
        String orderId = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

        mockMvc.perform(get("/api/orders/{orderId}", orderId).header("X-User-Id", shopper.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)));

        mockMvc.perform(get("/api/orders/{orderId}", orderId).header("X-User-Id", otherShopper.getId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Order not found"));
    }

    // ========================================
    // Addresses
    // ========================================

    @Test
    @DisplayName("PUT /api/users/addresses/{id} - New default replaces the old one")
    void updateAddress_SingleDefault() throws Exception {
        Address office = addressRepository.save(TestDataBuilder.anAddress(shopper.getId()).name("Office").build());

        mockMvc.perform(put("/api/users/addresses/{addressId}", office.getId())
                        .header("X-User-Id", shopper.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"isDefault\": true }"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isDefault").value(true));

        assertThat(addressRepository.countByUserIdAndIsDefaultTrue(shopper.getId())).isEqualTo(1);
        assertThat(addressRepository.findById(home.getId()).orElseThrow().getIsDefault()).isFalse();
    }

    @Test
    @DisplayName("DELETE /api/users/addresses/{id} - Non-owner gets 404 and the address survives")
    void deleteAddress_NonOwner() throws Exception {
        mockMvc.perform(delete("/api/users/addresses/{addressId}", home.getId())
                        .header("X-User-Id", otherShopper.getId()))
                .andExpect(status().isNotFound());

        assertThat(addressRepository.existsById(home.getId())).isTrue();
    }

    // ========================================
    // Admin
    // ========================================

    @Test
    @DisplayName("Admin flow - Delivering an order stamps deliveredAt and counts as revenue")
    void admin_DeliverOrder_UpdatesStats() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/orders")
                        .header("X-User-Id", shopper.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(placeOrderBody(watch.getId(), 1)))
                .andExpect(status().isCreated())
                .andReturn();
        String orderId = JsonPath.read(created.getResponse().getContentAsString(), "$.id");

        mockMvc.perform(get("/api/admin/stats")
                        .header("X-User-Id", admin.getId())
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOrders").value(1))
                .andExpect(jsonPath("$.pendingOrders").value(1))
                .andExpect(jsonPath("$.totalRevenue").value(0))
                .andExpect(jsonPath("$.totalUsers").value(3));

        mockMvc.perform(put("/api/admin/orders/{orderId}/status", orderId)
                        .header("X-User-Id", admin.getId())
                        .header("X-User-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"status\": \"DELIVERED\" }"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deliveredAt").exists())
                .andExpect(jsonPath("$.user.name").value("Mei Tan"));

        mockMvc.perform(get("/api/admin/stats")
                        .header("X-User-Id", admin.getId())
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pendingOrders").value(0))
                .andExpect(jsonPath("$.totalRevenue").value(35.00));

        mockMvc.perform(get("/api/admin/reports/sales")
                        .header("X-User-Id", admin.getId())
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOrders").value(1))
                .andExpect(jsonPath("$.averageOrderValue").value(35.00));
    }

    @Test
    @DisplayName("Admin routes - Customers are refused")
    void admin_CustomerForbidden() throws Exception {
        mockMvc.perform(get("/api/admin/users").header("X-User-Id", shopper.getId()))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("DELETE /api/admin/products/{id} - Deactivated product leaves the catalog")
    void admin_DeactivateProduct() throws Exception {
        mockMvc.perform(delete("/api/admin/products/{productId}", watch.getId())
                        .header("X-User-Id", admin.getId())
                        .header("X-User-Role", "ADMIN"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/products").param("category", "Watches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.products", hasSize(0)));

        assertThat(productRepository.existsById(watch.getId())).isTrue();
    }
}
