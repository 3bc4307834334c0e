package com.soora.shop.api.controller;

import com.soora.shop.api.dto.CategoryResponse;
import com.soora.shop.api.dto.PaginationResponse;
import com.soora.shop.api.dto.ProductDetailResponse;
import com.soora.shop.api.dto.ProductListResponse;
import com.soora.shop.api.dto.ProductResponse;
import com.soora.shop.api.exception.GlobalExceptionHandler;
import com.soora.shop.config.SecurityConfig;
import com.soora.shop.domain.model.Category;
import com.soora.shop.domain.model.Product;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.infrastructure.metrics.StoreMetricsService;
import com.soora.shop.service.ProductQuery;
import com.soora.shop.service.ProductService;
import com.soora.shop.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ProductController using MockMvc.
 * Catalog routes are public, so no identity headers are sent.
 */
@WebMvcTest(ProductController.class)
@ContextConfiguration(classes = {ProductController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("ProductController Tests")
class ProductControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProductService productService;

    @MockBean
    private StoreMetricsService metricsService;

    // ========================================
    // GET /api/products Tests
    // ========================================

    @Test
    @DisplayName("GET /api/products - Anonymous caller gets products and pagination")
    void listProducts_Anonymous_Returns200() throws Exception {
        // Given
        Product product = TestDataBuilder.aProduct().id("prod-1").name("Cotton Scarf")
                .price(new BigDecimal("18.00")).build();
        ProductListResponse response = new ProductListResponse(
                List.of(ProductResponse.fromEntity(product)),
                new PaginationResponse(1, 20, 1L, 1));
        when(productService.listProducts(any(ProductQuery.class))).thenReturn(response);

        // When / Then
        mockMvc.perform(get("/api/products")
                        .param("category", "Accessories")
                        .param("minPrice", "10")
                        .param("maxPrice", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.products", hasSize(1)))
                .andExpect(jsonPath("$.products[0].id").value("prod-1"))
                .andExpect(jsonPath("$.products[0].price").value(18.00))
                .andExpect(jsonPath("$.pagination.page").value(1))
                .andExpect(jsonPath("$.pagination.total").value(1))
                .andExpect(jsonPath("$.pagination.pages").value(1));

        ArgumentCaptor<ProductQuery> captor = ArgumentCaptor.forClass(ProductQuery.class);
        verify(productService).listProducts(captor.capture());
        assertThat(captor.getValue().getCategory()).isEqualTo("Accessories");
        assertThat(captor.getValue().getMinPrice()).isEqualByComparingTo("10");
        assertThat(captor.getValue().getMaxPrice()).isEqualByComparingTo("50");
    }

    @Test
    @DisplayName("GET /api/products - Limit above 100 returns 400 with the field")
    void listProducts_LimitTooLarge_Returns400() throws Exception {
        mockMvc.perform(get("/api/products").param("limit", "500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"))
                .andExpect(jsonPath("$.errors[0].field").value("limit"));

        verifyNoInteractions(productService);
    }

    @Test
    @DisplayName("GET /api/products - Sort field outside the allow-list returns 400")
    void listProducts_UnknownSortField_Returns400() throws Exception {
        mockMvc.perform(get("/api/products").param("sortBy", "passwordHash"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("sortBy"));
    }

    @Test
    @DisplayName("GET /api/products - Non-numeric page returns 400")
    void listProducts_NonNumericPage_Returns400() throws Exception {
        mockMvc.perform(get("/api/products").param("page", "two"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("page"));
    }

    @Test
    @DisplayName("GET /api/products - Page far past the last reachable offset returns 400")
    void listProducts_PageBeyondOffsetRange_Returns400() throws Exception {
        mockMvc.perform(get("/api/products").param("page", "30000000").param("limit", "100"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("page"));

        verifyNoInteractions(productService);
    }

    @Test
    @DisplayName("GET /api/products - Unparseable price returns 400")
    void listProducts_BadPrice_Returns400() throws Exception {
        mockMvc.perform(get("/api/products").param("minPrice", "cheap"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("minPrice"));
    }

    // ========================================
    // GET /api/products/{productId} Tests
    // ========================================

    @Test
    @DisplayName("GET /api/products/{id} - Existing product returns detail with reviews")
    void getProduct_Exists_Returns200() throws Exception {
        // Given
        Product product = TestDataBuilder.aProduct().id("prod-1").viewCount(4).build();
        when(productService.getProductDetail("prod-1"))
                .thenReturn(ProductDetailResponse.fromEntity(product, List.of()));

        // When / Then
        mockMvc.perform(get("/api/products/{productId}", "prod-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("prod-1"))
                .andExpect(jsonPath("$.viewCount").value(4))
                .andExpect(jsonPath("$.reviews", hasSize(0)));
    }

    @Test
    @DisplayName("GET /api/products/{id} - Missing product returns 404")
    void getProduct_Missing_Returns404() throws Exception {
        when(productService.getProductDetail("nope")).thenThrow(new ResourceNotFoundException("Product", "nope"));

        mockMvc.perform(get("/api/products/{productId}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.error").value("Product not found"))
                .andExpect(jsonPath("$.path").value("/api/products/nope"));
    }

    // ========================================
    // Featured / categories Tests
    // ========================================

    @Test
    @DisplayName("GET /api/products/featured/list - Routed to featured, not to a product lookup")
    void getFeatured_Returns200() throws Exception {
        Product product = TestDataBuilder.aProduct().id("prod-9").isFeatured(true).build();
        when(productService.getFeaturedProducts()).thenReturn(List.of(ProductResponse.fromEntity(product)));

        mockMvc.perform(get("/api/products/featured/list"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].isFeatured").value(true));

        verify(productService, never()).getProductDetail(anyString());
    }

    @Test
    @DisplayName("GET /api/products/categories/list - Returns active categories")
    void getCategories_Returns200() throws Exception {
        Category category = TestDataBuilder.aCategory("Accessories", 1).id("cat-1").build();
        when(productService.getActiveCategories()).thenReturn(List.of(CategoryResponse.fromEntity(category)));

        mockMvc.perform(get("/api/products/categories/list"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Accessories"));
    }

    @Test
    @DisplayName("POST /api/products - Write methods on the catalog need authentication")
    void postProducts_Anonymous_Returns401() throws Exception {
        mockMvc.perform(post("/api/products"))
                .andExpect(status().isUnauthorized());
    }
}
