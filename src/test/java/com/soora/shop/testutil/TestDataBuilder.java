package com.soora.shop.testutil;

import com.soora.shop.domain.model.Address;
import com.soora.shop.domain.model.Address.AddressType;
import com.soora.shop.domain.model.Category;
import com.soora.shop.domain.model.CustomerTier;
import com.soora.shop.domain.model.Order;
import com.soora.shop.domain.model.Order.OrderStatus;
import com.soora.shop.domain.model.OrderItem;
import com.soora.shop.domain.model.Product;
import com.soora.shop.domain.model.Review;
import com.soora.shop.domain.model.ShippingAddress;
import com.soora.shop.domain.model.User;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for test entities with sensible defaults.
 * Each method returns a Lombok builder so tests override only what they care about.
 */
public final class TestDataBuilder {

    private TestDataBuilder() {
    }

    public static User.UserBuilder aUser() {
        String id = UUID.randomUUID().toString();
        return User.builder()
                .email("shopper-" + id.substring(0, 8) + "@example.com")
                .name("Test Shopper")
                .phone("+65 91234567")
                .role(User.Role.CUSTOMER)
                .tier(CustomerTier.REGULAR);
    }

    public static Product.ProductBuilder aProduct() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return Product.builder()
                .name("Silk Scarf " + suffix)
                .slug("silk-scarf-" + suffix)
                .description("Hand-rolled silk scarf")
                .price(new BigDecimal("25.00"))
                .stock(50)
                .category("Accessories")
                .brand("Soora")
                .isActive(true)
                .isFeatured(false);
    }

    public static Category.CategoryBuilder aCategory(String name, int sortOrder) {
        return Category.builder()
                .name(name)
                .slug(name.toLowerCase())
                .sortOrder(sortOrder)
                .isActive(true);
    }

    public static Address.AddressBuilder anAddress(String userId) {
        return Address.builder()
                .userId(userId)
                .type(AddressType.HOME)
                .name("Home")
                .street("10 Orchard Road")
                .unit("#12-01")
                .building("Orchard Towers")
                .postalCode("238841")
                .district("Orchard")
                .isDefault(false);
    }

    public static Review.ReviewBuilder aReview(String productId, User user) {
        return Review.builder()
                .productId(productId)
                .user(user)
                .rating(5)
                .comment("Lovely quality")
                .isPublished(true);
    }

    /**
     * Order with a single line of {@code quantity} units of {@code product}.
     */
    public static Order anOrder(User user, Product product, int quantity, OrderStatus status) {
        BigDecimal subtotal = product.getPrice().multiply(BigDecimal.valueOf(quantity));
        Order order = Order.builder()
                .user(user)
                .status(status)
                .subtotal(subtotal)
                .deliveryFee(BigDecimal.ZERO)
                .total(subtotal)
                .shippingAddress(ShippingAddress.builder()
                        .label("Home")
                        .street("10 Orchard Road")
                        .postalCode("238841")
                        .district("Orchard")
                        .build())
                .build();
        order.addItem(OrderItem.builder()
                .product(product)
                .quantity(quantity)
                .price(product.getPrice())
                .build());
        return order;
    }

    /**
     * Same as {@link #anOrder} but with IDs and timestamps set, for tests that never persist.
     */
    public static Order aSavedOrder(User user, Product product, int quantity, OrderStatus status) {
        Order order = anOrder(user, product, quantity, status);
        order.setId(UUID.randomUUID().toString());
        order.setCreatedAt(Instant.now());
        order.setUpdatedAt(Instant.now());
        order.getItems().forEach(item -> item.setId(UUID.randomUUID().toString()));
        return order;
    }
}
