package com.soora.shop.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Customer order with its line items and a snapshot of the shipping address.
 *
 * @author Soora Platform Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user_id", columnList = "user_id"),
    @Index(name = "idx_orders_status", columnList = "status"),
    @Index(name = "idx_orders_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    /**
     * Statuses that count towards revenue in the dashboard and the sales report.
     */
    public static final Set<OrderStatus> REVENUE_STATUSES =
            EnumSet.of(OrderStatus.DELIVERED, OrderStatus.CONFIRMED);

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    /**
     * Purchaser.
     */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "subtotal", nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "delivery_fee", nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal deliveryFee = BigDecimal.ZERO;

    @Column(name = "total", nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    /**
     * Copy of the delivery address taken when the order was placed.
     * Later edits or deletion of the user's address book do not affect it.
     */
    @Embedded
    private ShippingAddress shippingAddress;

    @Column(name = "notes", length = 500)
    private String notes;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<OrderItem> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Set exactly when the status becomes DELIVERED.
     */
    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) {
            status = OrderStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Attach a line item to this order.
     *
     * @param item Line item
     */
    public void addItem(OrderItem item) {
        item.setOrder(this);
        items.add(item);
    }

    /**
     * Move the order to a new status.
     * DELIVERED stamps {@code deliveredAt}; every other status leaves it untouched.
     *
     * @param newStatus Target status
     */
    public void changeStatus(OrderStatus newStatus) {
        this.status = newStatus;
        if (newStatus == OrderStatus.DELIVERED) {
            this.deliveredAt = Instant.now();
        }
    }

    /**
     * Order status enum.
     */
    public enum OrderStatus {
        /**
         * Placed, awaiting confirmation.
         */
        PENDING,

        /**
         * Payment received and accepted by the store.
         */
        CONFIRMED,

        PROCESSING,

        SHIPPED,

        /**
         * Handed to the customer.
         */
        DELIVERED,

        CANCELLED
    }
}
