package com.soora.shop.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Delivery address owned by exactly one user.
 * At most one address per user has {@code isDefault = true}; AddressService keeps that
 * invariant by locking the owning user row before moving the flag.
 *
 * @author Soora Platform Team
 */
@Entity
@Table(name = "addresses", indexes = {
    @Index(name = "idx_addresses_user_id", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Address {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    /**
     * Owning user. Compared against the caller on every mutation.
     */
    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private AddressType type;

    /**
     * Display label, e.g. "Home" or "Mum's place".
     */
    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "street", nullable = false, length = 255)
    private String street;

    @Column(name = "unit", length = 20)
    private String unit;

    @Column(name = "building", length = 100)
    private String building;

    @Column(name = "postal_code", nullable = false, length = 10)
    private String postalCode;

    @Column(name = "district", nullable = false, length = 100)
    private String district;

    @Column(name = "is_default", nullable = false)
    @Builder.Default
    private Boolean isDefault = false;

    @Column(name = "delivery_notes", length = 500)
    private String deliveryNotes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (isDefault == null) {
            isDefault = false;
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public enum AddressType {
        HOME,
        WORK,
        OTHER
    }
}
