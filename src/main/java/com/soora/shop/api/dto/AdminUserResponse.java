package com.soora.shop.api.dto;

import com.soora.shop.domain.model.CustomerTier;
import com.soora.shop.domain.model.User;

import java.time.Instant;

/**
 * User row as listed in the admin console, with the number of orders placed.
 *
 * @author Soora Platform Team
 */
public class AdminUserResponse {

    private String id;
    private String email;
    private String name;
    private String phone;
    private User.Role role;
    private CustomerTier tier;
    private Boolean isActive;
    private Instant createdAt;
    private Long orderCount;

    public AdminUserResponse() {
    }

    public static AdminUserResponse fromEntity(User user, long orderCount) {
        AdminUserResponse response = new AdminUserResponse();
        response.setId(user.getId());
        response.setEmail(user.getEmail());
        response.setName(user.getName());
        response.setPhone(user.getPhone());
        response.setRole(user.getRole());
        response.setTier(user.getTier());
        response.setIsActive(user.getIsActive());
        response.setCreatedAt(user.getCreatedAt());
        response.setOrderCount(orderCount);
        return response;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public User.Role getRole() {
        return role;
    }

    public void setRole(User.Role role) {
        this.role = role;
    }

    public CustomerTier getTier() {
        return tier;
    }

    public void setTier(CustomerTier tier) {
        this.tier = tier;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Long getOrderCount() {
        return orderCount;
    }

    public void setOrderCount(Long orderCount) {
        this.orderCount = orderCount;
    }
}
