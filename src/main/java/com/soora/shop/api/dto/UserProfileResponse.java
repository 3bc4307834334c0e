package com.soora.shop.api.dto;

import com.soora.shop.domain.model.CustomerTier;
import com.soora.shop.domain.model.User;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Safe projection of the caller's own user row.
 *
 * @author Soora Platform Team
 */
public class UserProfileResponse {

    private String id;
    private String email;
    private String name;
    private String phone;
    private User.Role role;
    private CustomerTier tier;
    private LocalDate dateOfBirth;
    private Boolean ageVerified;
    private Boolean emailVerified;
    private Instant createdAt;

    public UserProfileResponse() {
    }

    public static UserProfileResponse fromEntity(User user) {
        UserProfileResponse response = new UserProfileResponse();
        response.setId(user.getId());
        response.setEmail(user.getEmail());
        response.setName(user.getName());
        response.setPhone(user.getPhone());
        response.setRole(user.getRole());
        response.setTier(user.getTier());
        response.setDateOfBirth(user.getDateOfBirth());
        response.setAgeVerified(user.getAgeVerified());
        response.setEmailVerified(user.getEmailVerified());
        response.setCreatedAt(user.getCreatedAt());
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

    public LocalDate getDateOfBirth() {
        return dateOfBirth;
    }

    public void setDateOfBirth(LocalDate dateOfBirth) {
        this.dateOfBirth = dateOfBirth;
    }

    public Boolean getAgeVerified() {
        return ageVerified;
    }

    public void setAgeVerified(Boolean ageVerified) {
        this.ageVerified = ageVerified;
    }

    public Boolean getEmailVerified() {
        return emailVerified;
    }

    public void setEmailVerified(Boolean emailVerified) {
        this.emailVerified = emailVerified;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
