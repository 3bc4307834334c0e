package com.soora.shop.api.dto;

import com.soora.shop.domain.model.CustomerTier;
import com.soora.shop.domain.model.User;

/**
 * Result of a tier change.
 *
 * @author Soora Platform Team
 */
public class UserTierResponse {

    private String id;
    private String email;
    private String name;
    private CustomerTier tier;

    public UserTierResponse() {
    }

    public static UserTierResponse fromEntity(User user) {
        UserTierResponse response = new UserTierResponse();
        response.setId(user.getId());
        response.setEmail(user.getEmail());
        response.setName(user.getName());
        response.setTier(user.getTier());
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

    public CustomerTier getTier() {
        return tier;
    }

    public void setTier(CustomerTier tier) {
        this.tier = tier;
    }
}
