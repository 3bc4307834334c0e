package com.soora.shop.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for changing a customer's loyalty tier.
 *
 * @author Soora Platform Team
 */
public class TierUpdateRequest {

    @NotBlank(message = "Tier is required")
    private String tier;

    public TierUpdateRequest() {
    }

    public TierUpdateRequest(String tier) {
        this.tier = tier;
    }

    public String getTier() {
        return tier;
    }

    public void setTier(String tier) {
        this.tier = tier;
    }
}
